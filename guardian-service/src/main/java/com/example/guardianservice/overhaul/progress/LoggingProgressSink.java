package com.example.guardianservice.overhaul.progress;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes status updates to the log. Used when a run has no status channel.
 */
@Slf4j
public class LoggingProgressSink implements ProgressSink {

    @Override
    public void publish(String text) {
        log.info("Overhaul status:\n{}", text);
    }
}
