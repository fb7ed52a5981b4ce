package com.example.guardianservice.overhaul.progress;

/**
 * Destination of the single evolving status artifact of a run.
 * The first call creates the artifact; every later call replaces its content.
 */
@FunctionalInterface
public interface ProgressSink {

    void publish(String text);
}
