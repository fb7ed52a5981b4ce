package com.example.guardianservice.overhaul.progress;

import com.example.guardianservice.client.DiscordPlatformClient;
import com.example.guardianservice.client.MessageContent;
import com.example.guardianservice.exception.PermanentRemoteException;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps the status as one message in a channel: created on first publish, edited afterwards.
 * If someone deletes the message mid-run it is created again.
 */
@Slf4j
public class DiscordMessageProgressSink implements ProgressSink {

    private final DiscordPlatformClient client;
    private final long channelId;
    private Long messageId;

    public DiscordMessageProgressSink(DiscordPlatformClient client, long channelId) {
        this.client = client;
        this.channelId = channelId;
    }

    @Override
    public synchronized void publish(String text) {
        MessageContent content = MessageContent.text(text);
        if (messageId != null) {
            try {
                client.editMessage(channelId, messageId, content);
                return;
            } catch (PermanentRemoteException e) {
                if (!e.isUnknownResource()) {
                    throw e;
                }
                log.warn("Status message {} disappeared from channel {}, recreating", messageId, channelId);
            }
        }
        messageId = client.createMessage(channelId, content);
    }

    public synchronized Long getMessageId() {
        return messageId;
    }
}
