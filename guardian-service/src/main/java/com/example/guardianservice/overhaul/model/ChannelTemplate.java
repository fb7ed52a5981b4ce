package com.example.guardianservice.overhaul.model;

/**
 * @param minimumTierToPost tier level required to send messages, or {@code null} for everyone
 * @param staffOnly         hidden from everyone but protected roles
 */
public record ChannelTemplate(
        String name,
        ChannelKind kind,
        Integer minimumTierToPost,
        boolean staffOnly
) {
    public static ChannelTemplate text(String name) {
        return new ChannelTemplate(name, ChannelKind.TEXT, null, false);
    }

    public static ChannelTemplate voice(String name) {
        return new ChannelTemplate(name, ChannelKind.VOICE, null, false);
    }
}
