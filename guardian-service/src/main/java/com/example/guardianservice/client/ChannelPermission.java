package com.example.guardianservice.client;

/**
 * The subset of channel permissions overhaul overwrites touch.
 */
public enum ChannelPermission {
    VIEW_CHANNEL,
    SEND_MESSAGES,
    CONNECT
}
