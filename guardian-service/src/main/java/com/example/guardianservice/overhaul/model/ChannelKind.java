package com.example.guardianservice.overhaul.model;

public enum ChannelKind {
    TEXT,
    VOICE
}
