package com.example.guardianservice.store;

import com.example.guardianservice.entity.RemoteResource;

import java.util.List;

/**
 * Identifiers of remote resources created by overhaul runs.
 */
public interface RemoteStateStore {

    List<RemoteResource> findByGuild(long guildId);

    void record(long guildId, RemoteResource.Kind kind, String templateKey, long remoteId);

    void forget(long guildId, RemoteResource.Kind kind, String templateKey);

    void evictGuild(long guildId);
}
