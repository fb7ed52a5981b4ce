package com.example.guardianservice.overhaul.execution;

import com.example.guardianservice.entity.RemoteResource;
import com.example.guardianservice.store.RemoteStateStore;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one overhaul run, shared by the handlers of its steps.
 * Identifiers produced by a step are recorded here and persisted, so later steps (and a later
 * repair) can find them.
 */
@Getter
public class RunContext {

    private final long guildId;
    private final KnownState knownState;
    private final boolean repair;
    private final CancelToken cancelToken;
    private final RemoteStateStore remoteStateStore;

    private int created;
    private int reused;
    private final List<String> notes = new ArrayList<>();
    private String summary;

    public RunContext(long guildId, KnownState knownState, boolean repair, CancelToken cancelToken,
                      RemoteStateStore remoteStateStore) {
        this.guildId = guildId;
        this.knownState = knownState;
        this.repair = repair;
        this.cancelToken = cancelToken;
        this.remoteStateStore = remoteStateStore;
    }

    public void recordRole(String name, long id) {
        knownState.putRole(name, id);
        remoteStateStore.record(guildId, RemoteResource.Kind.ROLE, name, id);
        created++;
    }

    public void recordCategory(String name, long id) {
        knownState.putCategory(name, id);
        remoteStateStore.record(guildId, RemoteResource.Kind.CATEGORY, name, id);
        created++;
    }

    public void recordChannel(String category, String channel, long id) {
        knownState.putChannel(category, channel, id);
        remoteStateStore.record(guildId, RemoteResource.Kind.CHANNEL, KnownState.channelKey(category, channel), id);
        created++;
    }

    public void reused() {
        reused++;
    }

    public void note(String note) {
        notes.add(note);
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }
}
