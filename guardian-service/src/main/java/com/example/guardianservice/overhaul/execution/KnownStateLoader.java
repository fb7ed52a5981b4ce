package com.example.guardianservice.overhaul.execution;

import com.example.guardianservice.client.ChannelSnapshot;
import com.example.guardianservice.client.DiscordPlatformClient;
import com.example.guardianservice.client.RoleSnapshot;
import com.example.guardianservice.entity.RemoteResource;
import com.example.guardianservice.store.RemoteStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the starting state of a repair from a fresh remote listing.
 * <p>
 * Resources are matched by name first; identifiers recorded by earlier runs then take precedence
 * for the same template, but only if the resource still exists.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KnownStateLoader {

    private final DiscordPlatformClient client;
    private final RemoteStateStore remoteStateStore;

    public KnownState load(long guildId) {
        KnownState state = KnownState.empty();

        Set<Long> liveRoles = new HashSet<>();
        for (RoleSnapshot role : client.listRoles(guildId)) {
            if (role.id() == guildId || role.managed()) {
                continue;
            }
            liveRoles.add(role.id());
            if (state.role(role.name()).isEmpty()) {
                state.putRole(role.name(), role.id());
            }
        }

        List<ChannelSnapshot> channels = client.listChannels(guildId);
        Map<Long, String> categoryNames = new HashMap<>();
        Set<Long> liveChannels = new HashSet<>();
        for (ChannelSnapshot channel : channels) {
            liveChannels.add(channel.id());
            if (channel.isCategory()) {
                categoryNames.put(channel.id(), channel.name());
                if (state.category(channel.name()).isEmpty()) {
                    state.putCategory(channel.name(), channel.id());
                }
            }
        }
        for (ChannelSnapshot channel : channels) {
            String parent = channel.parentId() == null ? null : categoryNames.get(channel.parentId());
            if (!channel.isCategory() && parent != null && state.channel(parent, channel.name()).isEmpty()) {
                state.putChannel(parent, channel.name(), channel.id());
            }
        }

        int recorded = 0;
        for (RemoteResource resource : remoteStateStore.findByGuild(guildId)) {
            long id = resource.getRemoteId();
            switch (resource.getKind()) {
                case ROLE -> {
                    if (liveRoles.contains(id)) {
                        state.putRole(resource.getTemplateKey(), id);
                        recorded++;
                    }
                }
                case CATEGORY -> {
                    if (liveChannels.contains(id)) {
                        state.putCategory(resource.getTemplateKey(), id);
                        recorded++;
                    }
                }
                case CHANNEL -> {
                    if (liveChannels.contains(id)) {
                        state.putChannelByKey(resource.getTemplateKey(), id);
                        recorded++;
                    }
                }
            }
        }
        log.info("Known state loaded: guildId={} {} recordedMatches={}", guildId, state, recorded);
        return state;
    }
}
