package com.example.guardianservice.overhaul.execution;

import com.example.guardianservice.client.ChannelSnapshot;
import com.example.guardianservice.client.DiscordPlatformClient;
import com.example.guardianservice.client.PermissionOverwrite;
import com.example.guardianservice.overhaul.model.CategoryTemplate;
import com.example.guardianservice.overhaul.model.ChannelTemplate;
import com.example.guardianservice.overhaul.plan.StepPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * Creates categories and their channels, applying derived overwrites right after each creation.
 * <p>
 * Anything already in the run's known state is reused. In repair mode the overwrites of reused
 * resources are compared with the live ones and only rewritten when they differ.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StructureApplier {

    private final DiscordPlatformClient client;

    public void apply(StepPayload.Structure layout, RunContext context) {
        long guildId = context.getGuildId();
        KnownState state = context.getKnownState();
        OverwriteDeriver deriver = new OverwriteDeriver(guildId, state, layout.roles(), layout.tiers());
        Map<Long, List<PermissionOverwrite>> live = context.isRepair() ? liveOverwrites(guildId) : Map.of();

        for (CategoryTemplate category : layout.categories()) {
            Long categoryId = state.category(category.name()).orElse(null);
            boolean created = categoryId == null;
            if (created) {
                categoryId = client.createCategory(guildId, category.name());
                context.recordCategory(category.name(), categoryId);
            } else {
                context.reused();
            }
            applyOverwrites(context, categoryId, deriver.forCategory(category), created, live);

            for (ChannelTemplate channel : category.channels()) {
                Long channelId = state.channel(category.name(), channel.name()).orElse(null);
                boolean channelCreated = channelId == null;
                if (channelCreated) {
                    channelId = client.createChannel(guildId, categoryId, channel.name(), channel.kind());
                    context.recordChannel(category.name(), channel.name(), channelId);
                } else {
                    context.reused();
                }
                applyOverwrites(context, channelId, deriver.forChannel(channel), channelCreated, live);
            }
            log.debug("Category ready: guildId={} category='{}' id={} channels={}",
                    guildId, category.name(), categoryId, category.channels().size());
        }
    }

    private void applyOverwrites(RunContext context, long channelId, List<PermissionOverwrite> wanted,
                                 boolean created, Map<Long, List<PermissionOverwrite>> live) {
        if (created) {
            if (!wanted.isEmpty()) {
                client.setChannelOverwrites(context.getGuildId(), channelId, wanted);
            }
            return;
        }
        if (!context.isRepair()) {
            return;
        }
        List<PermissionOverwrite> current = live.getOrDefault(channelId, List.of());
        if (!new HashSet<>(current).equals(new HashSet<>(wanted))) {
            log.info("Overwrite drift repaired: guildId={} channelId={}", context.getGuildId(), channelId);
            client.setChannelOverwrites(context.getGuildId(), channelId, wanted);
        }
    }

    private Map<Long, List<PermissionOverwrite>> liveOverwrites(long guildId) {
        Map<Long, List<PermissionOverwrite>> result = new HashMap<>();
        for (ChannelSnapshot channel : client.listChannels(guildId)) {
            result.put(channel.id(), channel.overwrites());
        }
        return result;
    }
}
