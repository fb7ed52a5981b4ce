package com.example.guardianservice.overhaul.execution;

import com.example.guardianservice.client.DiscordPlatformClient;
import com.example.guardianservice.overhaul.model.CategoryTemplate;
import com.example.guardianservice.overhaul.model.ChannelTemplate;
import com.example.guardianservice.overhaul.plan.Step;
import com.example.guardianservice.overhaul.plan.StepKind;
import com.example.guardianservice.overhaul.plan.StepPayload;
import com.example.guardianservice.store.LevelProfileStore;
import com.example.guardianservice.store.PanelRecordStore;
import com.example.guardianservice.store.ReactionRoleStore;
import com.example.guardianservice.store.RemoteStateStore;
import com.example.guardianservice.store.TierDefinitionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Verifies the structure against a fresh listing, drops cached records of the guild and writes
 * the run summary.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FinalizeStepHandler implements StepHandler {

    private final DiscordPlatformClient client;
    private final LevelProfileStore profileStore;
    private final TierDefinitionStore tierStore;
    private final ReactionRoleStore reactionRoleStore;
    private final PanelRecordStore panelStore;
    private final RemoteStateStore remoteStateStore;

    @Override
    public boolean supports(Step step) {
        return step.getKind() == StepKind.FINALIZE;
    }

    @Override
    public void execute(Step step, RunContext context) {
        long guildId = context.getGuildId();
        List<CategoryTemplate> expected = ((StepPayload.Finalize) step.getPayload()).expected();

        Set<Long> live = new HashSet<>();
        client.listChannels(guildId).forEach(channel -> live.add(channel.id()));
        KnownState state = context.getKnownState();
        List<String> missing = new ArrayList<>();
        Set<String> categoriesSeen = new HashSet<>();
        int channelCount = 0;
        for (CategoryTemplate category : expected) {
            if (categoriesSeen.add(category.name())
                    && !state.category(category.name()).map(live::contains).orElse(false)) {
                missing.add(category.name());
            }
            for (ChannelTemplate channel : category.channels()) {
                channelCount++;
                if (!state.channel(category.name(), channel.name()).map(live::contains).orElse(false)) {
                    missing.add(category.name() + "/" + channel.name());
                }
            }
        }

        profileStore.evictGuild(guildId);
        tierStore.evictGuild(guildId);
        reactionRoleStore.evictGuild(guildId);
        panelStore.evictGuild(guildId);
        remoteStateStore.evictGuild(guildId);

        StringBuilder summary = new StringBuilder()
                .append("Created ").append(context.getCreated())
                .append(", reused ").append(context.getReused()).append(" resources.");
        if (missing.isEmpty()) {
            summary.append("\nStructure verified: ").append(categoriesSeen.size()).append(" categories, ")
                    .append(channelCount).append(" channels.");
        } else {
            summary.append("\nDrift: missing ").append(String.join(", ", missing));
            log.warn("Structure drift after overhaul: guildId={} missing={}", guildId, missing);
        }
        context.getNotes().forEach(note -> summary.append('\n').append(note));
        context.setSummary(summary.toString());
    }
}
