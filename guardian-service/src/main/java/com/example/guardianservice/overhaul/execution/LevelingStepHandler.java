package com.example.guardianservice.overhaul.execution;

import com.example.guardianservice.entity.TierDefinition;
import com.example.guardianservice.leveling.LevelEngine;
import com.example.guardianservice.overhaul.model.TierTemplate;
import com.example.guardianservice.overhaul.plan.Step;
import com.example.guardianservice.overhaul.plan.StepKind;
import com.example.guardianservice.overhaul.plan.StepPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Stores the tier ladder with the reward roles created earlier in the run.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LevelingStepHandler implements StepHandler {

    private final LevelEngine levelEngine;

    @Override
    public boolean supports(Step step) {
        return step.getKind() == StepKind.LEVELING_SETUP;
    }

    @Override
    public void execute(Step step, RunContext context) {
        long guildId = context.getGuildId();
        List<TierDefinition> ladder = new ArrayList<>();
        for (TierTemplate tier : ((StepPayload.LevelingSetup) step.getPayload()).tiers()) {
            ladder.add(TierDefinition.builder()
                    .guildId(guildId)
                    .level(tier.level())
                    .threshold(tier.threshold())
                    .roleName(tier.roleName())
                    .roleId(context.getKnownState().role(tier.roleName()).orElse(null))
                    .capabilities(new ArrayList<>(tier.unlockedCapabilities()))
                    .build());
        }
        if (context.isRepair() && sameLadder(levelEngine.getTiers(guildId), ladder)) {
            log.info("Tier ladder already stored: guildId={} tiers={}", guildId, ladder.size());
            return;
        }
        levelEngine.replaceTiers(guildId, ladder);
        context.note("Level rewards: " + ladder.size() + " tiers");
    }

    private static boolean sameLadder(List<TierDefinition> stored, List<TierDefinition> wanted) {
        if (stored.size() != wanted.size()) {
            return false;
        }
        for (int i = 0; i < stored.size(); i++) {
            TierDefinition a = stored.get(i);
            TierDefinition b = wanted.get(i);
            if (a.getLevel() != b.getLevel() || a.getThreshold() != b.getThreshold()
                    || !Objects.equals(a.getRoleName(), b.getRoleName())
                    || !Objects.equals(a.getRoleId(), b.getRoleId())
                    || !Objects.equals(a.getCapabilities(), b.getCapabilities())) {
                return false;
            }
        }
        return true;
    }
}
