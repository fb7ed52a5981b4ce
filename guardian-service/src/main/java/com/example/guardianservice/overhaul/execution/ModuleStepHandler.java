package com.example.guardianservice.overhaul.execution;

import com.example.guardianservice.entity.PanelRecord;
import com.example.guardianservice.overhaul.model.FeatureFlag;
import com.example.guardianservice.overhaul.plan.Step;
import com.example.guardianservice.overhaul.plan.StepKind;
import com.example.guardianservice.overhaul.plan.StepPayload;
import com.example.guardianservice.reactionroles.ReactionPanelManager;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Optional modules: the reaction panel is published, the others add their own categories and
 * channels.
 */
@Component
@RequiredArgsConstructor
public class ModuleStepHandler implements StepHandler {

    private final StructureApplier structureApplier;
    private final ReactionPanelManager panelManager;

    @Override
    public boolean supports(Step step) {
        return step.getKind() == StepKind.MODULE_SETUP;
    }

    @Override
    public void execute(Step step, RunContext context) {
        StepPayload.ModuleSetup module = (StepPayload.ModuleSetup) step.getPayload();
        if (module.feature() == FeatureFlag.REACTION_ROLES) {
            PanelRecord panel = panelManager.publish(context.getGuildId());
            context.note("Reaction panel: channel " + panel.getChannelId() + ", message " + panel.getMessageId());
            return;
        }
        structureApplier.apply(module.layout(), context);
    }
}
