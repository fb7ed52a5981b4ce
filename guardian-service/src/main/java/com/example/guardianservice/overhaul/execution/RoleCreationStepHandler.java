package com.example.guardianservice.overhaul.execution;

import com.example.guardianservice.client.DiscordPlatformClient;
import com.example.guardianservice.client.RoleSnapshot;
import com.example.guardianservice.overhaul.model.RoleTemplate;
import com.example.guardianservice.overhaul.plan.Step;
import com.example.guardianservice.overhaul.plan.StepKind;
import com.example.guardianservice.overhaul.plan.StepPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Creates declared roles in order, reusing roles the run already knows by name.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RoleCreationStepHandler implements StepHandler {

    private final DiscordPlatformClient client;

    @Override
    public boolean supports(Step step) {
        return step.getKind() == StepKind.ROLE_CREATE;
    }

    @Override
    public void execute(Step step, RunContext context) {
        long guildId = context.getGuildId();
        for (RoleTemplate template : ((StepPayload.RoleCreation) step.getPayload()).roles()) {
            if (context.getKnownState().role(template.name()).isPresent()) {
                context.reused();
                continue;
            }
            RoleSnapshot role = client.createRole(guildId, template);
            context.recordRole(template.name(), role.id());
            log.debug("Role created: guildId={} name='{}' id={}", guildId, template.name(), role.id());
        }
    }
}
