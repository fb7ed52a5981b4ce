package com.example.guardianservice.overhaul.execution;

import com.example.guardianservice.client.DiscordPlatformClient;
import com.example.guardianservice.client.RoleSnapshot;
import com.example.guardianservice.exception.PermanentRemoteException;
import com.example.guardianservice.overhaul.plan.Step;
import com.example.guardianservice.overhaul.plan.StepKind;
import com.example.guardianservice.overhaul.plan.StepPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Puts declared roles in declaration order, highest first.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RoleOrderStepHandler implements StepHandler {

    private final DiscordPlatformClient client;

    @Override
    public boolean supports(Step step) {
        return step.getKind() == StepKind.ROLE_ORDER;
    }

    @Override
    public void execute(Step step, RunContext context) {
        long guildId = context.getGuildId();
        List<Long> wanted = new ArrayList<>();
        for (String name : ((StepPayload.RoleOrder) step.getPayload()).roleNames()) {
            wanted.add(context.getKnownState().role(name).orElseThrow(
                    () -> PermanentRemoteException.unknownResource("role '" + name + "' (not created in this guild)")));
        }
        if (wanted.size() < 2) {
            return;
        }
        if (context.isRepair() && wanted.equals(currentOrder(guildId, new HashSet<>(wanted)))) {
            log.info("Role hierarchy already ordered: guildId={}", guildId);
            return;
        }
        client.reorderRoles(guildId, wanted);
    }

    private List<Long> currentOrder(long guildId, Set<Long> ids) {
        return client.listRoles(guildId).stream()
                .filter(role -> ids.contains(role.id()))
                .sorted(Comparator.comparingInt(RoleSnapshot::position).reversed())
                .map(RoleSnapshot::id)
                .toList();
    }
}
