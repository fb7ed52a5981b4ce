package com.example.guardianservice.overhaul.execution;

import com.example.guardianservice.client.DiscordPlatformClient;
import com.example.guardianservice.client.GuildPermission;
import com.example.guardianservice.exception.PermanentRemoteException;
import com.example.guardianservice.overhaul.model.IdentitySettings;
import com.example.guardianservice.overhaul.plan.Step;
import com.example.guardianservice.overhaul.plan.StepKind;
import com.example.guardianservice.overhaul.plan.StepPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * First step of every run. Checks the bot holds the guild permissions the whole run needs
 * before the first mutation, then applies the guild settings.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SettingsStepHandler implements StepHandler {

    private final DiscordPlatformClient client;

    @Override
    public boolean supports(Step step) {
        return step.getKind() == StepKind.SETTINGS;
    }

    @Override
    public void execute(Step step, RunContext context) {
        checkPermissions(context.getGuildId());

        IdentitySettings wanted = ((StepPayload.Settings) step.getPayload()).identity();
        if (context.isRepair() && wanted.equals(client.getGuild(context.getGuildId()).settings())) {
            log.info("Guild settings already applied: guildId={}", context.getGuildId());
            context.reused();
            return;
        }
        client.updateGuildSettings(context.getGuildId(), wanted);
    }

    private void checkPermissions(long guildId) {
        Set<GuildPermission> missing = EnumSet.allOf(GuildPermission.class);
        missing.removeAll(client.getSelfPermissions(guildId));
        if (!missing.isEmpty()) {
            log.error("Preflight failed: guildId={} missingPermissions={}", guildId, missing);
            throw PermanentRemoteException.missingPermission("Bot missing permissions: " + missing);
        }
    }
}
