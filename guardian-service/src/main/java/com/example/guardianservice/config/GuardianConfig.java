package com.example.guardianservice.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Binds {@code guardian.*} properties into the immutable settings records used by the engines.
 */
@Configuration
public class GuardianConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public OverhaulSettings overhaulSettings(
            @Value("${guardian.overhaul.lock-at-most-for:2h}") Duration lockAtMostFor,
            @Value("${guardian.overhaul.bar-width:20}") int barWidth,
            @Value("${guardian.overhaul.confirmation-ttl:5m}") Duration confirmationTtl,
            @Value("${guardian.overhaul.status-text-limit:1900}") int statusTextLimit) {
        return new OverhaulSettings(lockAtMostFor, barWidth, confirmationTtl, statusTextLimit);
    }

    @Bean
    public LevelingSettings levelingSettings(
            @Value("${guardian.leveling.xp-min:10}") int xpMin,
            @Value("${guardian.leveling.xp-max:20}") int xpMax,
            @Value("${guardian.leveling.cooldown:60s}") Duration cooldown,
            @Value("${guardian.leveling.daily-cap:500}") long dailyCap) {
        return new LevelingSettings(xpMin, xpMax, cooldown, dailyCap);
    }

    @Bean
    public PanelSettings panelSettings(
            @Value("${guardian.panel.channel-name:🎭-reaction-roles}") String channelName,
            @Value("${guardian.panel.page-size:25}") int pageSize,
            @Value("${guardian.panel.title:🎭 Pick your roles}") String title,
            @Value("${guardian.panel.protected-roles:Owner,Admin,Moderator,Support,Bots}") List<String> protectedRoles) {
        return new PanelSettings(channelName, pageSize, title, new LinkedHashSet<>(protectedRoles));
    }

    @Bean
    public CacheSettings cacheSettings(
            @Value("${guardian.cache.profile-ttl:5m}") Duration profileTtl,
            @Value("${guardian.cache.tier-ttl:10m}") Duration tierTtl,
            @Value("${guardian.cache.reaction-role-ttl:5m}") Duration reactionRoleTtl,
            @Value("${guardian.cache.panel-ttl:10m}") Duration panelTtl,
            @Value("${guardian.cache.remote-state-ttl:1m}") Duration remoteStateTtl) {
        return new CacheSettings(profileTtl, tierTtl, reactionRoleTtl, panelTtl, remoteStateTtl);
    }
}
