package com.example.guardianservice.leveling;

import com.example.guardianservice.client.DiscordPlatformClient;
import com.example.guardianservice.client.MemberSnapshot;
import com.example.guardianservice.config.LevelingSettings;
import com.example.guardianservice.entity.LevelProfile;
import com.example.guardianservice.entity.TierDefinition;
import com.example.guardianservice.exception.ConfigurationValidationException;
import com.example.guardianservice.exception.ReconciliationException;
import com.example.guardianservice.exception.RemoteApiException;
import com.example.guardianservice.metrics.GuardianMetrics;
import com.example.guardianservice.store.LevelProfileStore;
import com.example.guardianservice.store.TierDefinitionStore;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Experience and tier bookkeeping.
 * <p>
 * XP only grows through {@link #grantXp}. After every change the current tier is recomputed
 * from the guild's ladder; on a crossing the new tier role is added before the previous tier
 * roles below it are removed, so the member is never without a tier role. The XP write is the
 * source of truth: role changes are best effort and a failed reconciliation is logged and
 * counted, never rethrown.
 * <p>
 * Updates to one profile are serialized; different profiles proceed concurrently. Changes are
 * made on a copy of the stored profile, so a failed save leaves the stored state untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LevelEngine {

    private final LevelProfileStore profileStore;
    private final TierDefinitionStore tierStore;
    private final DiscordPlatformClient client;
    private final GuardianMetrics metrics;
    private final LevelingSettings settings;

    private final LoadingCache<ProfileKey, ReentrantLock> profileLocks = Caffeine.newBuilder()
            .weakValues()
            .build(key -> new ReentrantLock());

    public LevelProfile grantXp(long guildId, long userId, long amount) {
        return grantXp(LevelProfile.fresh(guildId, userId), amount);
    }

    /**
     * Adds experience to the stored profile, or to {@code profile} if none is stored yet.
     * A non-positive amount changes nothing.
     *
     * @return the profile after the grant
     */
    public LevelProfile grantXp(LevelProfile profile, long amount) {
        return withProfileLock(profile.getGuildId(), profile.getUserId(), () -> {
            LevelProfile current = profileStore.find(profile.getGuildId(), profile.getUserId()).orElse(profile);
            return apply(current.copy(), amount);
        });
    }

    /**
     * Message experience: a random amount within the configured range, at most once per cooldown
     * and never beyond the daily cap (UTC days).
     *
     * @return experience actually granted, 0 when on cooldown or capped
     */
    public long awardMessageXp(long guildId, long userId, Instant now) {
        return withProfileLock(guildId, userId, () -> {
            LevelProfile profile = profileStore.find(guildId, userId)
                    .map(LevelProfile::copy)
                    .orElseGet(() -> LevelProfile.fresh(guildId, userId));
            Instant last = profile.getLastMessageXpAt();
            if (last != null && now.isBefore(last.plus(settings.cooldown()))) {
                return 0L;
            }
            LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
            if (!today.equals(profile.getDailyXpDate())) {
                profile.setDailyXp(0);
                profile.setDailyXpDate(today);
            }
            long remaining = settings.dailyCap() - profile.getDailyXp();
            if (remaining <= 0) {
                log.debug("Daily XP cap reached: guildId={} userId={}", guildId, userId);
                return 0L;
            }
            long amount = Math.min(remaining,
                    ThreadLocalRandom.current().nextInt(settings.xpMin(), settings.xpMax() + 1));
            profile.setLastMessageXpAt(now);
            profile.setDailyXp(profile.getDailyXp() + amount);
            apply(profile, amount);
            return amount;
        });
    }

    private LevelProfile apply(LevelProfile profile, long amount) {
        if (amount <= 0) {
            log.debug("Ignoring non-positive XP grant: guildId={} userId={} amount={}",
                    profile.getGuildId(), profile.getUserId(), amount);
            return profile;
        }
        List<TierDefinition> ladder = tierStore.findByGuild(profile.getGuildId());
        int previousTier = profile.getCurrentTier();
        profile.setXp(profile.getXp() + amount);
        TierDefinition reached = TierTable.highestReached(ladder, profile.getXp()).orElse(null);
        profile.setCurrentTier(reached == null ? 0 : reached.getLevel());
        profileStore.save(profile);

        if (reached != null && reached.getLevel() > previousTier) {
            metrics.recordLevelCrossing();
            log.info("Tier crossed: guildId={} userId={} xp={} tier {} -> {}",
                    profile.getGuildId(), profile.getUserId(), profile.getXp(), previousTier, reached.getLevel());
            reconcileCrossing(profile, ladder, reached);
        }
        return profile;
    }

    private void reconcileCrossing(LevelProfile profile, List<TierDefinition> ladder, TierDefinition reached) {
        long guildId = profile.getGuildId();
        long userId = profile.getUserId();
        Long newRole = reached.getRoleId();
        try {
            if (newRole == null) {
                log.warn("No reward role mapped: guildId={} tier={}", guildId, reached.getLevel());
            } else {
                client.addMemberRole(guildId, userId, newRole);
            }
            MemberSnapshot member = client.getMember(guildId, userId);
            for (TierDefinition lower : ladder) {
                Long roleId = lower.getRoleId();
                if (lower.getLevel() >= reached.getLevel() || roleId == null || roleId.equals(newRole)) {
                    continue;
                }
                if (member.hasRole(roleId)) {
                    client.removeMemberRole(guildId, userId, roleId);
                }
            }
        } catch (RemoteApiException e) {
            ReconciliationException failure = new ReconciliationException(guildId, userId, e);
            metrics.recordReconciliationFailure();
            log.warn("{} (XP kept)", failure.getMessage(), failure);
        }
    }

    /**
     * Maps the reward role of one tier. Only future crossings pick up the change; use
     * {@link #resync} to bring an existing member in line.
     */
    public void setRoleReward(long guildId, int level, long roleId) {
        if (!tierStore.setRoleId(guildId, level, roleId)) {
            throw ConfigurationValidationException.of("Guild " + guildId + " has no tier with level " + level);
        }
        log.info("Role reward set: guildId={} tier={} roleId={}", guildId, level, roleId);
    }

    /**
     * @return tier level to reward role id, in ladder order; unmapped tiers map to {@code null}
     */
    public Map<Integer, Long> getRoleRewards(long guildId) {
        Map<Integer, Long> rewards = new LinkedHashMap<>();
        tierStore.findByGuild(guildId).forEach(tier -> rewards.put(tier.getLevel(), tier.getRoleId()));
        return rewards;
    }

    public List<TierDefinition> getTiers(long guildId) {
        return tierStore.findByGuild(guildId);
    }

    /**
     * Replaces the guild's ladder wholesale. Profiles are not touched.
     */
    public void replaceTiers(long guildId, List<TierDefinition> ladder) {
        TierTable.validate(ladder);
        tierStore.replaceAll(guildId, ladder);
    }

    /**
     * Recomputes the member's tier and makes their tier roles match it exactly: the current tier
     * role present, every other tier role absent. Remote failures propagate to the caller.
     */
    public LevelProfile resync(long guildId, long userId) {
        return withProfileLock(guildId, userId, () -> {
            LevelProfile profile = profileStore.find(guildId, userId)
                    .map(LevelProfile::copy)
                    .orElseGet(() -> LevelProfile.fresh(guildId, userId));
            List<TierDefinition> ladder = tierStore.findByGuild(guildId);
            TierDefinition reached = TierTable.highestReached(ladder, profile.getXp()).orElse(null);
            int tier = reached == null ? 0 : reached.getLevel();
            if (tier != profile.getCurrentTier()) {
                profile.setCurrentTier(tier);
                profileStore.save(profile);
            }

            MemberSnapshot member = client.getMember(guildId, userId);
            Long wanted = reached == null ? null : reached.getRoleId();
            if (wanted != null && !member.hasRole(wanted)) {
                client.addMemberRole(guildId, userId, wanted);
            }
            for (TierDefinition other : ladder) {
                Long roleId = other.getRoleId();
                if (roleId != null && !roleId.equals(wanted) && member.hasRole(roleId)) {
                    client.removeMemberRole(guildId, userId, roleId);
                }
            }
            log.info("Tier roles resynced: guildId={} userId={} tier={}", guildId, userId, tier);
            return profile;
        });
    }

    public List<LevelProfile> leaderboard(long guildId, int limit) {
        return profileStore.top(guildId, limit);
    }

    private <T> T withProfileLock(long guildId, long userId, Supplier<T> action) {
        ReentrantLock lock = profileLocks.get(new ProfileKey(guildId, userId));
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private record ProfileKey(long guildId, long userId) {
    }
}
