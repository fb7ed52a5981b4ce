package com.example.guardianservice.leveling;

import com.example.guardianservice.entity.LevelProfile;
import com.example.guardianservice.entity.TierDefinition;
import com.example.guardianservice.exception.ConfigurationValidationException;
import com.example.guardianservice.exception.PermanentRemoteException;
import com.example.guardianservice.support.GuardianTestKit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * XP bookkeeping and tier role reconciliation.
 * Ladder: Bronze at 0 XP (tier 1), Silver at 500 (tier 5), Gold at 1000 (tier 10).
 */
class LevelEngineTest {

    private static final long GUILD_ID = 77L;
    private static final long USER_ID = 900L;

    private GuardianTestKit kit;
    private LevelEngine engine;
    private long bronze;
    private long silver;
    private long gold;

    @BeforeEach
    void setUp() {
        kit = new GuardianTestKit();
        engine = kit.levelEngine;
        bronze = kit.platform.seedRole(GUILD_ID, "Bronze", false).id();
        silver = kit.platform.seedRole(GUILD_ID, "Silver", false).id();
        gold = kit.platform.seedRole(GUILD_ID, "Gold", false).id();
        engine.replaceTiers(GUILD_ID, List.of(
                tier(1, 0, "Bronze", bronze),
                tier(5, 500, "Silver", silver),
                tier(10, 1000, "Gold", gold)));
    }

    private static TierDefinition tier(int level, long threshold, String roleName, Long roleId) {
        return TierDefinition.builder()
                .level(level)
                .threshold(threshold)
                .roleName(roleName)
                .roleId(roleId)
                .build();
    }

    private boolean holds(long roleId) {
        return kit.platform.getMember(GUILD_ID, USER_ID).hasRole(roleId);
    }

    private LevelProfile bronzeMember(long xp) {
        kit.platform.addMemberRole(GUILD_ID, USER_ID, bronze);
        LevelProfile profile = LevelProfile.fresh(GUILD_ID, USER_ID);
        profile.setXp(xp);
        profile.setCurrentTier(1);
        kit.profiles.save(profile);
        return profile;
    }

    @Test
    void testGrantXp_BelowNextThreshold_TierUnchangedAndNoRoleChange() {
        // GIVEN
        LevelProfile profile = bronzeMember(0);
        int mutations = kit.platform.mutationCount();

        // WHEN
        LevelProfile result = engine.grantXp(profile, 120);

        // THEN
        assertThat(result.getXp()).isEqualTo(120);
        assertThat(result.getCurrentTier()).isEqualTo(1);
        assertThat(kit.platform.mutationCount()).isEqualTo(mutations);
    }

    @Test
    void testGrantXp_CrossingToSilver_AddsSilverAndRemovesBronze() {
        // GIVEN
        LevelProfile profile = bronzeMember(120);

        // WHEN
        LevelProfile result = engine.grantXp(profile, 500);

        // THEN
        assertThat(result.getXp()).isEqualTo(620);
        assertThat(result.getCurrentTier()).isEqualTo(5);
        assertThat(holds(silver)).isTrue();
        assertThat(holds(bronze)).isFalse();
        assertThat(kit.counter("guardian_level_crossings_total")).isEqualTo(1.0);
    }

    @Test
    void testGrantXp_FreshMember_ReceivesFirstTierRole() {
        // WHEN
        LevelProfile result = engine.grantXp(GUILD_ID, USER_ID, 10);

        // THEN
        assertThat(result.getCurrentTier()).isEqualTo(1);
        assertThat(holds(bronze)).isTrue();
    }

    @Test
    void testGrantXp_SkippingTiers_LandsOnHighestReached() {
        LevelProfile profile = bronzeMember(0);

        LevelProfile result = engine.grantXp(profile, 1500);

        assertThat(result.getCurrentTier()).isEqualTo(10);
        assertThat(holds(gold)).isTrue();
        assertThat(holds(silver)).isFalse();
        assertThat(holds(bronze)).isFalse();
    }

    @Test
    void testGrantXp_StaleLowerTierRoles_AreAllRemovedOnCrossing() {
        // GIVEN: a Bronze member still holding Silver from an earlier ladder
        LevelProfile profile = bronzeMember(0);
        kit.platform.addMemberRole(GUILD_ID, USER_ID, silver);

        // WHEN
        LevelProfile result = engine.grantXp(profile, 1500);

        // THEN
        assertThat(result.getCurrentTier()).isEqualTo(10);
        assertThat(holds(gold)).isTrue();
        assertThat(holds(silver)).isFalse();
        assertThat(holds(bronze)).isFalse();
        assertThat(kit.platform.calls("removeMemberRole")).isEqualTo(2);
    }

    @Test
    void testGrantXp_SaveFails_StoredProfileAndRolesUnchanged() {
        // GIVEN
        LevelProfile profile = bronzeMember(100);
        kit.profiles.failSaves(new IllegalStateException("connection reset"));

        // WHEN / THEN
        assertThatThrownBy(() -> engine.grantXp(profile, 1000))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("connection reset");
        assertThat(profile.getXp()).isEqualTo(100);
        assertThat(holds(gold)).isFalse();

        // THEN: the next grant starts from the stored 100 XP
        kit.profiles.failSaves(null);
        LevelProfile retried = engine.grantXp(GUILD_ID, USER_ID, 50);
        assertThat(retried.getXp()).isEqualTo(150);
        assertThat(retried.getCurrentTier()).isEqualTo(1);
    }

    @Test
    void testAwardMessageXp_SaveFails_CooldownNotConsumed() {
        // GIVEN
        Instant now = Instant.parse("2026-03-01T08:00:00Z");
        kit.profiles.failSaves(new IllegalStateException("connection reset"));

        // WHEN
        assertThatThrownBy(() -> engine.awardMessageXp(GUILD_ID, USER_ID, now))
                .isInstanceOf(IllegalStateException.class);
        kit.profiles.failSaves(null);

        // THEN: the same message can still earn XP
        assertThat(engine.awardMessageXp(GUILD_ID, USER_ID, now)).isEqualTo(15);
        assertThat(kit.profiles.find(GUILD_ID, USER_ID).orElseThrow().getDailyXp()).isEqualTo(15);
    }

    @Test
    void testGrantXp_NonPositiveAmount_IsNoOp() {
        LevelProfile profile = bronzeMember(300);

        engine.grantXp(profile, 0);
        engine.grantXp(profile, -50);

        assertThat(kit.profiles.find(GUILD_ID, USER_ID).orElseThrow().getXp()).isEqualTo(300);
    }

    @Test
    void testGrantXp_AddFails_XpKeptAndOldRoleRetained() {
        // GIVEN: the new tier role cannot be granted
        LevelProfile profile = bronzeMember(450);
        kit.platform.failNext("addMemberRole",
                PermanentRemoteException.missingPermission("Missing Permissions"));

        // WHEN
        LevelProfile result = engine.grantXp(profile, 100);

        // THEN: the grant stands, the member is never left without a tier role
        assertThat(result.getXp()).isEqualTo(550);
        assertThat(result.getCurrentTier()).isEqualTo(5);
        assertThat(holds(bronze)).isTrue();
        assertThat(holds(silver)).isFalse();
        assertThat(kit.platform.calls("removeMemberRole")).isZero();
        assertThat(kit.counter("guardian_reconciliation_failures_total")).isEqualTo(1.0);
    }

    @Test
    void testGrantXp_ConcurrentGrants_AreNotLost() throws Exception {
        // GIVEN
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);

        // WHEN: 200 grants of 5 XP race on one profile
        for (int i = 0; i < 200; i++) {
            pool.submit(() -> {
                start.await();
                return engine.grantXp(GUILD_ID, USER_ID, 5);
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        // THEN
        LevelProfile stored = kit.profiles.find(GUILD_ID, USER_ID).orElseThrow();
        assertThat(stored.getXp()).isEqualTo(1000);
        assertThat(stored.getCurrentTier()).isEqualTo(10);
        assertThat(holds(gold)).isTrue();
    }

    @Test
    void testAwardMessageXp_CooldownAndDailyCap() {
        // GIVEN: 15 XP per message, 60s cooldown, 40 XP per day
        Instant morning = Instant.parse("2026-03-01T08:00:00Z");

        // WHEN / THEN
        assertThat(engine.awardMessageXp(GUILD_ID, USER_ID, morning)).isEqualTo(15);
        assertThat(engine.awardMessageXp(GUILD_ID, USER_ID, morning.plusSeconds(30))).isZero();
        assertThat(engine.awardMessageXp(GUILD_ID, USER_ID, morning.plusSeconds(60))).isEqualTo(15);
        // only 10 left of the daily cap
        assertThat(engine.awardMessageXp(GUILD_ID, USER_ID, morning.plusSeconds(120))).isEqualTo(10);
        assertThat(engine.awardMessageXp(GUILD_ID, USER_ID, morning.plusSeconds(180))).isZero();

        // the cap resets at the next UTC day
        assertThat(engine.awardMessageXp(GUILD_ID, USER_ID, morning.plus(Duration.ofDays(1)))).isEqualTo(15);
        assertThat(kit.profiles.find(GUILD_ID, USER_ID).orElseThrow().getXp()).isEqualTo(55);
    }

    @Test
    void testSetRoleReward_UnknownLevel_IsRejected() {
        assertThatThrownBy(() -> engine.setRoleReward(GUILD_ID, 7, silver))
                .isInstanceOf(ConfigurationValidationException.class)
                .hasMessageContaining("no tier with level 7");
    }

    @Test
    void testSetRoleReward_AppliesToFutureCrossings() {
        // GIVEN
        long champion = kit.platform.seedRole(GUILD_ID, "Champion", false).id();
        engine.setRoleReward(GUILD_ID, 10, champion);

        // WHEN
        engine.grantXp(GUILD_ID, USER_ID, 1000);

        // THEN
        assertThat(engine.getRoleRewards(GUILD_ID)).containsEntry(10, champion);
        assertThat(holds(champion)).isTrue();
        assertThat(holds(gold)).isFalse();
    }

    @Test
    void testReplaceTiers_NonIncreasingThresholds_AreRejected() {
        assertThatThrownBy(() -> engine.replaceTiers(GUILD_ID, List.of(
                tier(1, 100, "Bronze", bronze),
                tier(5, 100, "Silver", silver))))
                .isInstanceOf(ConfigurationValidationException.class);
        assertThat(engine.getTiers(GUILD_ID)).hasSize(3);
    }

    @Test
    void testResync_MemberWithWrongRoles_IsCorrected() {
        // GIVEN: stored at Silver XP but holding Bronze and Gold
        LevelProfile profile = LevelProfile.fresh(GUILD_ID, USER_ID);
        profile.setXp(700);
        kit.profiles.save(profile);
        kit.platform.addMemberRole(GUILD_ID, USER_ID, bronze);
        kit.platform.addMemberRole(GUILD_ID, USER_ID, gold);

        // WHEN
        LevelProfile result = engine.resync(GUILD_ID, USER_ID);

        // THEN
        assertThat(result.getCurrentTier()).isEqualTo(5);
        assertThat(holds(silver)).isTrue();
        assertThat(holds(bronze)).isFalse();
        assertThat(holds(gold)).isFalse();
    }

    @Test
    void testLeaderboard_OrdersByXp() {
        engine.grantXp(GUILD_ID, 1L, 50);
        engine.grantXp(GUILD_ID, 2L, 800);
        engine.grantXp(GUILD_ID, 3L, 300);

        assertThat(engine.leaderboard(GUILD_ID, 2))
                .extracting(LevelProfile::getUserId)
                .containsExactly(2L, 3L);
    }
}
