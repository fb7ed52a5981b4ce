package com.example.guardianservice.overhaul.execution;

import com.example.guardianservice.client.ChannelPermission;
import com.example.guardianservice.client.ChannelSnapshot;
import com.example.guardianservice.client.GuildPermission;
import com.example.guardianservice.client.PermissionOverwrite;
import com.example.guardianservice.exception.PermanentRemoteException;
import com.example.guardianservice.exception.TransientRemoteException;
import com.example.guardianservice.overhaul.ScenarioConfigurations;
import com.example.guardianservice.overhaul.model.ConfigurationModel;
import com.example.guardianservice.overhaul.plan.Step;
import com.example.guardianservice.overhaul.plan.StepStatus;
import com.example.guardianservice.support.GuardianTestKit;
import com.example.guardianservice.support.RecordingProgressSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Sequential execution against the in-memory platform: abort on the first failure,
 * retries below the step level, cooperative cancellation and idempotent repair.
 * <p>
 * Scenario configuration: 5 roles, 2 categories, 5 channels, leveling and reaction roles (7 steps).
 */
class StepExecutorTest {

    private static final long GUILD_ID = 4242L;

    private GuardianTestKit kit;
    private ConfigurationModel config;

    @BeforeEach
    void setUp() {
        kit = new GuardianTestKit();
        config = ScenarioConfigurations.levelingAndReactionRoles();
    }

    private RunResult run(boolean repair, KnownState state, CancelToken cancel, RecordingProgressSink sink) {
        List<Step> steps = kit.planner.plan(config);
        RunContext context = new RunContext(GUILD_ID, state, repair, cancel, kit.remoteState);
        return kit.stepExecutor.execute(steps, context, sink);
    }

    private RunResult freshRun(RecordingProgressSink sink) {
        return run(false, KnownState.empty(), new CancelToken(), sink);
    }

    private RunResult repairRun() {
        return run(true, kit.knownStateLoader.load(GUILD_ID), new CancelToken(), new RecordingProgressSink());
    }

    private ChannelSnapshot channel(String name) {
        return kit.platform.listChannels(GUILD_ID).stream()
                .filter(c -> c.name().equals(name))
                .findFirst()
                .orElseThrow();
    }

    private long roleId(String name) {
        return kit.platform.listRoles(GUILD_ID).stream()
                .filter(r -> r.name().equals(name))
                .findFirst()
                .orElseThrow()
                .id();
    }

    @Test
    void testExecute_FreshGuild_CompletesAllSevenSteps() {
        // GIVEN
        RecordingProgressSink sink = new RecordingProgressSink();

        // WHEN
        RunResult result = freshRun(sink);

        // THEN
        assertThat(result.outcome()).isEqualTo(RunResult.Outcome.COMPLETED);
        assertThat(result.completedSteps()).isEqualTo(7);
        assertThat(result.steps()).allMatch(step -> step.getStatus() == StepStatus.SUCCEEDED);
        assertThat(kit.platform.calls("createRole")).isEqualTo(5);
        assertThat(kit.platform.calls("createCategory")).isEqualTo(2);
        // 5 configured channels plus the reaction panel channel
        assertThat(kit.platform.calls("createChannel")).isEqualTo(6);
        assertThat(kit.platform.calls("createMessage")).isEqualTo(1);
        assertThat(kit.tiers.findByGuild(GUILD_ID)).hasSize(3);

        // one initial write, one per intermediate step, one final write
        assertThat(sink.published()).hasSize(8);
        assertThat(sink.published().get(0)).contains("Progress: 0/7 steps");
        assertThat(sink.last())
                .startsWith("**✅ Overhaul completed**")
                .contains("100%")
                .contains("Structure verified: 2 categories, 5 channels.")
                .contains("Level rewards: 3 tiers");
        assertThat(result.summary()).startsWith("Created 12, reused 0 resources.");
    }

    @Test
    void testExecute_PermanentFailureAtStructure_AbortsAtStepFourOfSeven() {
        // GIVEN
        kit.platform.failAlways("createCategory", PermanentRemoteException.missingPermission("Missing Permissions"));
        RecordingProgressSink sink = new RecordingProgressSink();

        // WHEN
        RunResult result = freshRun(sink);

        // THEN
        assertThat(result.outcome()).isEqualTo(RunResult.Outcome.FAILED);
        assertThat(result.completedSteps()).isEqualTo(3);
        assertThat(result.errorMessage()).isEqualTo("Missing Permissions");
        assertThat(result.getFailedStep()).map(Step::getId).contains(4);
        assertThat(result.steps()).extracting(Step::getStatus).containsExactly(
                StepStatus.SUCCEEDED, StepStatus.SUCCEEDED, StepStatus.SUCCEEDED,
                StepStatus.FAILED,
                StepStatus.SKIPPED, StepStatus.SKIPPED, StepStatus.SKIPPED);

        // permanent errors are never retried and nothing after the failure touches the platform
        assertThat(kit.platform.calls("createCategory")).isEqualTo(1);
        assertThat(kit.platform.calls("createChannel")).isZero();
        assertThat(kit.platform.calls("createMessage")).isZero();

        assertThat(sink.last())
                .startsWith("**❌ Overhaul failed at step 4 of 7**")
                .contains("Error: Missing Permissions")
                .contains("42%");
    }

    @Test
    void testExecute_BotMissingGuildPermission_FailsFirstStepWithoutMutation() {
        // GIVEN
        kit.platform.revokeSelfPermission(GUILD_ID, GuildPermission.MANAGE_CHANNELS);
        RecordingProgressSink sink = new RecordingProgressSink();

        // WHEN
        RunResult result = freshRun(sink);

        // THEN
        assertThat(result.outcome()).isEqualTo(RunResult.Outcome.FAILED);
        assertThat(result.steps()).hasSize(7);
        assertThat(result.getFailedStep()).map(Step::getId).contains(1);
        assertThat(result.errorMessage()).isEqualTo("Bot missing permissions: [MANAGE_CHANNELS]");
        assertThat(kit.platform.calls("getSelfPermissions")).isEqualTo(1);
        assertThat(kit.platform.mutationCount()).isZero();
        assertThat(sink.last()).startsWith("**❌ Overhaul failed at step 1 of 7**");
    }

    @Test
    void testExecute_RateLimitedOnce_RetriesAndCompletes() {
        // GIVEN
        kit.platform.failNext("createCategory", TransientRemoteException.rateLimited(Duration.ofMillis(5)));

        // WHEN
        RunResult result = freshRun(new RecordingProgressSink());

        // THEN
        assertThat(result.outcome()).isEqualTo(RunResult.Outcome.COMPLETED);
        assertThat(kit.platform.calls("createCategory")).isEqualTo(3);
        assertThat(kit.platform.listChannels(GUILD_ID))
                .filteredOn(ChannelSnapshot::isCategory)
                .hasSize(2);
    }

    @Test
    void testExecute_TransientFailuresExhaustRetries_FailsStep() {
        // GIVEN
        kit.platform.failAlways("createRole", new TransientRemoteException("503 Service Unavailable", (Duration) null));

        // WHEN
        RunResult result = freshRun(new RecordingProgressSink());

        // THEN
        assertThat(result.outcome()).isEqualTo(RunResult.Outcome.FAILED);
        assertThat(result.getFailedStep()).map(Step::getId).contains(2);
        assertThat(result.errorMessage()).isEqualTo("503 Service Unavailable");
        assertThat(kit.platform.calls("createRole")).isEqualTo(GuardianTestKit.MAX_ATTEMPTS);
    }

    @Test
    void testExecute_CancelledAfterSecondStep_SkipsTheRest() {
        // GIVEN: cancellation requested while step 2 is reported
        CancelToken cancel = new CancelToken();
        RecordingProgressSink sink = new RecordingProgressSink(text -> {
            if (text.contains("Progress: 2/7")) {
                cancel.cancel();
            }
        });

        // WHEN
        RunResult result = run(false, KnownState.empty(), cancel, sink);

        // THEN
        assertThat(result.isCancelled()).isTrue();
        assertThat(result.completedSteps()).isEqualTo(2);
        assertThat(result.steps()).extracting(Step::getStatus).containsExactly(
                StepStatus.SUCCEEDED, StepStatus.SUCCEEDED,
                StepStatus.SKIPPED, StepStatus.SKIPPED, StepStatus.SKIPPED, StepStatus.SKIPPED, StepStatus.SKIPPED);
        assertThat(kit.platform.calls("reorderRoles")).isZero();
        assertThat(sink.last()).startsWith("**⏹️ Overhaul cancelled at step 2 of 7**");
    }

    @Test
    void testRepair_AfterCompletedRun_MakesNoMutations() {
        // GIVEN
        freshRun(new RecordingProgressSink());
        int mutationsAfterOverhaul = kit.platform.mutationCount();
        int tierWrites = kit.tiers.replaceCount();

        // WHEN: repaired twice
        RunResult first = repairRun();
        RunResult second = repairRun();

        // THEN
        assertThat(first.outcome()).isEqualTo(RunResult.Outcome.COMPLETED);
        assertThat(second.outcome()).isEqualTo(RunResult.Outcome.COMPLETED);
        assertThat(kit.platform.mutationCount()).isEqualTo(mutationsAfterOverhaul);
        assertThat(kit.tiers.replaceCount()).isEqualTo(tierWrites);
        assertThat(second.summary()).startsWith("Created 0, reused");
    }

    @Test
    void testRepair_DeletedChannel_IsRecreatedOnce() {
        // GIVEN
        freshRun(new RecordingProgressSink());
        kit.platform.deleteChannel(GUILD_ID, channel("general").id());
        int channelsCreated = kit.platform.calls("createChannel");

        // WHEN
        RunResult result = repairRun();
        repairRun();

        // THEN
        assertThat(result.outcome()).isEqualTo(RunResult.Outcome.COMPLETED);
        assertThat(result.summary()).startsWith("Created 1, reused");
        assertThat(kit.platform.calls("createChannel")).isEqualTo(channelsCreated + 1);
        assertThat(kit.platform.listChannels(GUILD_ID)).filteredOn(c -> c.name().equals("general")).hasSize(1);
    }

    @Test
    void testRepair_ChangedOverwrites_AreRestored() {
        // GIVEN
        freshRun(new RecordingProgressSink());
        ChannelSnapshot staffRoom = channel("staff-room");
        kit.platform.setChannelOverwrites(GUILD_ID, staffRoom.id(), List.of());

        // WHEN
        repairRun();

        // THEN
        assertThat(channel("staff-room").overwrites()).containsExactlyInAnyOrderElementsOf(staffRoom.overwrites());
    }

    @Test
    void testExecute_RestrictedChannels_GetDerivedOverwrites() {
        // WHEN
        freshRun(new RecordingProgressSink());

        // THEN: staff-only hides the channel from everyone but protected roles
        assertThat(channel("staff-room").overwrites()).containsExactlyInAnyOrder(
                PermissionOverwrite.deny(GUILD_ID, ChannelPermission.VIEW_CHANNEL),
                PermissionOverwrite.allow(roleId("Admin"), ChannelPermission.VIEW_CHANNEL));

        // tier 5 posting: silenced for everyone, open to Silver and above and to staff
        assertThat(channel("media").overwrites()).containsExactlyInAnyOrder(
                PermissionOverwrite.deny(GUILD_ID, ChannelPermission.SEND_MESSAGES),
                PermissionOverwrite.allow(roleId("Silver"), ChannelPermission.SEND_MESSAGES),
                PermissionOverwrite.allow(roleId("Gold"), ChannelPermission.SEND_MESSAGES),
                PermissionOverwrite.allow(roleId("Admin"), ChannelPermission.SEND_MESSAGES));

        assertThat(channel("general").overwrites()).isEmpty();
    }

    @Test
    void testExecute_RecordsCreatedIdentifiers() {
        // WHEN
        freshRun(new RecordingProgressSink());

        // THEN
        KnownState reloaded = kit.knownStateLoader.load(GUILD_ID);
        assertThat(reloaded.roles()).hasSize(5);
        assertThat(reloaded.categories()).containsKeys("INFO", "COMMUNITY");
        assertThat(reloaded.channel("COMMUNITY", "media")).contains(channel("media").id());
        assertThat(kit.remoteState.findByGuild(GUILD_ID)).hasSize(12);
    }
}
