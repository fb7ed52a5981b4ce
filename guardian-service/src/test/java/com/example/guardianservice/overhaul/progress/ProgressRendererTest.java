package com.example.guardianservice.overhaul.progress;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressRendererTest {

    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    private static ProgressState running(int done, int total, String label) {
        return new ProgressState(done, total, label, START, null, false, ProgressState.Phase.RUNNING);
    }

    @Test
    void runningState_ShowsCountLabelBarAndElapsed() {
        String text = ProgressRenderer.render(running(3, 7, "Creating categories and channels"),
                Duration.ofMillis(4200), 10, 1900, null);

        assertThat(text).isEqualTo("**🛠️ Server overhaul in progress**\n"
                + "Progress: 3/7 steps\n"
                + "Current: Creating categories and channels\n"
                + "`████░░░░░░` 42%\n"
                + "Elapsed: 4.2s");
    }

    @Test
    void failedState_CountsOnlyStepsBeforeTheFailure() {
        ProgressState failed = new ProgressState(4, 7, "Creating categories and channels", START,
                "Missing Permissions", false, ProgressState.Phase.FAILED);

        String text = ProgressRenderer.render(failed, Duration.ofSeconds(75), 20, 1900, null);

        assertThat(failed.percentage()).isEqualTo(42);
        assertThat(text)
                .startsWith("**❌ Overhaul failed at step 4 of 7**\n")
                .contains("Error: Missing Permissions")
                .endsWith("Elapsed: 1m 15s");
    }

    @Test
    void completedState_AppendsSummary() {
        ProgressState done = new ProgressState(5, 5, "Done", START, null, false, ProgressState.Phase.COMPLETED);

        String text = ProgressRenderer.render(done, Duration.ofSeconds(2), 4, 1900, "Created 3, reused 0 resources.");

        assertThat(text).contains("`████` 100%").endsWith("\n\nCreated 3, reused 0 resources.");
    }

    @Test
    void percentage_FloorsAndHandlesEmptyPlans() {
        assertThat(running(1, 3, "x").percentage()).isEqualTo(33);
        assertThat(running(2, 3, "x").percentage()).isEqualTo(66);
        assertThat(running(0, 0, "x").percentage()).isEqualTo(100);
    }

    @Test
    void bar_NeverExceedsWidth() {
        assertThat(ProgressRenderer.bar(0, 5)).isEqualTo("░░░░░");
        assertThat(ProgressRenderer.bar(100, 5)).isEqualTo("█████");
        assertThat(ProgressRenderer.bar(150, 5)).hasSize(5);
    }

    @Test
    void longText_IsTruncatedWithMarker() {
        String summary = "x".repeat(500);
        ProgressState done = new ProgressState(5, 5, "Done", START, null, false, ProgressState.Phase.COMPLETED);

        String text = ProgressRenderer.render(done, Duration.ZERO, 20, 200, summary);

        assertThat(text).hasSize(200).endsWith(ProgressRenderer.TRUNCATION_MARKER);
        assertThat(ProgressRenderer.truncate("short", 200)).isEqualTo("short");
    }
}
