package com.example.guardianservice.overhaul.progress;

import com.example.guardianservice.config.OverhaulSettings;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Keeps the single status artifact of one run up to date.
 * <p>
 * Each write is tagged with the completed-step count; a write whose tag is not greater than the
 * last committed one is dropped, so a late update can never overwrite newer progress. The
 * terminal write is tagged above every step index. A run therefore produces at most one
 * initial write, one per step and one final write.
 * <p>
 * Sink failures are logged and never abort the run.
 */
@Slf4j
public class ProgressReporter {

    private final ProgressSink sink;
    private final Clock clock;
    private final OverhaulSettings settings;
    private final int totalSteps;
    private final Instant startedAt;

    private int lastCommittedTag = -1;
    private ProgressState state;

    public ProgressReporter(ProgressSink sink, Clock clock, OverhaulSettings settings, int totalSteps) {
        this.sink = sink;
        this.clock = clock;
        this.settings = settings;
        this.totalSteps = totalSteps;
        this.startedAt = clock.instant();
    }

    public void started(String firstLabel) {
        update(running(0, firstLabel), null);
    }

    public void stepCompleted(int completedSteps, String nextLabel) {
        update(running(completedSteps, nextLabel), null);
    }

    public void completed(String summary) {
        update(new ProgressState(totalSteps, totalSteps, "Done", startedAt, null, false,
                ProgressState.Phase.COMPLETED), summary);
    }

    /**
     * @param stepNumber one-based position of the failed step
     */
    public void failed(int stepNumber, String stepLabel, String error) {
        update(new ProgressState(stepNumber, totalSteps, stepLabel, startedAt, error, false,
                ProgressState.Phase.FAILED), null);
    }

    public void cancelled(int completedSteps) {
        update(new ProgressState(completedSteps, totalSteps, "Cancelled", startedAt, null, true,
                ProgressState.Phase.CANCELLED), null);
    }

    /**
     * Commits the state unless a newer or equal tag has already been committed.
     *
     * @return whether the update was written
     */
    public synchronized boolean update(ProgressState next, String summary) {
        int tag = next.isTerminal() ? totalSteps + 1 : next.currentStepIndex();
        if (tag <= lastCommittedTag) {
            log.debug("Dropping stale progress update: tag={} lastCommitted={}", tag, lastCommittedTag);
            return false;
        }
        lastCommittedTag = tag;
        state = next;
        Duration elapsed = Duration.between(startedAt, clock.instant());
        String text = ProgressRenderer.render(next, elapsed, settings.barWidth(), settings.statusTextLimit(), summary);
        try {
            sink.publish(text);
        } catch (RuntimeException e) {
            log.warn("Status update failed (run continues): tag={} error={}", tag, e.getMessage());
        }
        return true;
    }

    public synchronized ProgressState getState() {
        return state;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    private ProgressState running(int completed, String label) {
        return new ProgressState(completed, totalSteps, label, startedAt, null, false, ProgressState.Phase.RUNNING);
    }
}
