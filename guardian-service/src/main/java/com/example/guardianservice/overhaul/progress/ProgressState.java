package com.example.guardianservice.overhaul.progress;

import java.time.Instant;

/**
 * Snapshot of a run's progress as shown on the status message.
 *
 * @param currentStepIndex number of completed steps when running; for a terminal phase, the step
 *                         the run stopped at (failed) or the completed count (cancelled, completed)
 */
public record ProgressState(
        int currentStepIndex,
        int totalSteps,
        String stepLabel,
        Instant startedAt,
        String lastError,
        boolean cancelled,
        Phase phase
) {
    public int percentage() {
        if (totalSteps <= 0) {
            return 100;
        }
        int completed = phase == Phase.FAILED ? currentStepIndex - 1 : currentStepIndex;
        return (int) Math.floor(100.0 * completed / totalSteps);
    }

    public boolean isTerminal() {
        return phase != Phase.RUNNING;
    }

    public enum Phase {
        RUNNING,
        COMPLETED,
        FAILED,
        CANCELLED
    }
}
