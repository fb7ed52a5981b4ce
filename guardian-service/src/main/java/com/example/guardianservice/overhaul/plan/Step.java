package com.example.guardianservice.overhaul.plan;

import lombok.Getter;

import java.util.Set;

/**
 * One unit of planned remote work. Created by the planner; status changes only through the
 * step executor. Lives for the duration of one run.
 */
@Getter
public class Step {

    private final int id;
    private final StepKind kind;
    private final String label;
    private final Set<Integer> dependsOn;
    private final StepPayload payload;

    private volatile StepStatus status = StepStatus.PENDING;
    private volatile String error;

    public Step(int id, StepKind kind, String label, Set<Integer> dependsOn, StepPayload payload) {
        this.id = id;
        this.kind = kind;
        this.label = label;
        this.dependsOn = Set.copyOf(dependsOn);
        this.payload = payload;
    }

    public void markRunning() {
        transition(StepStatus.RUNNING);
    }

    public void markSucceeded() {
        transition(StepStatus.SUCCEEDED);
    }

    public void markFailed(String error) {
        transition(StepStatus.FAILED);
        this.error = error;
    }

    public void markSkipped() {
        transition(StepStatus.SKIPPED);
    }

    private void transition(StepStatus next) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Step " + id + " already " + status + ", cannot become " + next);
        }
        status = next;
    }

    @Override
    public String toString() {
        return "Step{" + id + " " + kind.key() + " '" + label + "' " + status + "}";
    }
}
