package com.example.guardianservice.overhaul.execution;

import com.example.guardianservice.overhaul.plan.Step;

/**
 * Performs the remote work of one kind of step.
 * Implementations must be safe to re-run: anything already present in the run's
 * {@link KnownState} is reused instead of created again.
 */
public interface StepHandler {

    boolean supports(Step step);

    /**
     * @throws com.example.guardianservice.exception.RemoteApiException when the platform rejects
     *         the work or transient retries are exhausted; aborts the run
     */
    void execute(Step step, RunContext context);
}
