package com.example.guardianservice.overhaul.execution;

import com.example.guardianservice.overhaul.plan.Step;
import com.example.guardianservice.overhaul.plan.StepKind;
import com.example.guardianservice.overhaul.plan.StepPayload;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class StructureStepHandler implements StepHandler {

    private final StructureApplier structureApplier;

    @Override
    public boolean supports(Step step) {
        return step.getKind() == StepKind.STRUCTURE_CREATE;
    }

    @Override
    public void execute(Step step, RunContext context) {
        structureApplier.apply((StepPayload.Structure) step.getPayload(), context);
    }
}
