package com.example.guardianservice.overhaul.plan;

import com.example.guardianservice.overhaul.model.CategoryTemplate;
import com.example.guardianservice.overhaul.model.ConfigurationModel;
import com.example.guardianservice.overhaul.model.ConfigurationValidator;
import com.example.guardianservice.overhaul.model.FeatureFlag;
import com.example.guardianservice.overhaul.model.RoleTemplate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Expands a configuration into the ordered step list of one overhaul run.
 * <p>
 * Steps follow a fixed precedence: settings, role creation, role ordering, structure,
 * leveling, one step per enabled module, finalize. Disabled features produce no step at all,
 * so the step count is always {@link #BASE_STEP_COUNT} plus one per enabled feature.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OverhaulPlanner {

    public static final int BASE_STEP_COUNT = 5;

    private final ConfigurationValidator validator;

    /**
     * @throws com.example.guardianservice.exception.ConfigurationValidationException
     *         if the configuration breaks an invariant; nothing is planned in that case
     */
    public List<Step> plan(ConfigurationModel config) {
        validator.validate(config).throwIfInvalid();

        List<Step> steps = new ArrayList<>();
        StepPayload.Structure structure = new StepPayload.Structure(
                config.categoryTemplates(), config.roleTemplates(), config.tierTemplates());

        add(steps, StepKind.SETTINGS, "Applying server settings",
                Set.of(), new StepPayload.Settings(config.identity()));
        Step roles = add(steps, StepKind.ROLE_CREATE, "Creating roles",
                Set.of(), new StepPayload.RoleCreation(config.roleTemplates()));
        add(steps, StepKind.ROLE_ORDER, "Ordering role hierarchy",
                Set.of(roles.getId()), new StepPayload.RoleOrder(orderedRoles(config)));
        Step structureStep = add(steps, StepKind.STRUCTURE_CREATE, "Creating categories and channels",
                Set.of(roles.getId()), structure);

        List<CategoryTemplate> expected = new ArrayList<>(config.categoryTemplates());
        for (FeatureFlag feature : FeatureFlag.values()) {
            if (!config.isEnabled(feature)) {
                continue;
            }
            if (feature == FeatureFlag.LEVELING) {
                add(steps, StepKind.LEVELING_SETUP, ModuleLayouts.labelFor(feature),
                        Set.of(roles.getId()), new StepPayload.LevelingSetup(config.tierTemplates()));
                continue;
            }
            List<CategoryTemplate> layout = ModuleLayouts.layoutFor(feature, config);
            expected.addAll(layout);
            add(steps, StepKind.MODULE_SETUP, ModuleLayouts.labelFor(feature),
                    Set.of(roles.getId(), structureStep.getId()),
                    new StepPayload.ModuleSetup(feature,
                            new StepPayload.Structure(layout, config.roleTemplates(), config.tierTemplates())));
        }

        Set<Integer> everything = new HashSet<>();
        steps.forEach(step -> everything.add(step.getId()));
        add(steps, StepKind.FINALIZE, "Finalizing", everything, new StepPayload.Finalize(expected));

        log.info("Planned overhaul: steps={} features={}", steps.size(), config.featureFlags());
        return List.copyOf(steps);
    }

    /**
     * Roles the hierarchy step moves. With {@code preserveStaffRoles} protected roles keep
     * whatever position they already have.
     */
    private static List<String> orderedRoles(ConfigurationModel config) {
        boolean preserveStaff = config.safetyOptions().preserveStaffRoles();
        return config.roleTemplates().stream()
                .filter(role -> !(preserveStaff && role.protectedRole()))
                .map(RoleTemplate::name)
                .toList();
    }

    private static Step add(List<Step> steps, StepKind kind, String label, Set<Integer> dependsOn,
                            StepPayload payload) {
        Step step = new Step(steps.size() + 1, kind, label, dependsOn, payload);
        steps.add(step);
        return step;
    }
}
