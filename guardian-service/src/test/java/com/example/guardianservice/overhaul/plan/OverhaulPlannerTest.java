package com.example.guardianservice.overhaul.plan;

import com.example.guardianservice.exception.ConfigurationValidationException;
import com.example.guardianservice.overhaul.ScenarioConfigurations;
import com.example.guardianservice.overhaul.model.CategoryTemplate;
import com.example.guardianservice.overhaul.model.ConfigurationModel;
import com.example.guardianservice.overhaul.model.ConfigurationTemplates;
import com.example.guardianservice.overhaul.model.ConfigurationValidator;
import com.example.guardianservice.overhaul.model.FeatureFlag;
import com.example.guardianservice.overhaul.model.SafetyOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Step expansion rules: fixed precedence, one step per enabled feature, nothing for disabled ones.
 */
class OverhaulPlannerTest {

    private final OverhaulPlanner planner = new OverhaulPlanner(new ConfigurationValidator());

    @Test
    void testPlan_LevelingAndReactionRoles_ProducesSevenOrderedSteps() {
        // GIVEN: 5 roles, 2 categories, 5 channels, leveling + reaction roles
        ConfigurationModel config = ScenarioConfigurations.levelingAndReactionRoles();

        // WHEN
        List<Step> steps = planner.plan(config);

        // THEN
        assertThat(steps).extracting(Step::getKind).containsExactly(
                StepKind.SETTINGS,
                StepKind.ROLE_CREATE,
                StepKind.ROLE_ORDER,
                StepKind.STRUCTURE_CREATE,
                StepKind.LEVELING_SETUP,
                StepKind.MODULE_SETUP,
                StepKind.FINALIZE);
        assertThat(steps).extracting(Step::getId).containsExactly(1, 2, 3, 4, 5, 6, 7);
        assertThat(steps).allMatch(step -> step.getStatus() == StepStatus.PENDING);

        StepPayload.Structure structure = (StepPayload.Structure) steps.get(3).getPayload();
        assertThat(structure.categories()).hasSize(2);
        assertThat(structure.categories().stream().mapToInt(c -> c.channels().size()).sum()).isEqualTo(5);

        StepPayload.ModuleSetup module = (StepPayload.ModuleSetup) steps.get(5).getPayload();
        assertThat(module.feature()).isEqualTo(FeatureFlag.REACTION_ROLES);
        assertThat(module.layout().categories()).isEmpty();
    }

    @Test
    void testPlan_PreserveStaffRoles_LeavesStaffOutOfRoleOrder() {
        // GIVEN: Admin is a staff role, staff roles preserved by default
        ConfigurationModel preserving = ScenarioConfigurations.levelingAndReactionRoles();
        ConfigurationModel reordering = preserving.toBuilder()
                .safetyOptions(new SafetyOptions(false, false))
                .build();

        // WHEN
        StepPayload.RoleOrder preserved = (StepPayload.RoleOrder) planner.plan(preserving).get(2).getPayload();
        StepPayload.RoleOrder all = (StepPayload.RoleOrder) planner.plan(reordering).get(2).getPayload();

        // THEN
        assertThat(preserved.roleNames()).containsExactly("Gold", "Silver", "Bronze", "Member");
        assertThat(all.roleNames()).containsExactly("Admin", "Gold", "Silver", "Bronze", "Member");
    }

    @Test
    void testPlan_NoFeatures_ProducesOnlyBaseSteps() {
        List<Step> steps = planner.plan(ScenarioConfigurations.community(EnumSet.noneOf(FeatureFlag.class)));

        assertThat(steps).hasSize(OverhaulPlanner.BASE_STEP_COUNT);
        assertThat(steps).extracting(Step::getKind)
                .doesNotContain(StepKind.LEVELING_SETUP, StepKind.MODULE_SETUP);
    }

    @ParameterizedTest
    @EnumSource(FeatureFlag.class)
    void testPlan_EachFeature_AddsExactlyOneStep(FeatureFlag flag) {
        ConfigurationModel config = ConfigurationTemplates.standard("Guardian", EnumSet.of(flag));

        assertThat(planner.plan(config)).hasSize(OverhaulPlanner.BASE_STEP_COUNT + 1);
    }

    @Test
    void testPlan_AllFeatures_ModulesFollowDeclarationOrder() {
        ConfigurationModel config = ConfigurationTemplates.standard("Guardian", EnumSet.allOf(FeatureFlag.class));

        List<Step> steps = planner.plan(config);

        assertThat(steps).hasSize(OverhaulPlanner.BASE_STEP_COUNT + FeatureFlag.values().length);
        assertThat(steps).extracting(Step::getLabel).containsSubsequence(
                "Configuring level rewards",
                "Publishing reaction-role panel",
                "Creating welcome channel",
                "Creating VIP lounge",
                "Creating gaming category",
                "Finalizing");
    }

    @Test
    void testPlan_FinalizeExpectsModuleLayouts() {
        ConfigurationModel config = ConfigurationTemplates.standard("Guardian", EnumSet.of(FeatureFlag.GAMING));

        Step finalize = planner.plan(config).get(5);

        assertThat(finalize.getKind()).isEqualTo(StepKind.FINALIZE);
        StepPayload.Finalize payload = (StepPayload.Finalize) finalize.getPayload();
        assertThat(payload.expected()).extracting(CategoryTemplate::name)
                .containsExactly("INFORMATION", "GENERAL", "VOICE", "STAFF", "GAMING");
        assertThat(finalize.getDependsOn()).containsExactlyInAnyOrder(1, 2, 3, 4, 5);
    }

    @Test
    void testPlan_InvalidConfiguration_PlansNothing() {
        ConfigurationModel config = ScenarioConfigurations.community(EnumSet.of(FeatureFlag.LEVELING)).toBuilder()
                .tierTemplates(List.of())
                .build();

        assertThatThrownBy(() -> planner.plan(config))
                .isInstanceOf(ConfigurationValidationException.class);
    }

    @Test
    void testStep_TerminalStatus_CannotChange() {
        Step step = planner.plan(ScenarioConfigurations.community(EnumSet.noneOf(FeatureFlag.class))).get(0);

        step.markRunning();
        step.markFailed("boom");

        assertThat(step.getError()).isEqualTo("boom");
        assertThatThrownBy(step::markSucceeded).isInstanceOf(IllegalStateException.class);
    }
}
