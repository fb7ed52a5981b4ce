package com.example.guardianservice.overhaul.model;

import com.example.guardianservice.exception.ConfigurationValidationException;
import com.example.guardianservice.overhaul.ScenarioConfigurations;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class ConfigurationValidatorTest {

    private final ConfigurationValidator validator = new ConfigurationValidator();

    @Test
    void standardTemplate_WithEveryFeature_IsValid() {
        ConfigurationModel config = ConfigurationTemplates.standard("Guardian", EnumSet.allOf(FeatureFlag.class));

        ValidationResult result = validator.validate(config);

        assertThat(result.errors()).isEmpty();
        assertThat(result.isOk()).isTrue();
    }

    @Test
    void duplicateRoleNames_AfterNormalization_AreRejected() {
        ConfigurationModel config = ScenarioConfigurations.community(EnumSet.noneOf(FeatureFlag.class)).toBuilder()
                .roleTemplates(List.of(
                        RoleTemplate.plain("Member", 1),
                        RoleTemplate.plain(" Member ", 2),
                        RoleTemplate.plain("Bronze", 3),
                        RoleTemplate.plain("Silver", 4),
                        RoleTemplate.plain("Gold", 5),
                        RoleTemplate.staff("Admin", 6)))
                .build();

        assertThat(validator.validate(config).errors())
                .anySatisfy(error -> assertThat(error).startsWith("Duplicate role name"));
    }

    @Test
    void nonIncreasingTierThresholds_AreRejected() {
        ConfigurationModel config = ScenarioConfigurations.community(EnumSet.of(FeatureFlag.LEVELING)).toBuilder()
                .tierTemplates(List.of(
                        new TierTemplate(1, 0, "Bronze", List.of()),
                        new TierTemplate(5, 500, "Silver", List.of()),
                        new TierTemplate(10, 500, "Gold", List.of())))
                .build();

        assertThat(validator.validate(config).errors())
                .containsExactly("Tier thresholds must be strictly increasing: 500 after 500");
    }

    @Test
    void levelingWithoutTiers_IsRejected() {
        ConfigurationModel config = ScenarioConfigurations.community(EnumSet.of(FeatureFlag.LEVELING)).toBuilder()
                .tierTemplates(List.of())
                .categoryTemplates(List.of(CategoryTemplate.open("INFO", List.of(ChannelTemplate.text("rules")))))
                .build();

        assertThat(validator.validate(config).errors())
                .containsExactly("Leveling is enabled but no tiers are defined");
    }

    @Test
    void structureReferences_ToUnknownRolesAndTiers_AreRejected() {
        ConfigurationModel config = ScenarioConfigurations.community(EnumSet.noneOf(FeatureFlag.class)).toBuilder()
                .categoryTemplates(List.of(
                        new CategoryTemplate("SECRET", List.of(
                                new ChannelTemplate("vault", ChannelKind.TEXT, 99, false),
                                ChannelTemplate.text("vault")),
                                Map.of("Ghost", true))))
                .build();

        assertThat(validator.validate(config).errors()).containsExactlyInAnyOrder(
                "Category SECRET grants visibility to unknown role: Ghost",
                "Channel vault requires unknown tier 99",
                "Duplicate channel name in SECRET: vault");
    }

    @Test
    void tooManyRoles_ExceedPlatformLimit() {
        List<RoleTemplate> roles = new ArrayList<>();
        for (int i = 0; i <= ConfigurationValidator.MAX_ROLES; i++) {
            roles.add(RoleTemplate.plain("role-" + i, 0));
        }
        ConfigurationModel config = ConfigurationModel.builder()
                .identity(IdentitySettings.of("Big"))
                .roleTemplates(roles)
                .build();

        assertThat(validator.validate(config).errors())
                .containsExactly("Role count 251 exceeds platform limit of 250");
    }

    @Test
    void throwIfInvalid_CarriesEveryViolation() {
        ConfigurationModel config = ConfigurationModel.builder()
                .identity(IdentitySettings.of(" "))
                .roleTemplates(List.of(RoleTemplate.plain("A", 0), RoleTemplate.plain("A", 0)))
                .build();

        ConfigurationValidationException thrown = catchThrowableOfType(
                () -> validator.validate(config).throwIfInvalid(), ConfigurationValidationException.class);

        assertThat(thrown).isNotNull();
        assertThat(thrown.getViolations())
                .containsExactly("Server name must not be blank", "Duplicate role name: A");
    }

    @Test
    void featureFlags_ParseFromFreeText_AndRejectUnknownTokens() {
        assertThat(FeatureFlag.parse("leveling, reactionRoles, vip-lounge"))
                .containsExactlyInAnyOrder(FeatureFlag.LEVELING, FeatureFlag.REACTION_ROLES, FeatureFlag.VIP_LOUNGE);
        assertThat(FeatureFlag.parse("  ")).isEmpty();

        assertThatThrownBy(() -> FeatureFlag.parse("leveling,starboard"))
                .isInstanceOf(ConfigurationValidationException.class)
                .hasMessageContaining("starboard");
    }

    @Test
    void fingerprint_IgnoresFlagSetOrder_ButTracksContent() {
        ConfigurationModel a = ConfigurationTemplates.standard("G", EnumSet.of(FeatureFlag.GAMING, FeatureFlag.LEVELING));
        ConfigurationModel b = ConfigurationTemplates.standard("G", EnumSet.of(FeatureFlag.LEVELING, FeatureFlag.GAMING));
        ConfigurationModel renamed = ConfigurationTemplates.standard("Other", EnumSet.of(FeatureFlag.LEVELING, FeatureFlag.GAMING));

        assertThat(a.fingerprint()).isEqualTo(b.fingerprint());
        assertThat(a.fingerprint()).isNotEqualTo(renamed.fingerprint());
    }
}
