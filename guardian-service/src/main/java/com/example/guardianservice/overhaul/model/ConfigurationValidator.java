package com.example.guardianservice.overhaul.model;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks every invariant of a {@link ConfigurationModel} without touching the remote platform.
 * All violations are collected, not just the first one.
 */
@Component
public class ConfigurationValidator {

    public static final int MAX_ROLES = 250;
    public static final int MAX_CHANNELS = 500;
    public static final int MAX_CHANNELS_PER_CATEGORY = 50;
    public static final int MAX_NAME_LENGTH = 100;

    public ValidationResult validate(ConfigurationModel config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            return new ValidationResult(List.of("Configuration is missing"));
        }

        validateIdentity(config.identity(), errors);
        Set<String> roleNames = validateRoles(config.roleTemplates(), errors);
        Set<Integer> tierLevels = validateTiers(config, roleNames, errors);
        validateStructure(config.categoryTemplates(), roleNames, tierLevels, errors);

        return new ValidationResult(errors);
    }

    private void validateIdentity(IdentitySettings identity, List<String> errors) {
        if (identity == null) {
            errors.add("Identity settings are missing");
            return;
        }
        checkName("Server name", identity.name(), errors);
        if (identity.verificationTier() == null) {
            errors.add("Verification tier is missing");
        }
        if (identity.contentFilterTier() == null) {
            errors.add("Content filter tier is missing");
        }
        if (identity.notificationDefault() == null) {
            errors.add("Notification default is missing");
        }
    }

    private Set<String> validateRoles(List<RoleTemplate> roles, List<String> errors) {
        Set<String> names = new HashSet<>();
        if (roles.size() > MAX_ROLES) {
            errors.add("Role count " + roles.size() + " exceeds platform limit of " + MAX_ROLES);
        }
        for (RoleTemplate role : roles) {
            if (!checkName("Role name", role.name(), errors)) {
                continue;
            }
            if (!names.add(normalize(role.name()))) {
                errors.add("Duplicate role name: " + role.name());
            }
        }
        return names;
    }

    private Set<Integer> validateTiers(ConfigurationModel config, Set<String> roleNames, List<String> errors) {
        Set<Integer> levels = new HashSet<>();
        List<TierTemplate> tiers = config.tierTemplates();
        if (config.isEnabled(FeatureFlag.LEVELING) && tiers.isEmpty()) {
            errors.add("Leveling is enabled but no tiers are defined");
        }
        if (config.isEnabled(FeatureFlag.VIP_LOUNGE)
                && !roleNames.contains(normalize(ConfigurationTemplates.VIP_ROLE))) {
            errors.add("VIP lounge is enabled but no " + ConfigurationTemplates.VIP_ROLE + " role is defined");
        }
        TierTemplate previous = null;
        for (TierTemplate tier : tiers) {
            if (tier.threshold() < 0) {
                errors.add("Tier " + tier.level() + " has a negative threshold");
            }
            if (previous != null) {
                if (tier.threshold() <= previous.threshold()) {
                    errors.add(String.format("Tier thresholds must be strictly increasing: %d after %d",
                            tier.threshold(), previous.threshold()));
                }
                if (tier.level() <= previous.level()) {
                    errors.add(String.format("Tier levels must be strictly increasing: %d after %d",
                            tier.level(), previous.level()));
                }
            }
            if (tier.roleName() == null || !roleNames.contains(normalize(tier.roleName()))) {
                errors.add("Tier " + tier.level() + " references unknown role: " + tier.roleName());
            }
            levels.add(tier.level());
            previous = tier;
        }
        return levels;
    }

    private void validateStructure(List<CategoryTemplate> categories, Set<String> roleNames,
                                   Set<Integer> tierLevels, List<String> errors) {
        Set<String> categoryNames = new HashSet<>();
        int totalChannels = categories.size();
        for (CategoryTemplate category : categories) {
            if (!checkName("Category name", category.name(), errors)) {
                continue;
            }
            if (!categoryNames.add(normalize(category.name()))) {
                errors.add("Duplicate category name: " + category.name());
            }
            if (category.channels().size() > MAX_CHANNELS_PER_CATEGORY) {
                errors.add("Category " + category.name() + " has more than " + MAX_CHANNELS_PER_CATEGORY + " channels");
            }
            totalChannels += category.channels().size();

            for (Map.Entry<String, Boolean> rule : category.visibility().entrySet()) {
                String roleName = rule.getKey();
                if (!CategoryTemplate.EVERYONE.equals(roleName) && !roleNames.contains(normalize(roleName))) {
                    errors.add("Category " + category.name() + " grants visibility to unknown role: " + roleName);
                }
            }

            Set<String> channelNames = new HashSet<>();
            for (ChannelTemplate channel : category.channels()) {
                if (!checkName("Channel name", channel.name(), errors)) {
                    continue;
                }
                if (channel.kind() == null) {
                    errors.add("Channel " + channel.name() + " has no kind");
                }
                if (!channelNames.add(normalize(channel.name()))) {
                    errors.add("Duplicate channel name in " + category.name() + ": " + channel.name());
                }
                if (channel.minimumTierToPost() != null && !tierLevels.contains(channel.minimumTierToPost())) {
                    errors.add("Channel " + channel.name() + " requires unknown tier " + channel.minimumTierToPost());
                }
            }
        }
        if (totalChannels > MAX_CHANNELS) {
            errors.add("Channel count " + totalChannels + " exceeds platform limit of " + MAX_CHANNELS);
        }
    }

    private boolean checkName(String what, String name, List<String> errors) {
        if (name == null || name.isBlank()) {
            errors.add(what + " must not be blank");
            return false;
        }
        if (name.length() > MAX_NAME_LENGTH) {
            errors.add(what + " too long (max " + MAX_NAME_LENGTH + "): " + name);
            return false;
        }
        return true;
    }

    /**
     * Names compare after Unicode NFC normalization and trimming, the same way the remote
     * platform echoes them back.
     */
    public static String normalize(String name) {
        return name == null ? "" : Normalizer.normalize(name, Normalizer.Form.NFC).strip();
    }
}
