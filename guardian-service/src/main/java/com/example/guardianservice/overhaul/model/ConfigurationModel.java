package com.example.guardianservice.overhaul.model;

import lombok.Builder;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Set;

/**
 * Declarative end state of a guild. Immutable; owned by the caller for one run.
 */
@Builder(toBuilder = true)
public record ConfigurationModel(
        IdentitySettings identity,
        List<RoleTemplate> roleTemplates,
        List<CategoryTemplate> categoryTemplates,
        List<TierTemplate> tierTemplates,
        Set<FeatureFlag> featureFlags,
        SafetyOptions safetyOptions
) {
    public ConfigurationModel {
        roleTemplates = roleTemplates == null ? List.of() : List.copyOf(roleTemplates);
        categoryTemplates = categoryTemplates == null ? List.of() : List.copyOf(categoryTemplates);
        tierTemplates = tierTemplates == null ? List.of() : List.copyOf(tierTemplates);
        featureFlags = featureFlags == null || featureFlags.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(featureFlags));
        safetyOptions = safetyOptions == null ? SafetyOptions.defaults() : safetyOptions;
    }

    public boolean isEnabled(FeatureFlag flag) {
        return featureFlags.contains(flag);
    }

    public boolean isTierRole(String roleName) {
        return tierTemplates.stream().anyMatch(t -> t.roleName().equals(roleName));
    }

    /**
     * Stable digest binding a confirmation token to this exact configuration.
     */
    public String fingerprint() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(canonicalForm().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash, 0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private String canonicalForm() {
        // feature flags rendered in declaration order so set iteration order never matters
        StringBuilder flags = new StringBuilder();
        for (FeatureFlag flag : FeatureFlag.values()) {
            if (featureFlags.contains(flag)) {
                flags.append(flag.key()).append(',');
            }
        }
        return identity + "|" + roleTemplates + "|" + categoryTemplates + "|" + tierTemplates
                + "|" + flags + "|" + safetyOptions;
    }
}
