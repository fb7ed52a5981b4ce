package com.example.guardianservice.overhaul.model;

/**
 * Guild-wide settings applied by the first step of every overhaul.
 */
public record IdentitySettings(
        String name,
        VerificationTier verificationTier,
        ContentFilterTier contentFilterTier,
        NotificationDefault notificationDefault
) {
    public static IdentitySettings of(String name) {
        return new IdentitySettings(name, VerificationTier.HIGH, ContentFilterTier.ALL_MEMBERS,
                NotificationDefault.ONLY_MENTIONS);
    }
}
