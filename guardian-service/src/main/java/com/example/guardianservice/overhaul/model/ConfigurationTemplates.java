package com.example.guardianservice.overhaul.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ready-made configurations offered when no custom layout is supplied.
 */
public final class ConfigurationTemplates {

    public static final String VIP_ROLE = "VIP";
    public static final String STAFF_CATEGORY = "STAFF";

    private ConfigurationTemplates() {
    }

    public static ConfigurationModel standard(String serverName, Set<FeatureFlag> flags) {
        boolean leveling = flags.contains(FeatureFlag.LEVELING);

        List<RoleTemplate> roles = new ArrayList<>();
        roles.add(RoleTemplate.staff("Admin", 0xE74C3C));
        roles.add(RoleTemplate.staff("Moderator", 0x3498DB));
        if (flags.contains(FeatureFlag.VIP_LOUNGE)) {
            roles.add(new RoleTemplate(VIP_ROLE, 0xE67E22, true, true, false));
        }
        List<TierTemplate> tiers = leveling ? standardTiers() : List.of();
        if (leveling) {
            roles.add(new RoleTemplate("Diamond", 0x206694, true, false, false));
            roles.add(new RoleTemplate("Platinum", 0x9B59B6, true, false, false));
            roles.add(new RoleTemplate("Gold", 0xF1C40F, true, false, false));
            roles.add(new RoleTemplate("Silver", 0x979C9F, true, false, false));
            roles.add(new RoleTemplate("Bronze", 0x3498DB, true, false, false));
        }
        roles.add(RoleTemplate.plain("Verified", 0x2ECC71));
        roles.add(RoleTemplate.plain("Member", 0x1F8B4C));
        roles.add(RoleTemplate.plain("Muted", 0x607D8B));

        List<CategoryTemplate> categories = new ArrayList<>();
        categories.add(CategoryTemplate.open("INFORMATION", List.of(
                ChannelTemplate.text("rules"),
                ChannelTemplate.text("announcements"))));
        categories.add(CategoryTemplate.open("GENERAL", List.of(
                ChannelTemplate.text("general"),
                ChannelTemplate.text("commands"),
                new ChannelTemplate("media", ChannelKind.TEXT, leveling ? 5 : null, false))));
        categories.add(CategoryTemplate.open("VOICE", List.of(
                ChannelTemplate.voice("General"),
                ChannelTemplate.voice("AFK"))));

        Map<String, Boolean> staffVisibility = new LinkedHashMap<>();
        staffVisibility.put(CategoryTemplate.EVERYONE, false);
        staffVisibility.put("Admin", true);
        staffVisibility.put("Moderator", true);
        categories.add(new CategoryTemplate(STAFF_CATEGORY, List.of(
                new ChannelTemplate("staff-chat", ChannelKind.TEXT, null, true),
                new ChannelTemplate("mod-log", ChannelKind.TEXT, null, true)), staffVisibility));

        return ConfigurationModel.builder()
                .identity(IdentitySettings.of(serverName))
                .roleTemplates(roles)
                .categoryTemplates(categories)
                .tierTemplates(tiers)
                .featureFlags(flags)
                .safetyOptions(SafetyOptions.defaults())
                .build();
    }

    public static List<TierTemplate> standardTiers() {
        return List.of(
                new TierTemplate(1, 0, "Bronze", List.of("chat")),
                new TierTemplate(5, 500, "Silver", List.of("attach_files")),
                new TierTemplate(10, 1000, "Gold", List.of("embed_links")),
                new TierTemplate(25, 2500, "Platinum", List.of("external_emojis")),
                new TierTemplate(50, 5000, "Diamond", List.of("priority_speaker")));
    }
}
