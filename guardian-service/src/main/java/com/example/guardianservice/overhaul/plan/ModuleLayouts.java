package com.example.guardianservice.overhaul.plan;

import com.example.guardianservice.overhaul.model.CategoryTemplate;
import com.example.guardianservice.overhaul.model.ChannelTemplate;
import com.example.guardianservice.overhaul.model.ConfigurationModel;
import com.example.guardianservice.overhaul.model.ConfigurationTemplates;
import com.example.guardianservice.overhaul.model.FeatureFlag;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Categories and channels owned by optional modules.
 */
final class ModuleLayouts {

    static final String WELCOME_CHANNEL = "welcome";
    static final String WELCOME_FALLBACK_CATEGORY = "WELCOME";
    static final String VIP_CATEGORY = "VIP LOUNGE";
    static final String GAMING_CATEGORY = "GAMING";

    private ModuleLayouts() {
    }

    static List<CategoryTemplate> layoutFor(FeatureFlag feature, ConfigurationModel config) {
        return switch (feature) {
            case WELCOME -> List.of(welcome(config));
            case VIP_LOUNGE -> List.of(vipLounge());
            case GAMING -> List.of(CategoryTemplate.open(GAMING_CATEGORY, List.of(
                    ChannelTemplate.text("gaming-chat"),
                    ChannelTemplate.text("looking-for-group"),
                    ChannelTemplate.voice("Gaming Voice"))));
            case LEVELING, REACTION_ROLES -> List.of();
        };
    }

    static String labelFor(FeatureFlag feature) {
        return switch (feature) {
            case REACTION_ROLES -> "Publishing reaction-role panel";
            case WELCOME -> "Creating welcome channel";
            case VIP_LOUNGE -> "Creating VIP lounge";
            case GAMING -> "Creating gaming category";
            case LEVELING -> "Configuring level rewards";
        };
    }

    private static CategoryTemplate welcome(ConfigurationModel config) {
        // the welcome channel joins the first declared category when there is one
        if (config.categoryTemplates().isEmpty()) {
            return CategoryTemplate.open(WELCOME_FALLBACK_CATEGORY, List.of(ChannelTemplate.text(WELCOME_CHANNEL)));
        }
        CategoryTemplate first = config.categoryTemplates().get(0);
        return new CategoryTemplate(first.name(), List.of(ChannelTemplate.text(WELCOME_CHANNEL)), first.visibility());
    }

    private static CategoryTemplate vipLounge() {
        Map<String, Boolean> visibility = new LinkedHashMap<>();
        visibility.put(CategoryTemplate.EVERYONE, false);
        visibility.put(ConfigurationTemplates.VIP_ROLE, true);
        return new CategoryTemplate(VIP_CATEGORY, List.of(
                ChannelTemplate.text("vip-chat"),
                ChannelTemplate.voice("VIP Lounge")), visibility);
    }
}
