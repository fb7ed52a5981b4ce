package com.example.guardianservice.reactionroles;

import com.example.guardianservice.client.MessageContent;
import com.example.guardianservice.config.PanelSettings;
import com.example.guardianservice.entity.ReactionRoleEntry;
import com.example.guardianservice.exception.ReactionRoleConfigException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders the member panel: one select menu per group, groups larger than the page size split
 * into numbered pages.
 */
final class PanelRenderer {

    static final String MENU_ID_PREFIX = "guardian:rr:member:";

    private PanelRenderer() {
    }

    /**
     * @param entries   enabled entries in {@code orderIndex} order
     * @param roleNames role id to current role name, used for entries without a label
     */
    static MessageContent render(List<ReactionRoleEntry> entries, Map<Long, String> roleNames,
                                 PanelSettings settings) {
        List<MessageContent.SelectMenu> menus = menus(entries, roleNames, settings.pageSize());
        if (menus.size() > MessageContent.MAX_MENUS) {
            throw new ReactionRoleConfigException("PANEL_TOO_LARGE", String.format(
                    "Panel needs %d menus, at most %d fit in one message", menus.size(), MessageContent.MAX_MENUS));
        }
        String body = entries.isEmpty()
                ? "No roles are available yet."
                : "Pick roles from the menus below. Pick a role again to remove it.";
        return new MessageContent("**" + settings.title() + "**\n" + body, menus);
    }

    static int menuCount(List<ReactionRoleEntry> entries, int pageSize) {
        int count = 0;
        for (List<ReactionRoleEntry> group : groups(entries).values()) {
            count += (group.size() + pageSize - 1) / pageSize;
        }
        return count;
    }

    static String contentHash(MessageContent content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static List<MessageContent.SelectMenu> menus(List<ReactionRoleEntry> entries, Map<Long, String> roleNames,
                                                         int pageSize) {
        List<MessageContent.SelectMenu> menus = new ArrayList<>();
        groups(entries).forEach((groupKey, group) -> {
            int pages = (group.size() + pageSize - 1) / pageSize;
            for (int page = 0; page < pages; page++) {
                List<MessageContent.SelectOption> options = new ArrayList<>();
                for (ReactionRoleEntry entry : group.subList(page * pageSize, Math.min(group.size(), (page + 1) * pageSize))) {
                    String label = entry.getLabel() != null && !entry.getLabel().isBlank()
                            ? entry.getLabel()
                            : roleNames.getOrDefault(entry.getRoleId(), String.valueOf(entry.getRoleId()));
                    options.add(new MessageContent.SelectOption(label, String.valueOf(entry.getRoleId()), entry.getEmoji()));
                }
                String customId = MENU_ID_PREFIX + groupKey;
                String placeholder = "Select " + title(groupKey) + " roles...";
                if (pages > 1) {
                    customId += ":" + (page + 1);
                    placeholder = "Select " + title(groupKey) + " roles (" + (page + 1) + "/" + pages + ")...";
                }
                menus.add(new MessageContent.SelectMenu(customId, placeholder, options));
            }
        });
        return menus;
    }

    private static Map<String, List<ReactionRoleEntry>> groups(List<ReactionRoleEntry> entries) {
        Map<String, List<ReactionRoleEntry>> groups = new LinkedHashMap<>();
        for (ReactionRoleEntry entry : entries) {
            groups.computeIfAbsent(entry.getGroupKey(), key -> new ArrayList<>()).add(entry);
        }
        return groups;
    }

    private static String title(String groupKey) {
        if (groupKey.isEmpty()) {
            return groupKey;
        }
        return groupKey.substring(0, 1).toUpperCase(Locale.ROOT) + groupKey.substring(1);
    }
}
