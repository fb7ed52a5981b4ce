package com.example.guardianservice.client;

import java.util.List;

/**
 * Text plus optional selection menus. Each menu is one independently interactive row.
 */
public record MessageContent(String text, List<SelectMenu> menus) {

    public static final int MAX_MENUS = 5;

    public MessageContent {
        menus = menus == null ? List.of() : List.copyOf(menus);
    }

    public static MessageContent text(String text) {
        return new MessageContent(text, List.of());
    }

    public record SelectMenu(String customId, String placeholder, List<SelectOption> options) {
        public SelectMenu {
            options = List.copyOf(options);
        }
    }

    /**
     * @param value role id the option toggles
     */
    public record SelectOption(String label, String value, String emoji) {
    }
}
