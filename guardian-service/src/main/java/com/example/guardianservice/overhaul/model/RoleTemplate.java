package com.example.guardianservice.overhaul.model;

/**
 * @param protectedRole staff or otherwise privileged role; never offered on a panel,
 *                      never removed by reconciliation
 */
public record RoleTemplate(
        String name,
        int color,
        boolean hoisted,
        boolean mentionable,
        boolean protectedRole
) {
    public static RoleTemplate plain(String name, int color) {
        return new RoleTemplate(name, color, false, false, false);
    }

    public static RoleTemplate staff(String name, int color) {
        return new RoleTemplate(name, color, true, false, true);
    }
}
