package com.example.guardianservice.client;

/**
 * @param position hierarchy position, higher is more powerful
 */
public record RoleSnapshot(
        long id,
        String name,
        int position,
        int color,
        boolean hoisted,
        boolean mentionable,
        boolean managed
) {
}
