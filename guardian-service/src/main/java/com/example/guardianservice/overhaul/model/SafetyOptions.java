package com.example.guardianservice.overhaul.model;

/**
 * @param preserveStaffRoles protected roles are left where they are in the role hierarchy
 * @param backupRequired     a fresh overhaul first records the identifiers of everything the
 *                           guild already has, and does not start if that fails
 */
public record SafetyOptions(boolean preserveStaffRoles, boolean backupRequired) {

    public static SafetyOptions defaults() {
        return new SafetyOptions(true, false);
    }
}
