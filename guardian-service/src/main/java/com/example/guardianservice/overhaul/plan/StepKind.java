package com.example.guardianservice.overhaul.plan;

/**
 * Step classification, in the fixed precedence the planner emits them.
 */
public enum StepKind {
    SETTINGS("settings"),
    ROLE_CREATE("role-create"),
    ROLE_ORDER("role-order"),
    STRUCTURE_CREATE("structure-create"),
    LEVELING_SETUP("leveling-setup"),
    MODULE_SETUP("module-setup"),
    FINALIZE("finalize");

    private final String key;

    StepKind(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
