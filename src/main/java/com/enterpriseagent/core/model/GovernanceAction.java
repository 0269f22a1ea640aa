package com.enterpriseagent.core.model;

/**
 * Remediation a failing governance check recommends. Rules are evaluated in declaration order.
 */
public enum GovernanceAction {

    FIX_TARGETED("fix_targeted", false),
    DELETE_REFACTOR_PARTS("delete_refactor_parts", false),
    REBUILD_FROM_SCRATCH("rebuild_from_scratch", true);

    private final String key;
    private final boolean destructive;

    GovernanceAction(String key, boolean destructive) {
        this.key = key;
        this.destructive = destructive;
    }

    public String key() {
        return key;
    }

    /**
     * Destructive actions need human approval before a caller may carry them out.
     */
    public boolean destructive() {
        return destructive;
    }
}
