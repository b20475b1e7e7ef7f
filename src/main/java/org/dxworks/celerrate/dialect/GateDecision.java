package org.dxworks.celerrate.dialect;

public enum GateDecision {
    ALLOW,
    DOWNGRADE,
    KEEP_WITH_WARNING,
    REJECT;

    public boolean isAllowed() {
        return this == ALLOW;
    }

    /**
     * Whether the construct's field or node survives into the AST.
     */
    public boolean keepsConstruct() {
        return this == ALLOW || this == KEEP_WITH_WARNING;
    }
}
