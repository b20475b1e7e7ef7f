package org.dxworks.celerrate.dialect;

/**
 * What the mapper does with a construct the active dialect does not allow.
 */
public enum GatePolicy {
    /** Drop the disputed field (flag false, type absent) and warn. */
    DOWNGRADE,
    /** Build the node as written and warn. */
    KEEP,
    /** Replace the node with an Unknown placeholder and warn. */
    REJECT
}
