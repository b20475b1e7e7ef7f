package org.dxworks.celerrate.mapper;

import java.util.Optional;

/**
 * Which diagnostics count as failures of a mapped file.
 */
public enum ReportingMode {
    /** Only errors fail a file. */
    LENIENT("lenient"),
    /** Every diagnostic fails a file. */
    STRICT("strict");

    private final String name;

    ReportingMode(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static Optional<ReportingMode> fromName(String name) {
        if (name == null) return Optional.empty();
        for (ReportingMode mode : values()) {
            if (mode.name.equalsIgnoreCase(name.trim())) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
