package org.dxworks.celerrate.diagnostics;

public enum Severity {
    WARNING("warning"),
    ERROR("error");

    private final String name;

    Severity(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
