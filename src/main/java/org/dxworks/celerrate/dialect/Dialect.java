package org.dxworks.celerrate.dialect;

import java.util.Optional;

/**
 * PHP language-version profiles, one per supported minor release, in release order.
 */
public enum Dialect {
    PHP_7_0("7.0"),
    PHP_7_1("7.1"),
    PHP_7_2("7.2"),
    PHP_7_3("7.3"),
    PHP_7_4("7.4"),
    PHP_8_0("8.0"),
    PHP_8_1("8.1"),
    PHP_8_2("8.2"),
    PHP_8_3("8.3"),
    PHP_8_4("8.4");

    private final String tag;

    Dialect(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public boolean isAtLeast(Dialect other) {
        return compareTo(other) >= 0;
    }

    public static Dialect latest() {
        Dialect[] all = values();
        return all[all.length - 1];
    }

    public static Dialect earliest() {
        return values()[0];
    }

    /**
     * Accepts "8.1", "8.1.12", "php8.1", "PHP_8_1" and similar spellings.
     */
    public static Optional<Dialect> fromTag(String tag) {
        if (tag == null) return Optional.empty();
        String normalized = tag.trim().toLowerCase()
                .replaceFirst("^php[-_ ]?", "")
                .replace('_', '.');
        String[] parts = normalized.split("\\.");
        if (parts.length < 2) return Optional.empty();
        String majorMinor = parts[0] + "." + parts[1];
        for (Dialect dialect : values()) {
            if (dialect.tag.equals(majorMinor)) {
                return Optional.of(dialect);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "PHP " + tag;
    }
}
