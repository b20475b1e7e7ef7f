package org.dxworks.celerrate.model;

import java.util.Optional;

public enum Visibility {
    PUBLIC("public"),
    PROTECTED("protected"),
    PRIVATE("private");

    private final String keyword;

    Visibility(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    public static Optional<Visibility> fromKeyword(String text) {
        if (text == null) return Optional.empty();
        String normalized = text.trim().toLowerCase();
        for (Visibility visibility : values()) {
            if (visibility.keyword.equals(normalized)) {
                return Optional.of(visibility);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return keyword;
    }
}
