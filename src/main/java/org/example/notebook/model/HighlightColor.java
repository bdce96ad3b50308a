package org.example.notebook.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum HighlightColor {
    YELLOW("Yellow"),
    BLUE("Blue"),
    PINK("Pink"),
    ORANGE("Orange"),
    GREEN("Green");

    private final String displayName;

    HighlightColor(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String displayName() {
        return displayName;
    }

    public static Optional<HighlightColor> fromName(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        for (HighlightColor color : values()) {
            if (color.displayName.equalsIgnoreCase(raw.trim())) {
                return Optional.of(color);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return displayName;
    }
}
