package org.example.notebook.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One extracted passage. {@code note}, {@code color}, {@code page} and {@code location}
 * are null when the export did not carry them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record KindleHighlight(
        String text,
        String note,
        HighlightColor color,
        String page,
        String location
) {

    public KindleHighlight {
        text = text == null ? "" : text;
    }

    public static KindleHighlight of(String text) {
        return new KindleHighlight(text, null, null, null, null);
    }

    public boolean hasMetadata() {
        return color != null || page != null || location != null;
    }
}
