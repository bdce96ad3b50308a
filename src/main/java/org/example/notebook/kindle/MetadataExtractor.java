package org.example.notebook.kindle;

import org.example.notebook.model.HighlightColor;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls page, location and highlight color out of a normalized heading such as
 * "Highlight (Yellow) - Page 12 · Location 340-342".
 */
public final class MetadataExtractor {

    private static final Pattern LOCATION_PATTERN = Pattern.compile(
        "Location\\s+([\\d-]+)",
        Pattern.CASE_INSENSITIVE
    );

    private static final Pattern PAGE_PATTERN = Pattern.compile(
        "Page\\s+([\\d-]+)",
        Pattern.CASE_INSENSITIVE
    );

    // tags inside the parentheses are normalized to spaces: "Highlight( yellow )"
    private static final Pattern COLOR_PATTERN = Pattern.compile(
        "\\(\\s*(Yellow|Blue|Pink|Orange|Green)\\s*\\)",
        Pattern.CASE_INSENSITIVE
    );

    public record HeadingMetadata(String page, String location, HighlightColor color) {

        public static final HeadingMetadata EMPTY = new HeadingMetadata(null, null, null);
    }

    private MetadataExtractor() {
    }

    public static HeadingMetadata extract(String heading) {
        if (heading == null || heading.isEmpty()) {
            return HeadingMetadata.EMPTY;
        }
        return new HeadingMetadata(
            extractPage(heading).orElse(null),
            extractLocation(heading).orElse(null),
            extractColor(heading).orElse(null)
        );
    }

    public static Optional<String> extractLocation(String heading) {
        return firstGroup(LOCATION_PATTERN, heading);
    }

    public static Optional<String> extractPage(String heading) {
        return firstGroup(PAGE_PATTERN, heading);
    }

    public static Optional<HighlightColor> extractColor(String heading) {
        return firstGroup(COLOR_PATTERN, heading).flatMap(HighlightColor::fromName);
    }

    private static Optional<String> firstGroup(Pattern pattern, String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = pattern.matcher(text);
        if (matcher.find()) {
            return Optional.of(matcher.group(1));
        }
        return Optional.empty();
    }
}
