package org.example.notebook.kindle;

import java.util.regex.Pattern;

/**
 * Turns an HTML fragment from a notebook export into plain text.
 * Only the handful of entities the export templates emit are decoded.
 */
public final class TextNormalizer {

    private static final Pattern TAG_PATTERN = Pattern.compile("<[^>]*>");
    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");

    // &amp; must stay after &lt; and &gt;, otherwise "&amp;lt;" would decode twice
    private static final String[][] ENTITIES = {
        {"&nbsp;", " "},
        {"&lt;", "<"},
        {"&gt;", ">"},
        {"&amp;", "&"},
        {"&quot;", "\""},
        {"&#39;", "'"}
    };

    private TextNormalizer() {
    }

    public static String normalize(String fragment) {
        if (fragment == null || fragment.isEmpty()) {
            return "";
        }

        String text = TAG_PATTERN.matcher(fragment).replaceAll(" ");
        text = decodeEntities(text);
        return WHITESPACE_PATTERN.matcher(text).replaceAll(" ").trim();
    }

    static String decodeEntities(String text) {
        String decoded = text;
        for (String[] entity : ENTITIES) {
            decoded = decoded.replace(entity[0], entity[1]);
        }
        return decoded;
    }
}
