package org.example.notebook.kindle;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Single forward scan over a notebook export that pairs each heading block
 * ({@code <div class="noteHeading">}) with the body block that follows it
 * ({@code <div class="noteText">}).
 *
 * <p>Block content runs to the first {@code </div>}; nested divs are not supported.
 * Between the heading close and the body open only whitespace, comments and non-div
 * tags may appear. After a pair is emitted, scanning resumes right after the body's
 * closing tag, so pairs never overlap.
 */
public final class BlockScanner {

    private static final String DIV_CLOSE = "</div>";
    private static final String COMMENT_OPEN = "<!--";
    private static final String COMMENT_CLOSE = "-->";

    public record BlockMarkers(String headingClass, String bodyClass) {

        public static final BlockMarkers DEFAULT = new BlockMarkers("noteHeading", "noteText");

        public BlockMarkers {
            if (headingClass == null || headingClass.isBlank()) {
                throw new IllegalArgumentException("headingClass must not be blank");
            }
            if (bodyClass == null || bodyClass.isBlank()) {
                throw new IllegalArgumentException("bodyClass must not be blank");
            }
            headingClass = headingClass.trim();
            bodyClass = bodyClass.trim();
        }
    }

    /** Raw inner markup of a heading block and of the body block paired with it. */
    public record BlockPair(String headingRaw, String bodyRaw) {}

    private record DivTag(int start, int end, String classValue) {}

    private final BlockMarkers markers;

    public BlockScanner() {
        this(BlockMarkers.DEFAULT);
    }

    public BlockScanner(BlockMarkers markers) {
        this.markers = markers;
    }

    public BlockMarkers markers() {
        return markers;
    }

    public List<BlockPair> scan(String html) {
        List<BlockPair> pairs = new ArrayList<>();
        scan(html, pairs::add);
        return pairs;
    }

    public void scan(String html, Consumer<BlockPair> sink) {
        if (html == null || html.isEmpty()) {
            return;
        }

        int position = 0;
        while (position < html.length()) {
            DivTag heading = findDiv(html, position, markers.headingClass());
            if (heading == null) {
                return;
            }

            int headingClose = indexOfIgnoreCase(html, DIV_CLOSE, heading.end());
            if (headingClose < 0) {
                return;
            }

            DivTag body = nextDivAfterMarkup(html, headingClose + DIV_CLOSE.length());
            if (body == null || !markers.bodyClass().equalsIgnoreCase(body.classValue())) {
                position = heading.end();
                continue;
            }

            int bodyClose = indexOfIgnoreCase(html, DIV_CLOSE, body.end());
            if (bodyClose < 0) {
                position = heading.end();
                continue;
            }

            sink.accept(new BlockPair(
                html.substring(heading.end(), headingClose),
                html.substring(body.end(), bodyClose)
            ));
            position = bodyClose + DIV_CLOSE.length();
        }
    }

    /**
     * Finds the next opening {@code <div>} at or after {@code from} whose class attribute
     * equals {@code className}, ignoring case.
     */
    private static DivTag findDiv(String html, int from, String className) {
        int cursor = from;
        while (true) {
            int open = html.indexOf('<', cursor);
            if (open < 0) {
                return null;
            }
            if (html.startsWith(COMMENT_OPEN, open)) {
                cursor = skipComment(html, open);
                if (cursor < 0) {
                    return null;
                }
                continue;
            }
            if (!isDivOpen(html, open)) {
                cursor = open + 1;
                continue;
            }
            DivTag div = readDiv(html, open);
            if (div == null) {
                return null;
            }
            if (className.equalsIgnoreCase(div.classValue())) {
                return div;
            }
            cursor = div.end();
        }
    }

    /**
     * Skips whitespace, comments and any tag that is not an opening div. Returns the
     * first opening div found that way, or null as soon as text or the end of input is hit.
     */
    private static DivTag nextDivAfterMarkup(String html, int from) {
        int cursor = from;
        while (cursor < html.length()) {
            char current = html.charAt(cursor);
            if (Character.isWhitespace(current)) {
                cursor++;
                continue;
            }
            if (current != '<' || !isTagStart(html, cursor)) {
                return null;
            }
            if (html.startsWith(COMMENT_OPEN, cursor)) {
                cursor = skipComment(html, cursor);
                if (cursor < 0) {
                    return null;
                }
                continue;
            }
            if (isDivOpen(html, cursor)) {
                return readDiv(html, cursor);
            }
            int tagEnd = html.indexOf('>', cursor);
            if (tagEnd < 0) {
                return null;
            }
            cursor = tagEnd + 1;
        }
        return null;
    }

    private static DivTag readDiv(String html, int open) {
        int tagEnd = findTagEnd(html, open);
        if (tagEnd < 0) {
            return null;
        }
        String classValue = attributeValue(html.substring(open + 4, tagEnd - 1), "class");
        return new DivTag(open, tagEnd, classValue);
    }

    private static boolean isTagStart(String html, int open) {
        if (open + 1 >= html.length()) {
            return false;
        }
        char next = html.charAt(open + 1);
        return Character.isLetter(next) || next == '/' || next == '!' || next == '?';
    }

    private static boolean isDivOpen(String html, int open) {
        if (!html.regionMatches(true, open, "<div", 0, 4)) {
            return false;
        }
        if (open + 4 >= html.length()) {
            return false;
        }
        char next = html.charAt(open + 4);
        return next == '>' || next == '/' || Character.isWhitespace(next);
    }

    private static int skipComment(String html, int open) {
        int close = html.indexOf(COMMENT_CLOSE, open + COMMENT_OPEN.length());
        return close < 0 ? -1 : close + COMMENT_CLOSE.length();
    }

    /**
     * Returns the index just past the {@code >} closing the tag that starts at
     * {@code open}, skipping over quoted attribute values, or -1 when the tag never closes.
     */
    private static int findTagEnd(String html, int open) {
        char quote = 0;
        for (int i = open + 1; i < html.length(); i++) {
            char c = html.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '>') {
                return i + 1;
            }
        }
        // unbalanced quote inside the tag: fall back to the first '>'
        int plainEnd = html.indexOf('>', open);
        return plainEnd < 0 ? -1 : plainEnd + 1;
    }

    static String attributeValue(String attributes, String name) {
        int length = attributes.length();
        int i = 0;
        while (i < length) {
            while (i < length && (Character.isWhitespace(attributes.charAt(i)) || attributes.charAt(i) == '/')) {
                i++;
            }
            int nameStart = i;
            while (i < length && !Character.isWhitespace(attributes.charAt(i))
                    && attributes.charAt(i) != '=' && attributes.charAt(i) != '/') {
                i++;
            }
            String attributeName = attributes.substring(nameStart, i);
            while (i < length && Character.isWhitespace(attributes.charAt(i))) {
                i++;
            }

            String value = null;
            if (i < length && attributes.charAt(i) == '=') {
                i++;
                while (i < length && Character.isWhitespace(attributes.charAt(i))) {
                    i++;
                }
                if (i < length && (attributes.charAt(i) == '"' || attributes.charAt(i) == '\'')) {
                    char quote = attributes.charAt(i);
                    int close = attributes.indexOf(quote, i + 1);
                    if (close < 0) {
                        close = length;
                    }
                    value = attributes.substring(i + 1, close);
                    i = Math.min(close + 1, length);
                } else {
                    int valueStart = i;
                    while (i < length && !Character.isWhitespace(attributes.charAt(i))) {
                        i++;
                    }
                    value = attributes.substring(valueStart, i);
                }
            }

            if (!attributeName.isEmpty() && attributeName.equalsIgnoreCase(name)) {
                return value == null ? "" : value.trim();
            }
            if (attributeName.isEmpty() && i < length) {
                i++;
            }
        }
        return null;
    }

    static int indexOfIgnoreCase(String text, String needle, int from) {
        int last = text.length() - needle.length();
        for (int i = Math.max(from, 0); i <= last; i++) {
            if (text.regionMatches(true, i, needle, 0, needle.length())) {
                return i;
            }
        }
        return -1;
    }
}
