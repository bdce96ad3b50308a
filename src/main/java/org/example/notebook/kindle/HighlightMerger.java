package org.example.notebook.kindle;

import org.example.notebook.kindle.BlockScanner.BlockPair;
import org.example.notebook.kindle.MetadataExtractor.HeadingMetadata;
import org.example.notebook.model.HighlightColor;
import org.example.notebook.model.KindleHighlight;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Folds heading/body pairs into the ordered highlight list. A pair whose heading starts
 * with "Note" annotates an earlier highlight instead of adding one:
 * <ol>
 *     <li>the latest highlight with the same location, when the note carries one;</li>
 *     <li>otherwise the most recently added highlight;</li>
 *     <li>with no highlight yet, the note is kept as a standalone entry.</li>
 * </ol>
 * Instances are single-use and not thread-safe; create one per document.
 */
public class HighlightMerger {

    private static final Pattern NOTE_HEADING_PATTERN = Pattern.compile(
        "^note\\b",
        Pattern.CASE_INSENSITIVE
    );

    private final List<Entry> entries = new ArrayList<>();
    private int noteCount;
    private int orphanNoteCount;

    public void accept(BlockPair pair) {
        Objects.requireNonNull(pair, "pair must not be null");
        accept(TextNormalizer.normalize(pair.headingRaw()), TextNormalizer.normalize(pair.bodyRaw()));
    }

    /**
     * Same as {@link #accept(BlockPair)} for a heading and body that are already normalized.
     */
    public void accept(String heading, String body) {
        HeadingMetadata metadata = MetadataExtractor.extract(heading);

        if (isNoteHeading(heading)) {
            mergeNote(body, metadata);
            return;
        }

        entries.add(new Entry(body, metadata));
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public int noteCount() {
        return noteCount;
    }

    public int orphanNoteCount() {
        return orphanNoteCount;
    }

    public List<KindleHighlight> highlights() {
        return entries.stream()
            .map(Entry::toHighlight)
            .toList();
    }

    static boolean isNoteHeading(String heading) {
        return heading != null && NOTE_HEADING_PATTERN.matcher(heading).find();
    }

    private void mergeNote(String body, HeadingMetadata metadata) {
        noteCount++;
        Entry target = findTarget(metadata.location());

        if (target == null) {
            orphanNoteCount++;
            entries.add(new Entry(body, metadata));
            return;
        }

        target.note = body;
        if (target.page == null && metadata.page() != null) {
            target.page = metadata.page();
        }
    }

    private Entry findTarget(String location) {
        if (location != null) {
            for (int i = entries.size() - 1; i >= 0; i--) {
                Entry candidate = entries.get(i);
                if (location.equals(candidate.location)) {
                    return candidate;
                }
            }
        }
        return entries.isEmpty() ? null : entries.get(entries.size() - 1);
    }

    private static final class Entry {
        private final String text;
        private final HighlightColor color;
        private final String location;
        private String page;
        private String note;

        private Entry(String text, HeadingMetadata metadata) {
            this.text = text;
            this.color = metadata.color();
            this.page = metadata.page();
            this.location = metadata.location();
        }

        private KindleHighlight toHighlight() {
            return new KindleHighlight(text, note, color, page, location);
        }
    }
}
