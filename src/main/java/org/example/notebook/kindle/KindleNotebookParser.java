package org.example.notebook.kindle;

import org.example.notebook.kindle.BlockScanner.BlockMarkers;
import org.example.notebook.model.KindleHighlight;
import org.example.notebook.model.KindleNotebook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Parses a Kindle notebook export (the HTML file sent by "Export Notebook" or the
 * Kindle web notebook page) into a {@link KindleNotebook}.
 *
 * <p>Never fails on unexpected markup. When no heading/body blocks are recognized the
 * whole document text becomes a single highlight, so nothing readable is lost.
 * Stateless; one instance can be shared across threads.
 */
public class KindleNotebookParser {

    private static final Logger log = LoggerFactory.getLogger(KindleNotebookParser.class);

    private final BlockScanner blockScanner;
    private final TitleAuthorExtractor titleAuthorExtractor;

    public KindleNotebookParser() {
        this(new BlockScanner(), new TitleAuthorExtractor());
    }

    public KindleNotebookParser(BlockMarkers markers) {
        this(new BlockScanner(markers), new TitleAuthorExtractor());
    }

    public KindleNotebookParser(BlockScanner blockScanner, TitleAuthorExtractor titleAuthorExtractor) {
        this.blockScanner = blockScanner;
        this.titleAuthorExtractor = titleAuthorExtractor;
    }

    public KindleNotebook parse(String html) {
        String source = html == null ? "" : html;

        TitleAuthorExtractor.TitleAuthor titleAuthor = titleAuthorExtractor.extract(source);
        String title = titleAuthor.title();
        String author = titleAuthor.author().orElse(null);

        HighlightMerger merger = new HighlightMerger();
        blockScanner.scan(source, merger::accept);

        List<KindleHighlight> highlights;
        if (merger.isEmpty()) {
            highlights = extractAsSingleHighlight(source);
            log.debug("No note blocks recognized in '{}', fell back to whole-document text ({} highlight)",
                title, highlights.size());
        } else {
            highlights = merger.highlights();
            log.debug("Parsed '{}': {} highlights, {} notes ({} without a preceding highlight)",
                title, highlights.size(), merger.noteCount(), merger.orphanNoteCount());
        }

        return new KindleNotebook(title, author, highlights);
    }

    private List<KindleHighlight> extractAsSingleHighlight(String html) {
        String text = TextNormalizer.normalize(html);
        if (text.isEmpty()) {
            return List.of();
        }
        return List.of(KindleHighlight.of(text));
    }
}
