package org.example.notebook.kindle;

import org.example.notebook.model.KindleHighlight;
import org.example.notebook.model.KindleNotebook;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders a notebook as a plain markdown report suitable for a chat message or mail body:
 * <pre>
 * # Title
 * _by Author_
 *
 * 1. Highlight text — (Yellow · Page 12 · Loc 340)
 *    > note text
 * </pre>
 */
@Component
public class NotebookMarkdownRenderer {

    private static final String META_SEPARATOR = " · ";

    public String render(KindleNotebook notebook) {
        Objects.requireNonNull(notebook, "notebook must not be null");

        List<String> lines = new ArrayList<>();
        lines.add("# " + notebook.title());

        if (notebook.author() != null) {
            lines.add("_by " + notebook.author() + "_");
        }

        lines.add("");

        List<KindleHighlight> highlights = notebook.highlights();
        for (int i = 0; i < highlights.size(); i++) {
            KindleHighlight highlight = highlights.get(i);

            String meta = formatMetadata(highlight);
            String label = meta.isEmpty() ? "" : " — (" + meta + ")";
            lines.add((i + 1) + ". " + highlight.text() + label);

            if (highlight.note() != null && !highlight.note().isEmpty()) {
                lines.add("   > " + highlight.note());
            }
        }

        return String.join("\n", lines);
    }

    String formatMetadata(KindleHighlight highlight) {
        List<String> parts = new ArrayList<>(3);
        if (highlight.color() != null) {
            parts.add(highlight.color().displayName());
        }
        if (highlight.page() != null && !highlight.page().isEmpty()) {
            parts.add("Page " + highlight.page());
        }
        if (highlight.location() != null && !highlight.location().isEmpty()) {
            parts.add("Loc " + highlight.location());
        }
        return String.join(META_SEPARATOR, parts);
    }
}
