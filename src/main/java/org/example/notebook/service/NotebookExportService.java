package org.example.notebook.service;

import org.example.notebook.kindle.KindleNotebookParser;
import org.example.notebook.kindle.NotebookMarkdownRenderer;
import org.example.notebook.model.KindleNotebook;
import org.example.notebook.model.NotebookAttachment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for collaborators that receive notebook exports (mail pollers, the HTTP
 * API, the command-line runner): parses the HTML and renders the markdown report.
 */
@Service
public class NotebookExportService {

    private static final Logger log = LoggerFactory.getLogger(NotebookExportService.class);

    static final int DEFAULT_MAX_DOCUMENT_CHARS = 5_000_000;

    private final KindleNotebookParser notebookParser;
    private final NotebookMarkdownRenderer markdownRenderer;

    @Value("${notebook.export.max-document-chars:5000000}")
    private int maxDocumentChars = DEFAULT_MAX_DOCUMENT_CHARS;

    public NotebookExportService(KindleNotebookParser notebookParser,
                                 NotebookMarkdownRenderer markdownRenderer) {
        this.notebookParser = notebookParser;
        this.markdownRenderer = markdownRenderer;
    }

    public record ExportResult(
        boolean success,
        String filename,
        String message,
        String title,
        String author,
        int highlightCount,
        String markdown
    ) {
        public static ExportResult failure(String filename, String message) {
            return new ExportResult(false, filename, message, null, null, 0, null);
        }
    }

    public KindleNotebook parse(String html) {
        return notebookParser.parse(html);
    }

    public String render(KindleNotebook notebook) {
        return markdownRenderer.render(notebook);
    }

    public ExportResult export(String html) {
        return export(NotebookAttachment.DEFAULT_FILENAME, html);
    }

    public ExportResult export(String filename, String html) {
        if (html == null || html.isBlank()) {
            log.warn("Rejected empty notebook export {}", filename);
            return ExportResult.failure(filename, "Document is empty");
        }
        if (html.length() > maxDocumentChars) {
            log.warn("Rejected notebook export {}: {} chars exceeds limit of {}",
                filename, html.length(), maxDocumentChars);
            return ExportResult.failure(filename, "Document exceeds " + maxDocumentChars + " characters");
        }

        KindleNotebook notebook = notebookParser.parse(html);
        if (notebook.highlights().isEmpty()) {
            log.info("No highlights found in {}", filename);
            return ExportResult.failure(filename, "No highlights found");
        }

        String markdown = markdownRenderer.render(notebook);
        log.info("Exported {} highlights from '{}' ({})",
            notebook.highlights().size(), notebook.title(), filename);

        return new ExportResult(
            true,
            filename,
            "Exported " + notebook.highlights().size() + " highlights",
            notebook.title(),
            notebook.author(),
            notebook.highlights().size(),
            markdown
        );
    }

    /**
     * Exports every HTML attachment of a message. Attachments that are not {@code .html}
     * files are skipped; the returned list only covers the ones that were processed.
     */
    public List<ExportResult> exportAttachments(List<NotebookAttachment> attachments) {
        if (attachments == null || attachments.isEmpty()) {
            return List.of();
        }

        List<ExportResult> results = new ArrayList<>();
        for (NotebookAttachment attachment : attachments) {
            Objects.requireNonNull(attachment, "attachment must not be null");
            if (!attachment.isHtml()) {
                log.info("Skipping non-HTML attachment {} ({})", attachment.filename(), attachment.mimeType());
                continue;
            }
            String html = new String(attachment.data(), StandardCharsets.UTF_8);
            results.add(export(attachment.filename(), html));
        }

        if (results.isEmpty()) {
            log.info("No HTML attachment among {} attachments", attachments.size());
        }
        return results;
    }
}
