package org.example.notebook.controller;

import org.example.notebook.model.KindleNotebook;
import org.example.notebook.model.NotebookAttachment;
import org.example.notebook.service.NotebookExportService;
import org.example.notebook.service.NotebookExportService.ExportResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api/notebooks")
public class NotebookController {

    private static final Logger log = LoggerFactory.getLogger(NotebookController.class);

    private final NotebookExportService notebookExportService;

    public NotebookController(NotebookExportService notebookExportService) {
        this.notebookExportService = notebookExportService;
    }

    @PostMapping("/parse")
    public KindleNotebook parse(@RequestBody(required = false) String html) {
        return notebookExportService.parse(html);
    }

    @PostMapping(value = "/markdown", produces = MediaType.TEXT_PLAIN_VALUE)
    public String markdown(@RequestBody(required = false) String html) {
        return notebookExportService.render(notebookExportService.parse(html));
    }

    @PostMapping("/export")
    public ResponseEntity<ExportResult> export(@RequestBody(required = false) String html) {
        ExportResult result = notebookExportService.export(html);

        if (result.success()) {
            return ResponseEntity.ok(result);
        }
        return ResponseEntity.badRequest().body(result);
    }

    @PostMapping(value = "/export/attachments", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<List<ExportResult>> exportAttachments(@RequestParam("files") List<MultipartFile> files) {
        List<NotebookAttachment> attachments = new ArrayList<>();
        for (MultipartFile file : files) {
            try {
                attachments.add(new NotebookAttachment(file.getOriginalFilename(), file.getContentType(), file.getBytes()));
            } catch (IOException e) {
                log.warn("Failed to read uploaded attachment {}", file.getOriginalFilename(), e);
                return ResponseEntity.badRequest().body(List.of(
                    ExportResult.failure(file.getOriginalFilename(), "Failed to read attachment: " + e.getMessage())
                ));
            }
        }

        List<ExportResult> results = notebookExportService.exportAttachments(attachments);
        if (results.isEmpty()) {
            return ResponseEntity.badRequest().body(List.of(
                ExportResult.failure(null, "No HTML attachment found")
            ));
        }
        return ResponseEntity.ok(results);
    }
}
