package org.example.notebook.service;

/**
 * Exception thrown when a notebook export cannot be read or written.
 */
public class NotebookExportException extends RuntimeException {

    public NotebookExportException(String message) {
        super(message);
    }

    public NotebookExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
