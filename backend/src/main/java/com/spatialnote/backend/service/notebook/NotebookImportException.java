package com.spatialnote.backend.service.notebook;

/** The document as a whole cannot be read; nothing was restored. */
public class NotebookImportException extends RuntimeException {

    public enum Kind {
        INVALID_JSON,
        INVALID_NOTEBOOK_FORMAT,
        FILE_READ_ERROR
    }

    private final Kind kind;

    public NotebookImportException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public NotebookImportException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
