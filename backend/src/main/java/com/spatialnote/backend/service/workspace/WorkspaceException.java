package com.spatialnote.backend.service.workspace;

public class WorkspaceException extends RuntimeException {

    public enum Kind {
        INVALID_NAME("Invalid workspace name"),
        DUPLICATE_NAME("A workspace with this name already exists"),
        FILE_NOT_FOUND("Workspace file not found"),
        DIRECTORY_CREATION_FAILED("Failed to create workspace directory"),
        SAVE_FAILED("Save error"),
        LOAD_FAILED("Load error");

        private final String description;

        Kind(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    private final Kind kind;

    public WorkspaceException(Kind kind, String detail) {
        super(detail == null ? kind.description() : kind.description() + ": " + detail);
        this.kind = kind;
    }

    public WorkspaceException(Kind kind, String detail, Throwable cause) {
        super(detail == null ? kind.description() : kind.description() + ": " + detail, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
