package com.spatialnote.backend.service.notebook;

/** A cell that could not be restored. The rest of the document is unaffected. */
public record CellImportError(int cellIndex, Kind kind, String message) {

    public enum Kind {
        INVALID_METADATA,
        CELL_PARSING_FAILED
    }

    @Override
    public String toString() {
        return "cell " + cellIndex + ": " + kind + " (" + message + ")";
    }
}
