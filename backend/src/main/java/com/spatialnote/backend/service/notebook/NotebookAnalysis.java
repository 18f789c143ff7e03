package com.spatialnote.backend.service.notebook;

import java.util.List;

public record NotebookAnalysis(
        int totalCells,
        int windowCells,
        List<String> windowTypes,
        List<String> exportTemplates,
        ExportInfo metadata
) {
    public NotebookAnalysis {
        windowTypes = windowTypes == null ? List.of() : List.copyOf(windowTypes);
        exportTemplates = exportTemplates == null ? List.of() : List.copyOf(exportTemplates);
    }

    public boolean isNative() {
        return metadata != null;
    }
}
