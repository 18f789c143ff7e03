package com.spatialnote.backend.service.notebook;

import java.util.List;

/**
 * Aggregate block written into the document metadata on export. Informational
 * only: the lists are set-derived and may disagree with the cells.
 */
public record ExportInfo(
        String exportDate,
        int totalWindows,
        List<String> windowTypes,
        List<String> exportTemplates,
        List<String> allTags
) {
    public ExportInfo {
        exportDate = exportDate == null ? "" : exportDate;
        windowTypes = windowTypes == null ? List.of() : List.copyOf(windowTypes);
        exportTemplates = exportTemplates == null ? List.of() : List.copyOf(exportTemplates);
        allTags = allTags == null ? List.of() : List.copyOf(allTags);
    }
}
