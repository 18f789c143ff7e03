package com.spatialnote.backend.service.notebook;

import com.spatialnote.backend.domain.WindowRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of reading a document: the restored records in cell order, the
 * cells that failed, and old window id to new window id.
 */
public record ImportResult(
        List<WindowRecord> restoredWindows,
        List<CellImportError> errors,
        Map<Integer, Integer> idMapping,
        ExportInfo originalMetadata
) {
    public ImportResult {
        restoredWindows = restoredWindows == null ? List.of() : List.copyOf(restoredWindows);
        errors = errors == null ? List.of() : List.copyOf(errors);
        idMapping = idMapping == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(idMapping));
    }

    /** Same result with every restored id, and every mapped id, moved by {@code offset}. */
    public ImportResult shiftIds(int offset) {
        if (offset == 0) return this;
        List<WindowRecord> shifted = new ArrayList<>(restoredWindows.size());
        for (WindowRecord w : restoredWindows) {
            shifted.add(w.withId(w.getId() + offset));
        }
        Map<Integer, Integer> mapping = new LinkedHashMap<>();
        idMapping.forEach((oldId, newId) -> mapping.put(oldId, newId + offset));
        return new ImportResult(shifted, errors, mapping, originalMetadata);
    }

    public boolean isSuccessful() {
        return errors.isEmpty() && !restoredWindows.isEmpty();
    }

    public String summary() {
        if (errors.isEmpty()) {
            return "Successfully restored " + restoredWindows.size() + " windows";
        }
        if (!restoredWindows.isEmpty()) {
            return "Restored " + restoredWindows.size() + " windows with " + errors.size() + " errors";
        }
        return "Failed to restore windows: " + errors.size() + " errors";
    }
}
