package com.spatialnote.backend.service.workspace;

import com.spatialnote.backend.service.notebook.ImportResult;

import java.util.List;

/** Import outcome plus which restored windows the presenter actually opened. */
public record RestoreResult(ImportResult importResult, List<Integer> openedWindowIds, List<Integer> failedWindowIds) {
    public RestoreResult {
        openedWindowIds = List.copyOf(openedWindowIds);
        failedWindowIds = List.copyOf(failedWindowIds);
    }
}
