package com.spatialnote.backend.service.autosave;

import java.time.Instant;
import java.util.List;

public record AutoSaveStatus(
        boolean enabled,
        boolean running,
        boolean autoSaving,
        Instant lastSaveTime,
        Integer focusedWindowId,
        Integer lastFocusedWindowId,
        int queuedEvents,
        List<AutoSaveResult> recentResults
) {
}
