package com.spatialnote.backend.service.autosave;

import java.time.Instant;

/** Outcome of one write to one destination. */
public record AutoSaveResult(
        boolean success,
        String destination,
        String error,
        Instant timestamp,
        Integer windowId,
        String location
) {
    public static AutoSaveResult ok(String destination, Integer windowId, String location) {
        return new AutoSaveResult(true, destination, null, Instant.now(), windowId, location);
    }

    public static AutoSaveResult failed(String destination, Integer windowId, String error) {
        return new AutoSaveResult(false, destination, error, Instant.now(), windowId, null);
    }
}
