package com.spatialnote.backend.service.autosave;

/** Partial settings change; null fields stay as they are. */
public record AutoSaveSettingsUpdate(
        Boolean enabled,
        Boolean saveToLocalFiles,
        Boolean saveToServer,
        Boolean saveOnFocusLoss,
        Boolean saveOnMovement
) {
}
