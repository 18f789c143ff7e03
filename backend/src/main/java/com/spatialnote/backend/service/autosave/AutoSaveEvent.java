package com.spatialnote.backend.service.autosave;

import com.spatialnote.backend.domain.WindowPosition;

/**
 * Something that may cause a save. Window-less kinds carry a null window id.
 */
public record AutoSaveEvent(
        Kind kind,
        Integer windowId,
        WindowPosition position,
        String content
) {
    public enum Kind {
        FOCUS_GAINED,
        FOCUS_LOST,
        MOVEMENT_STOPPED,
        CONTENT_CHANGED,
        WINDOW_CLOSED,
        MANUAL_SAVE,
        INTERVAL_SAVE
    }

    public AutoSaveEvent {
        if (kind == null) throw new IllegalArgumentException("kind is required");
        boolean windowless = kind == Kind.MANUAL_SAVE || kind == Kind.INTERVAL_SAVE;
        if (!windowless && windowId == null) {
            throw new IllegalArgumentException(kind + " needs a window id");
        }
    }

    public static AutoSaveEvent focusGained(int windowId) {
        return new AutoSaveEvent(Kind.FOCUS_GAINED, windowId, null, null);
    }

    public static AutoSaveEvent focusLost(int windowId) {
        return new AutoSaveEvent(Kind.FOCUS_LOST, windowId, null, null);
    }

    public static AutoSaveEvent movementStopped(int windowId, WindowPosition position) {
        return new AutoSaveEvent(Kind.MOVEMENT_STOPPED, windowId, position, null);
    }

    public static AutoSaveEvent contentChanged(int windowId, String content) {
        return new AutoSaveEvent(Kind.CONTENT_CHANGED, windowId, null, content);
    }

    public static AutoSaveEvent windowClosed(int windowId) {
        return new AutoSaveEvent(Kind.WINDOW_CLOSED, windowId, null, null);
    }

    public static AutoSaveEvent manualSave() {
        return new AutoSaveEvent(Kind.MANUAL_SAVE, null, null, null);
    }

    public static AutoSaveEvent intervalSave() {
        return new AutoSaveEvent(Kind.INTERVAL_SAVE, null, null, null);
    }
}
