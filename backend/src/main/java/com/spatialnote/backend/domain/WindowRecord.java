package com.spatialnote.backend.domain;

import java.time.Instant;

/**
 * One visual pane and its payload. The id and creation time never change;
 * everything else lives in {@link WindowState}.
 */
public class WindowRecord {
    private final int id;
    private final WindowType windowType;
    private final Instant createdAt;
    private WindowPosition position;
    private WindowState state;

    public WindowRecord(int id, WindowType windowType, WindowPosition position) {
        this(id, windowType, position, new WindowState(), Instant.now());
    }

    public WindowRecord(int id, WindowType windowType, WindowPosition position, WindowState state, Instant createdAt) {
        if (id < 0) throw new IllegalArgumentException("window id must not be negative: " + id);
        if (windowType == null) throw new IllegalArgumentException("windowType is required");
        this.id = id;
        this.windowType = windowType;
        this.position = position == null ? WindowPosition.defaults() : position;
        this.state = state == null ? new WindowState() : state;
        this.createdAt = createdAt == null ? Instant.now() : createdAt;
    }

    public WindowRecord copy() {
        return new WindowRecord(id, windowType, position, state.copy(), createdAt);
    }

    /** Same window under another id, used when imported records are re-numbered. */
    public WindowRecord withId(int newId) {
        return new WindowRecord(newId, windowType, position, state.copy(), createdAt);
    }

    public int getId() { return id; }
    public WindowType getWindowType() { return windowType; }
    public Instant getCreatedAt() { return createdAt; }

    public WindowPosition getPosition() { return position; }
    public void setPosition(WindowPosition position) {
        this.position = position == null ? WindowPosition.defaults() : position;
    }

    public WindowState getState() { return state; }
    public void setState(WindowState state) { this.state = state == null ? new WindowState() : state; }
}
