package com.spatialnote.backend.service.autosave;

import com.spatialnote.backend.domain.WindowPosition;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Turns a stream of position samples into one movement-stopped event per
 * window, carrying the last sample, once that window has been still for the
 * debounce delay.
 */
public class MovementDebouncer {
    private final KeyedDebouncer<Integer> debouncer;
    private final Supplier<Duration> delay;
    private final Consumer<AutoSaveEvent> sink;
    private final Map<Integer, WindowPosition> lastPositions = new ConcurrentHashMap<>();
    private volatile boolean tracking;

    public MovementDebouncer(ScheduledExecutorService scheduler, Supplier<Duration> delay, Consumer<AutoSaveEvent> sink) {
        this.debouncer = new KeyedDebouncer<>(scheduler);
        this.delay = delay;
        this.sink = sink;
    }

    public void startTracking() {
        tracking = true;
    }

    /** Stops tracking and drops pending samples without emitting them. */
    public void stopTracking() {
        tracking = false;
        debouncer.cancelAll();
        lastPositions.clear();
    }

    public boolean isTracking() {
        return tracking;
    }

    /** Returns false when the sample was ignored because tracking is off. */
    public boolean positionChanged(int windowId, WindowPosition position) {
        if (!tracking) return false;
        lastPositions.put(windowId, position);
        debouncer.schedule(windowId, delay.get(), () -> {
            WindowPosition last = lastPositions.remove(windowId);
            if (last != null) sink.accept(AutoSaveEvent.movementStopped(windowId, last));
        });
        return true;
    }

    public int pendingWindows() {
        return debouncer.pendingCount();
    }
}
