package com.spatialnote.backend.service.autosave;

import com.spatialnote.backend.domain.WindowPosition;
import com.spatialnote.backend.service.notebook.NotebookService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serial save queue. Producers enqueue and return at once; a single drain
 * task processes events strictly in arrival order, so writes to a
 * destination happen in the order their events arrived.
 */
@Service
public class AutoSavePipeline {
    private static final Logger log = LoggerFactory.getLogger(AutoSavePipeline.class);
    static final int HISTORY_LIMIT = 10;

    private final NotebookService notebooks;
    private final List<SaveDestination> destinations;
    private final AutoSaveSettings settings;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService drainer;
    private final MovementDebouncer movement;

    // queue + draining are guarded by queueLock
    private final ReentrantLock queueLock = new ReentrantLock();
    private final Deque<Queued> queue = new ArrayDeque<>();
    private boolean draining;

    private final Deque<AutoSaveResult> history = new ArrayDeque<>();
    private volatile boolean running;
    private volatile boolean autoSaving;
    private volatile Instant lastSaveTime;
    private volatile Integer focusedWindowId;
    private volatile Integer lastFocusedWindowId;
    private ScheduledFuture<?> intervalTask;

    public AutoSavePipeline(
            NotebookService notebooks,
            List<SaveDestination> destinations,
            AutoSaveSettings settings,
            @Qualifier("autosaveScheduler") ScheduledExecutorService scheduler
    ) {
        this.notebooks = notebooks;
        this.destinations = List.copyOf(destinations);
        this.settings = settings;
        this.scheduler = scheduler;
        this.drainer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "autosave-drain");
            t.setDaemon(true);
            return t;
        });
        this.movement = new MovementDebouncer(scheduler, settings::getMovementDebounce, this::submit);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (settings.isEnabled()) start();
    }

    // =========================
    // lifecycle
    // =========================

    /** Arms the interval timer and movement tracking. No-op while disabled. */
    public synchronized void start() {
        if (!settings.isEnabled() || running) return;
        Duration every = settings.getInterval();
        if (every != null && !every.isZero() && !every.isNegative()) {
            long ms = every.toMillis();
            intervalTask = scheduler.scheduleAtFixedRate(
                    () -> submit(AutoSaveEvent.intervalSave()), ms, ms, TimeUnit.MILLISECONDS);
        }
        movement.startTracking();
        running = true;
        log.info("autosave started (interval {}, destinations {})", every, enabledDestinationNames());
    }

    /** Cancels timers. Already queued events are still written. */
    public synchronized void stop() {
        if (intervalTask != null) {
            intervalTask.cancel(false);
            intervalTask = null;
        }
        movement.stopTracking();
        running = false;
        log.info("autosave stopped");
    }

    @PreDestroy
    public void shutdown() {
        stop();
        drainer.shutdown();
    }

    public boolean isRunning() {
        return running;
    }

    public void updateSettings(AutoSaveSettingsUpdate update) {
        if (update.saveToLocalFiles() != null) settings.setSaveToLocalFiles(update.saveToLocalFiles());
        if (update.saveToServer() != null) settings.setSaveToServer(update.saveToServer());
        if (update.saveOnFocusLoss() != null) settings.setSaveOnFocusLoss(update.saveOnFocusLoss());
        if (update.saveOnMovement() != null) settings.setSaveOnMovement(update.saveOnMovement());
        if (update.enabled() != null) {
            settings.setEnabled(update.enabled());
            if (update.enabled()) start();
            else stop();
        }
    }

    // =========================
    // producers
    // =========================

    /**
     * Queues an event. The future completes with the per-destination results
     * once the event has been processed, or with an empty list when the event
     * is filtered out or autosave is disabled.
     */
    public CompletableFuture<List<AutoSaveResult>> submit(AutoSaveEvent event) {
        if (!settings.isEnabled()) {
            return CompletableFuture.completedFuture(List.of());
        }
        trackFocus(event);

        Queued q = new Queued(event, new CompletableFuture<>());
        boolean startDrain;
        queueLock.lock();
        try {
            queue.addLast(q);
            startDrain = !draining;
            draining = true;
        } finally {
            queueLock.unlock();
        }
        if (startDrain) {
            try {
                drainer.execute(this::drain);
            } catch (RejectedExecutionException e) {
                List<Queued> dropped;
                queueLock.lock();
                try {
                    draining = false;
                    dropped = new ArrayList<>(queue);
                    queue.clear();
                } finally {
                    queueLock.unlock();
                }
                log.warn("autosave is shut down, dropping {} queued events", dropped.size());
                dropped.forEach(d -> d.done.complete(List.of()));
            }
        }
        return q.done;
    }

    public CompletableFuture<List<AutoSaveResult>> triggerManualSave() {
        return submit(AutoSaveEvent.manualSave());
    }

    /** Position sample for the movement debouncer. Ignored unless started. */
    public boolean recordMovement(int windowId, WindowPosition position) {
        return movement.positionChanged(windowId, position);
    }

    private void trackFocus(AutoSaveEvent event) {
        if (event.kind() == AutoSaveEvent.Kind.FOCUS_GAINED) {
            focusedWindowId = event.windowId();
        } else if (event.kind() == AutoSaveEvent.Kind.FOCUS_LOST) {
            lastFocusedWindowId = event.windowId();
            if (Objects.equals(focusedWindowId, event.windowId())) focusedWindowId = null;
        }
    }

    // =========================
    // drain loop
    // =========================

    private void drain() {
        while (true) {
            Queued next;
            queueLock.lock();
            try {
                next = queue.pollFirst();
                if (next == null) {
                    draining = false;
                    return;
                }
            } finally {
                queueLock.unlock();
            }
            try {
                next.done.complete(process(next.event));
            } catch (RuntimeException e) {
                log.warn("autosave event {} failed: {}", next.event.kind(), e.getMessage(), e);
                next.done.complete(List.of());
            }
        }
    }

    static boolean shouldProcess(AutoSaveEvent event, AutoSaveSettings settings) {
        return switch (event.kind()) {
            case FOCUS_LOST -> settings.isSaveOnFocusLoss();
            case MOVEMENT_STOPPED -> settings.isSaveOnMovement();
            case CONTENT_CHANGED, WINDOW_CLOSED, MANUAL_SAVE, INTERVAL_SAVE -> true;
            case FOCUS_GAINED -> false;
        };
    }

    private List<AutoSaveResult> process(AutoSaveEvent event) {
        if (!shouldProcess(event, settings)) return List.of();
        List<SaveDestination> targets = destinations.stream().filter(SaveDestination::isEnabled).toList();
        if (targets.isEmpty()) {
            log.debug("no autosave destination enabled, skipping {}", event.kind());
            return List.of();
        }

        autoSaving = true;
        try {
            log.debug("processing autosave event {} (window {})", event.kind(), event.windowId());
            List<AutoSaveResult> results = new ArrayList<>();
            byte[] document;
            try {
                document = notebooks.exportAll();
            } catch (RuntimeException e) {
                log.warn("autosave export failed: {}", e.getMessage(), e);
                for (SaveDestination d : targets) {
                    results.add(AutoSaveResult.failed(d.name(), event.windowId(), "export failed: " + e.getMessage()));
                }
                record(results);
                return results;
            }

            for (SaveDestination d : targets) {
                results.add(writeTo(d, document, event.windowId()));
            }
            record(results);
            return results;
        } finally {
            autoSaving = false;
        }
    }

    private AutoSaveResult writeTo(SaveDestination d, byte[] document, Integer windowId) {
        try {
            String location = d.write(document);
            log.info("autosaved to {} at {}", d.name(), location);
            return AutoSaveResult.ok(d.name(), windowId, location);
        } catch (IOException | RuntimeException e) {
            log.warn("autosave to {} failed: {}", d.name(), e.getMessage());
            return AutoSaveResult.failed(d.name(), windowId, e.getMessage());
        }
    }

    private void record(List<AutoSaveResult> results) {
        synchronized (history) {
            results.forEach(history::addLast);
            while (history.size() > HISTORY_LIMIT) history.removeFirst();
        }
        lastSaveTime = Instant.now();
    }

    // =========================
    // status
    // =========================

    public List<AutoSaveResult> recentResults() {
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    public boolean isAutoSaving() {
        return autoSaving;
    }

    public Optional<Instant> lastSaveTime() {
        return Optional.ofNullable(lastSaveTime);
    }

    public AutoSaveStatus status() {
        int queued;
        queueLock.lock();
        try {
            queued = queue.size();
        } finally {
            queueLock.unlock();
        }
        return new AutoSaveStatus(settings.isEnabled(), running, autoSaving, lastSaveTime,
                focusedWindowId, lastFocusedWindowId, queued, recentResults());
    }

    private List<String> enabledDestinationNames() {
        return destinations.stream().filter(SaveDestination::isEnabled).map(SaveDestination::name).toList();
    }

    private record Queued(AutoSaveEvent event, CompletableFuture<List<AutoSaveResult>> done) {
    }
}
