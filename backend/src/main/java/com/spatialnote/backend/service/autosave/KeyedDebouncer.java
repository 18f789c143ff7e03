package com.spatialnote.backend.service.autosave;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Trailing-edge debounce per key. Scheduling a key again cancels its pending
 * task and restarts the delay; different keys never affect each other.
 *
 * <p>A task only runs if it is still the installed entry for its key when the
 * delay elapses, so a superseded task can never fire, even when cancellation
 * loses the race against the scheduler thread.
 */
public class KeyedDebouncer<K> {
    private static final Logger log = LoggerFactory.getLogger(KeyedDebouncer.class);

    private final ScheduledExecutorService scheduler;
    private final Map<K, Pending> pending = new ConcurrentHashMap<>();

    public KeyedDebouncer(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    public void schedule(K key, Duration delay, Runnable task) {
        long millis = Math.max(0, delay.toMillis());
        pending.compute(key, (k, previous) -> {
            if (previous != null) previous.cancel();
            Pending next = new Pending(task);
            // runs after compute returns; remove(k, next) waits on this bin until then
            next.future = scheduler.schedule(() -> fire(k, next), millis, TimeUnit.MILLISECONDS);
            return next;
        });
    }

    public boolean cancel(K key) {
        Pending p = pending.remove(key);
        if (p == null) return false;
        p.cancel();
        return true;
    }

    public void cancelAll() {
        pending.keySet().forEach(this::cancel);
    }

    public boolean isPending(K key) {
        return pending.containsKey(key);
    }

    public int pendingCount() {
        return pending.size();
    }

    private void fire(K key, Pending p) {
        if (!pending.remove(key, p)) return;
        try {
            p.task.run();
        } catch (RuntimeException e) {
            log.warn("debounced task for {} failed: {}", key, e.getMessage(), e);
        }
    }

    private static final class Pending {
        private final Runnable task;
        private volatile ScheduledFuture<?> future;

        Pending(Runnable task) {
            this.task = task;
        }

        void cancel() {
            ScheduledFuture<?> f = future;
            if (f != null) f.cancel(false);
        }
    }
}
