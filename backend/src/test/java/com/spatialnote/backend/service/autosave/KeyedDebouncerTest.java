package com.spatialnote.backend.service.autosave;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class KeyedDebouncerTest {

    private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(2);

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void onlyTheLastScheduleForAKeyRuns() throws Exception {
        KeyedDebouncer<String> debouncer = new KeyedDebouncer<>(scheduler);
        List<Integer> ran = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(1);

        for (int i = 0; i < 20; i++) {
            int n = i;
            debouncer.schedule("ws", Duration.ofMillis(150), () -> {
                ran.add(n);
                done.countDown();
            });
        }

        assertTrue(done.await(2, TimeUnit.SECONDS));
        Thread.sleep(300);
        assertEquals(List.of(19), ran);
        assertFalse(debouncer.isPending("ws"));
    }

    @Test
    void keysAreIndependent() throws Exception {
        KeyedDebouncer<Integer> debouncer = new KeyedDebouncer<>(scheduler);
        Set<Integer> ran = ConcurrentHashMap.newKeySet();
        CountDownLatch done = new CountDownLatch(2);

        debouncer.schedule(1, Duration.ofMillis(100), () -> { ran.add(1); done.countDown(); });
        debouncer.schedule(2, Duration.ofMillis(100), () -> { ran.add(2); done.countDown(); });

        assertTrue(done.await(2, TimeUnit.SECONDS));
        assertEquals(Set.of(1, 2), ran);
    }

    @Test
    void cancelledTaskNeverRuns() throws Exception {
        KeyedDebouncer<String> debouncer = new KeyedDebouncer<>(scheduler);
        AtomicInteger runs = new AtomicInteger();

        debouncer.schedule("a", Duration.ofMillis(100), runs::incrementAndGet);
        assertTrue(debouncer.cancel("a"));
        assertFalse(debouncer.cancel("a"));

        Thread.sleep(300);
        assertEquals(0, runs.get());
    }

    @Test
    void rescheduleRacingTheTimerFiresAtMostOncePerArm() throws Exception {
        KeyedDebouncer<String> debouncer = new KeyedDebouncer<>(scheduler);
        AtomicInteger runs = new AtomicInteger();

        // zero delay makes the old timer and the replacement race
        for (int i = 0; i < 500; i++) {
            debouncer.schedule("k", Duration.ZERO, runs::incrementAndGet);
        }
        Thread.sleep(300);

        assertTrue(runs.get() >= 1);
        assertTrue(runs.get() <= 500);
        assertEquals(0, debouncer.pendingCount());
    }

    @Test
    void failingTaskDoesNotBreakTheDebouncer() throws Exception {
        KeyedDebouncer<String> debouncer = new KeyedDebouncer<>(scheduler);
        CountDownLatch done = new CountDownLatch(1);

        debouncer.schedule("a", Duration.ofMillis(10), () -> {
            throw new IllegalStateException("boom");
        });
        Thread.sleep(100);
        debouncer.schedule("a", Duration.ofMillis(10), done::countDown);

        assertTrue(done.await(1, TimeUnit.SECONDS));
    }
}
