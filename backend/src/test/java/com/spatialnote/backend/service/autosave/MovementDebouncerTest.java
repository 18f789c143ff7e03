package com.spatialnote.backend.service.autosave;

import com.spatialnote.backend.domain.WindowPosition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

class MovementDebouncerTest {

    private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(2);
    private final List<AutoSaveEvent> emitted = new CopyOnWriteArrayList<>();

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void burstOfSamplesGivesOneEventWithLastPosition() throws Exception {
        CountDownLatch stopped = new CountDownLatch(1);
        MovementDebouncer debouncer = new MovementDebouncer(scheduler, () -> Duration.ofMillis(400), e -> {
            emitted.add(e);
            stopped.countDown();
        });
        debouncer.startTracking();

        WindowPosition last = null;
        for (int i = 0; i < 50; i++) {
            last = new WindowPosition(i, i * 2, 0, 400, 300);
            debouncer.positionChanged(7, last);
            Thread.sleep(5);
        }

        assertTrue(stopped.await(3, TimeUnit.SECONDS));
        Thread.sleep(600);
        assertEquals(1, emitted.size());
        AutoSaveEvent event = emitted.get(0);
        assertEquals(AutoSaveEvent.Kind.MOVEMENT_STOPPED, event.kind());
        assertEquals(7, event.windowId());
        assertEquals(last, event.position());
    }

    @Test
    void windowsAreDebouncedSeparately() throws Exception {
        CountDownLatch stopped = new CountDownLatch(2);
        MovementDebouncer debouncer = new MovementDebouncer(scheduler, () -> Duration.ofMillis(100), e -> {
            emitted.add(e);
            stopped.countDown();
        });
        debouncer.startTracking();

        debouncer.positionChanged(1, new WindowPosition(1, 0, 0, 400, 300));
        debouncer.positionChanged(2, new WindowPosition(2, 0, 0, 400, 300));

        assertTrue(stopped.await(2, TimeUnit.SECONDS));
        Set<Integer> ids = new HashSet<>();
        emitted.forEach(e -> ids.add(e.windowId()));
        assertEquals(Set.of(1, 2), ids);
    }

    @Test
    void samplesAreIgnoredWhenNotTracking() throws Exception {
        MovementDebouncer debouncer = new MovementDebouncer(scheduler, () -> Duration.ofMillis(50), emitted::add);

        assertFalse(debouncer.positionChanged(1, WindowPosition.defaults()));

        debouncer.startTracking();
        debouncer.positionChanged(1, WindowPosition.defaults());
        debouncer.stopTracking();
        Thread.sleep(200);

        assertTrue(emitted.isEmpty());
        assertEquals(0, debouncer.pendingWindows());
    }
}
