package com.spatialnote.backend.config;

import com.spatialnote.backend.service.autosave.AutoSaveSettings;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties(AutoSaveSettings.class)
public class AutoSaveConfig {

    /** Debounce timers and the interval save. Tasks are short; writes happen on the drain thread. */
    @Bean(name = "autosaveScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService autosaveScheduler() {
        AtomicInteger n = new AtomicInteger();
        return Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "autosave-timer-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
