package com.spatialnote.backend.repo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Headless presenter: there is no scene to draw into, so it only records the calls. */
@Component
public class LoggingWindowPresenter implements WindowPresenter {
    private static final Logger log = LoggerFactory.getLogger(LoggingWindowPresenter.class);

    @Override
    public void open(int windowId) {
        log.info("open window #{}", windowId);
    }

    @Override
    public void cleanup(int windowId) {
        log.debug("release entities of window #{}", windowId);
    }

    @Override
    public void cleanupAll() {
        log.debug("release entities of all windows");
    }
}
