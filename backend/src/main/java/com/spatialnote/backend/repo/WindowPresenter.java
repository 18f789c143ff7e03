package com.spatialnote.backend.repo;

/**
 * Rendering side of a window. The registry only tells it when a window should
 * appear or when the resources behind an id can be released.
 */
public interface WindowPresenter {

    void open(int windowId);

    void cleanup(int windowId);

    void cleanupAll();
}
