package com.spatialnote.backend.repo;

@FunctionalInterface
public interface WindowChangeListener {

    /** Called after a mutation was applied. windowId is null for bulk changes. */
    void windowChanged(Integer windowId);
}
