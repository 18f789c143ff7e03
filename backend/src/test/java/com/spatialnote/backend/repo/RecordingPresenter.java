package com.spatialnote.backend.repo;

import java.util.*;

/** Presenter that remembers the calls it got. */
public class RecordingPresenter implements WindowPresenter {
    public final List<Integer> opened = Collections.synchronizedList(new ArrayList<>());
    public final List<Integer> cleanedUp = Collections.synchronizedList(new ArrayList<>());
    public int cleanupAllCalls;
    public Set<Integer> failOpen = new HashSet<>();

    @Override
    public void open(int windowId) {
        if (failOpen.contains(windowId)) throw new IllegalStateException("cannot open " + windowId);
        opened.add(windowId);
    }

    @Override
    public void cleanup(int windowId) {
        cleanedUp.add(windowId);
    }

    @Override
    public void cleanupAll() {
        cleanupAllCalls++;
    }
}
