package com.spatialnote.backend.service.notebook.extract;

import com.spatialnote.backend.domain.WindowState;

/**
 * Best-effort recovery of a payload from cell source. Not finding anything
 * is a normal outcome; only unexpected failures should throw.
 */
public interface PayloadExtractor {

    /** Returns true when a payload was recovered and attached to the target. */
    boolean extract(String source, WindowState target);
}
