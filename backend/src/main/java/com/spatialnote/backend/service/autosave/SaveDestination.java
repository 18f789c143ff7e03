package com.spatialnote.backend.service.autosave;

import java.io.IOException;

/**
 * A place an exported document can be written to. Destinations are tried
 * independently; one failing never stops another.
 */
public interface SaveDestination {

    /** Short name shown in save results. */
    String name();

    /** Whether the current settings ask for this destination. */
    boolean isEnabled();

    /**
     * Writes the document and returns where it ended up.
     */
    String write(byte[] document) throws IOException;
}
