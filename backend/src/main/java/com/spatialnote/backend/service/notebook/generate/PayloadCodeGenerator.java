package com.spatialnote.backend.service.notebook.generate;

/**
 * Turns a payload into notebook cell source. Implementations are pure: the
 * same payload always yields the same text, and a null or empty payload
 * yields a labelled placeholder instead of an exception.
 */
public interface PayloadCodeGenerator<T> {

    String generate(T payload);
}
