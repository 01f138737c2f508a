package com.phillippitts.vadbridge.service.engine;

/**
 * Creates a fresh, uninitialized engine for each session {@code init}.
 */
@FunctionalInterface
public interface VadEngineFactory {

    VadEngine create();
}
