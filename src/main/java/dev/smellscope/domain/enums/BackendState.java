package dev.smellscope.domain.enums;

/**
 * Resolution of one detector slot. SKIPPED means the detector was not called.
 */
public enum BackendState {
    SUCCESS, FAILURE, TIMEOUT, SKIPPED
}
