package org.javai.resilience;

/**
 * Indicates whether a failed attempt is worth repeating.
 */
public enum FailureStability {
    /**
     * The failure is likely temporary (peer restarting, network blip).
     * Retry may succeed.
     */
    TRANSIENT,

    /**
     * The failure is permanent (entity missing, access denied).
     * Retrying stops immediately and the error is surfaced as is.
     */
    PERMANENT
}
