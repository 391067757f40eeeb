package io.github.eutro.nativedec.api;

/**
 * How a decompilation ended, when it did not fail.
 */
public enum Outcome {
    /**
     * Every pass ran.
     */
    COMPLETED,
    /**
     * Cancellation was requested, and the remaining passes were not run.
     * The context holds the stage of the last pass that completed.
     */
    CANCELLED,
}
