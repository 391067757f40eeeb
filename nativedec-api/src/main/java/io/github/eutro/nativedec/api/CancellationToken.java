package io.github.eutro.nativedec.api;

/**
 * A cooperative cancellation signal, set by the host of a decompilation and polled by the pipeline.
 * <p>
 * The pipeline polls between passes and, in per-function passes, between functions.
 * Once set, a token stays set.
 */
public final class CancellationToken {
    private volatile boolean cancelled;

    /**
     * Request cancellation.
     */
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
