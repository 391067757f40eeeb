package io.github.eutro.nativedec.core.calling;

/**
 * Detects the calling convention of a callee, recording it in {@link Conventions}.
 * <p>
 * {@link Hooks} calls the detector at most once per callee, and never concurrently.
 */
@FunctionalInterface
public interface ConventionDetector {
    /**
     * A detector that detects nothing, leaving every convention unknown.
     */
    ConventionDetector NONE = (calleeId, conventions) -> {
    };

    /**
     * Detect the convention of a callee.
     *
     * @param calleeId    The callee.
     * @param conventions Where to record the convention, if one is detected.
     */
    void detect(CalleeId calleeId, Conventions conventions);
}
