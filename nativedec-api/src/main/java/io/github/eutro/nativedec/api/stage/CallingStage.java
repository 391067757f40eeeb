package io.github.eutro.nativedec.api.stage;

import io.github.eutro.nativedec.core.calling.Conventions;
import io.github.eutro.nativedec.core.calling.Signatures;

/**
 * The calling conventions and function signatures are known, as far as they go.
 * <p>
 * Signature reconstruction returns this stage rather than a {@link DataflowStage},
 * since the dataflow facts computed before it are stale under the new signatures.
 */
public class CallingStage extends FunctionsStage {
    private final Conventions conventions;
    private final Signatures signatures;

    /**
     * Construct a calling stage.
     *
     * @param previous    The stage carrying the program and functions. Only those are kept.
     * @param conventions The conventions.
     * @param signatures  The signatures.
     */
    public CallingStage(FunctionsStage previous, Conventions conventions, Signatures signatures) {
        super(previous, previous.getFunctions());
        this.conventions = conventions;
        this.signatures = signatures;
    }

    public Conventions getConventions() {
        return conventions;
    }

    public Signatures getSignatures() {
        return signatures;
    }
}
