package io.github.eutro.nativedec.api.stage;

import io.github.eutro.nativedec.core.calling.Hooks;
import io.github.eutro.nativedec.core.dflow.Dataflows;

/**
 * Every function has dataflow facts, computed under the calling model of {@link #getHooks()}.
 */
public class DataflowStage extends CallingStage {
    private final Hooks hooks;
    private final Dataflows dataflows;

    public DataflowStage(CallingStage previous, Hooks hooks, Dataflows dataflows) {
        super(previous, previous.getConventions(), previous.getSignatures());
        this.hooks = hooks;
        this.dataflows = dataflows;
    }

    public Hooks getHooks() {
        return hooks;
    }

    public Dataflows getDataflows() {
        return dataflows;
    }
}
