package io.github.eutro.nativedec.api.stage;

import io.github.eutro.nativedec.core.liveness.Livenesses;

/**
 * Every function has a frozen liveness.
 */
public class LivenessStage extends StructureStage {
    private final Livenesses livenesses;

    public LivenessStage(StructureStage previous, Livenesses livenesses) {
        super(previous, previous.getGraphs());
        this.livenesses = livenesses;
    }

    public Livenesses getLivenesses() {
        return livenesses;
    }
}
