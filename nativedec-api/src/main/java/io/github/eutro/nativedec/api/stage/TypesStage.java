package io.github.eutro.nativedec.api.stage;

import io.github.eutro.nativedec.core.types.Types;

public class TypesStage extends LivenessStage {
    private final Types types;

    public TypesStage(LivenessStage previous, Types types) {
        super(previous, previous.getLivenesses());
        this.types = types;
    }

    public Types getTypes() {
        return types;
    }
}
