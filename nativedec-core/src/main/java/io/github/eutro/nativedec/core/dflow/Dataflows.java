package io.github.eutro.nativedec.core.dflow;

import io.github.eutro.nativedec.core.util.FunctionMap;

/**
 * The {@link Dataflow} of every analysed function.
 */
public final class Dataflows extends FunctionMap<Dataflow> {
}
