package io.github.eutro.nativedec.core.liveness;

import io.github.eutro.nativedec.core.util.FunctionMap;

/**
 * The {@link Liveness} of every analysed function.
 */
public final class Livenesses extends FunctionMap<Liveness> {
}
