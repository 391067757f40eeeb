package io.github.eutro.nativedec.core.cflow;

import io.github.eutro.nativedec.core.util.FunctionMap;

/**
 * The control-flow graph of each function.
 */
public final class Graphs extends FunctionMap<Graph> {
}
