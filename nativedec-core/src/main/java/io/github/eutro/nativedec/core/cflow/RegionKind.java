package io.github.eutro.nativedec.core.cflow;

/**
 * The shape structural analysis recognised a {@link Region} as.
 */
public enum RegionKind {
    UNKNOWN,
    BLOCK,
    COMPOUND_CONDITION,
    IF_THEN,
    IF_THEN_ELSE,
    LOOP,
    WHILE,
    DO_WHILE,
    SWITCH,
}
