package io.github.eutro.nativedec.core.ir;

import java.util.Collections;
import java.util.List;

/**
 * An instruction the lifter could not express in the IR, emitted verbatim.
 */
public final class InlineAssembly extends Statement {
    private final String text;

    public InlineAssembly(String text) {
        super(Kind.INLINE_ASSEMBLY);
        this.text = text;
    }

    public String getText() {
        return text;
    }

    @Override
    public List<Term> getTerms() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return "asm(\"" + text + "\")";
    }
}
