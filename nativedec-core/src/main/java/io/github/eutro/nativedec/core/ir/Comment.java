package io.github.eutro.nativedec.core.ir;

import java.util.Collections;
import java.util.List;

/**
 * A comment, carried through to the output.
 */
public final class Comment extends Statement {
    private final String text;

    public Comment(String text) {
        super(Kind.COMMENT);
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
        return "// " + text;
    }
}
