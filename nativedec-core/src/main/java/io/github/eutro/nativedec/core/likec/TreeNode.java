package io.github.eutro.nativedec.core.likec;

import io.github.eutro.nativedec.core.ir.Statement;
import io.github.eutro.nativedec.core.ir.Term;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of the generated C-like syntax tree.
 * <p>
 * A node may refer to the IR statement or term it was generated from.
 */
public final class TreeNode {
    private final String label;
    @Nullable
    private final Statement statement;
    @Nullable
    private final Term term;
    private final List<TreeNode> children = new ArrayList<>();

    public TreeNode(String label, @Nullable Statement statement, @Nullable Term term) {
        this.label = label;
        this.statement = statement;
        this.term = term;
    }

    public static TreeNode of(String label) {
        return new TreeNode(label, null, null);
    }

    public static TreeNode of(Statement statement) {
        return new TreeNode(statement.getKind().name(), statement, null);
    }

    public static TreeNode of(Term term) {
        return new TreeNode(term.getKind().name(), null, term);
    }

    public String getLabel() {
        return label;
    }

    public @Nullable Statement getStatement() {
        return statement;
    }

    public @Nullable Term getTerm() {
        return term;
    }

    public TreeNode addChild(TreeNode child) {
        children.add(child);
        return this;
    }

    public List<TreeNode> getChildren() {
        return Collections.unmodifiableList(children);
    }
}
