package io.github.eutro.nativedec.core.ir;

import io.github.eutro.nativedec.core.util.TrackedList;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A function, a list of {@link BasicBlock basic blocks}.
 * <p>
 * The first block, if any, is the entry. A function reconstructed from a
 * dangling fragment of code may have no entry at all.
 */
public final class Function {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger();

    /**
     * The list of basic blocks in this function. {@code [0]} is the entry.
     */
    public final List<BasicBlock> blocks = new TrackedList<BasicBlock>(new ArrayList<>()) {
        @Override
        protected void onAdded(BasicBlock elt) {
            elt.setFunction(Function.this);
        }

        @Override
        protected void onRemoved(BasicBlock elt) {
            elt.setFunction(null);
        }
    };

    private final int id = ID_COUNTER.getAndIncrement();
    @Nullable
    private String name;

    /**
     * Get the unique handle of this function. Handles are allocated in construction order.
     *
     * @return The handle.
     */
    public int getId() {
        return id;
    }
    private final List<String> comment = new ArrayList<>();

    /**
     * Get the entry block of this function.
     *
     * @return The entry, or null if the function has no blocks.
     */
    public @Nullable BasicBlock getEntry() {
        return blocks.isEmpty() ? null : blocks.get(0);
    }

    public @Nullable String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /**
     * Get the lines of documentation attached to this function, such as
     * the original and demangled symbol names.
     *
     * @return The mutable list of lines.
     */
    public List<String> getComment() {
        return comment;
    }

    /**
     * Collect the {@link Return} statements of this function.
     *
     * @return The returns, in block order.
     */
    public List<Return> getReturns() {
        List<Return> returns = null;
        for (BasicBlock block : blocks) {
            for (Statement statement : block.getStatements()) {
                if (statement instanceof Return) {
                    if (returns == null) returns = new ArrayList<>();
                    returns.add((Return) statement);
                }
            }
        }
        return returns == null ? Collections.emptyList() : returns;
    }

    /**
     * Creates a new basic block at the end of this function.
     *
     * @param address The address of the block, if any.
     * @return The new basic block.
     */
    public BasicBlock newBb(@Nullable Long address) {
        BasicBlock bb = new BasicBlock(address);
        blocks.add(bb);
        return bb;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(name == null ? "fn" : name).append("() {\n");
        for (BasicBlock block : blocks) {
            sb.append(block).append('\n');
        }
        sb.append("}");
        return sb.toString();
    }
}
