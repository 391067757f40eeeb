package io.github.eutro.nativedec.core.ir;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The lifted program: every basic block of the input, before it is partitioned into functions.
 */
public final class Program {
    private final List<BasicBlock> basicBlocks = new ArrayList<>();
    private final Map<Long, BasicBlock> blocksByAddress = new HashMap<>();
    private final List<Long> calledAddresses = new ArrayList<>();

    /**
     * Add a block to the program.
     *
     * @param basicBlock The block.
     * @return The block.
     */
    public BasicBlock addBasicBlock(BasicBlock basicBlock) {
        Long address = basicBlock.getAddress();
        if (address != null && blocksByAddress.putIfAbsent(address, basicBlock) != null) {
            throw new IllegalArgumentException(String.format("two blocks at address 0x%x", address));
        }
        basicBlocks.add(basicBlock);
        return basicBlock;
    }

    public List<BasicBlock> getBasicBlocks() {
        return Collections.unmodifiableList(basicBlocks);
    }

    public @Nullable BasicBlock getBasicBlockForAddress(long address) {
        return blocksByAddress.get(address);
    }

    /**
     * Record an address that is the target of a call, and so starts a function.
     *
     * @param address The address.
     */
    public void addCalledAddress(long address) {
        calledAddresses.add(address);
    }

    public List<Long> getCalledAddresses() {
        return Collections.unmodifiableList(calledAddresses);
    }
}
