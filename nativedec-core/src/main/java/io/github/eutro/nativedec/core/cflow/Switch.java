package io.github.eutro.nativedec.core.cflow;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A switch region: a node dispatching through a jump table, optionally
 * guarded by a bounds check on the switch value.
 * <p>
 * When the bounds check was folded into the switch, the jump ending the
 * bounds check node no longer has any effect on the decompiled code.
 */
public final class Switch extends Region {
    private final BasicNode switchNode;
    @Nullable
    private final BasicNode boundsCheckNode;

    public Switch(BasicNode switchNode, @Nullable BasicNode boundsCheckNode, List<Node> nodes) {
        super(RegionKind.SWITCH, nodes);
        this.switchNode = switchNode;
        this.boundsCheckNode = boundsCheckNode;
    }

    public BasicNode switchNode() {
        return switchNode;
    }

    public @Nullable BasicNode boundsCheckNode() {
        return boundsCheckNode;
    }
}
