package io.github.eutro.nativedec.core.calling;

import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The reconstructed signatures of callees.
 */
public final class Signatures {
    private final Map<CalleeId, Signature> signatures = new ConcurrentHashMap<>();

    public void setSignature(CalleeId calleeId, Signature signature) {
        signatures.put(calleeId, signature);
    }

    public @Nullable Signature getSignature(@Nullable CalleeId calleeId) {
        if (calleeId == null) return null;
        return signatures.get(calleeId);
    }

    public int size() {
        return signatures.size();
    }
}
