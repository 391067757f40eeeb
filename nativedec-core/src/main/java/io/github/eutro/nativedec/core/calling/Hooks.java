package io.github.eutro.nativedec.core.calling;

import io.github.eutro.nativedec.core.ir.BasicBlock;
import io.github.eutro.nativedec.core.ir.Call;
import io.github.eutro.nativedec.core.ir.Function;
import io.github.eutro.nativedec.core.ir.Return;
import org.jetbrains.annotations.Nullable;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The calling model of the program: who each call calls, and the hooks
 * that materialize arguments and return values under the callee's convention.
 * <p>
 * A fresh instance is built for every dataflow analysis run, over the
 * conventions and signatures known at that point.
 */
public final class Hooks {
    private final Conventions conventions;
    private final Signatures signatures;
    private ConventionDetector conventionDetector = ConventionDetector.NONE;

    private final Map<Call, CalleeId> callees = new ConcurrentHashMap<>();
    private final Map<Call, CallHook> callHooks = new ConcurrentHashMap<>();
    private final Map<Return, ReturnHook> returnHooks = new ConcurrentHashMap<>();
    private final Set<CalleeId> detectionAttempted = new HashSet<>();

    public Hooks(Conventions conventions, Signatures signatures) {
        this.conventions = conventions;
        this.signatures = signatures;
    }

    public Conventions getConventions() {
        return conventions;
    }

    public Signatures getSignatures() {
        return signatures;
    }

    public void setConventionDetector(ConventionDetector conventionDetector) {
        this.conventionDetector = conventionDetector;
    }

    /**
     * Get the id a function is known by as a callee.
     *
     * @param function The function.
     * @return The id.
     */
    public CalleeId getCalleeId(Function function) {
        BasicBlock entry = function.getEntry();
        if (entry != null && entry.getAddress() != null) {
            return CalleeId.ofAddress(entry.getAddress());
        }
        return CalleeId.ofFunction(function);
    }

    /**
     * Get the callee of a call, if dataflow analysis resolved it.
     *
     * @param call The call.
     * @return The callee, or null.
     */
    public @Nullable CalleeId getCalleeId(Call call) {
        return callees.get(call);
    }

    /**
     * Record the callee of a call.
     *
     * @param call     The call.
     * @param calleeId The callee.
     */
    public void setCalleeId(Call call, CalleeId calleeId) {
        callees.put(call, calleeId);
    }

    /**
     * Get the convention of a callee, running the convention detector the first time it is unknown.
     *
     * @param calleeId The callee.
     * @return The convention, or null if it is unknown.
     */
    public @Nullable Convention getConvention(CalleeId calleeId) {
        Convention convention = conventions.getConvention(calleeId);
        if (convention != null) return convention;
        synchronized (detectionAttempted) {
            if (detectionAttempted.add(calleeId)) {
                conventionDetector.detect(calleeId, conventions);
            }
        }
        return conventions.getConvention(calleeId);
    }

    /**
     * Get the hook of a call whose callee and convention are known.
     *
     * @param call The call.
     * @return The hook, or null.
     */
    public @Nullable CallHook getCallHook(Call call) {
        CalleeId calleeId = getCalleeId(call);
        if (calleeId == null) return null;
        Convention convention = getConvention(calleeId);
        if (convention == null) return null;
        return callHooks.computeIfAbsent(call, c -> new CallHook(c, convention));
    }

    /**
     * Get the hook of a return from a function whose convention is known.
     *
     * @param function The function returned from.
     * @param ret      The return statement.
     * @return The hook, or null.
     */
    public @Nullable ReturnHook getReturnHook(Function function, Return ret) {
        Convention convention = getConvention(getCalleeId(function));
        if (convention == null) return null;
        return returnHooks.computeIfAbsent(ret, r -> new ReturnHook(r, convention));
    }
}
