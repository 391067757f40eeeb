package io.github.eutro.nativedec.core.calling;

import io.github.eutro.nativedec.core.ir.*;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class HooksTest {
    private static final MemoryLocation R0 = new MemoryLocation(MemoryDomain.FIRST_REGISTER, 0, 64);

    @Test
    void calleeIdOfFunction() {
        Hooks hooks = new Hooks(new Conventions(), new Signatures());
        Function withEntry = new Function();
        withEntry.newBb(0x1234L);
        assertEquals(CalleeId.ofAddress(0x1234), hooks.getCalleeId(withEntry));

        Function noEntry = new Function();
        assertEquals(CalleeId.ofFunction(noEntry), hooks.getCalleeId(noEntry));
        assertNotEquals(CalleeId.ofFunction(new Function()), hooks.getCalleeId(noEntry));

        Function noAddress = new Function();
        noAddress.newBb(null);
        assertEquals(CalleeId.ofFunction(noAddress), hooks.getCalleeId(noAddress));
    }

    @Test
    void detectorRunsOncePerCallee() {
        Conventions conventions = new Conventions();
        Hooks hooks = new Hooks(conventions, new Signatures());
        AtomicInteger calls = new AtomicInteger();
        hooks.setConventionDetector((calleeId, cs) -> {
            calls.incrementAndGet();
            if (calleeId.equals(CalleeId.ofAddress(1))) {
                cs.setConvention(calleeId, new Convention("stdcall", Collections.singletonList(R0)));
            }
        });

        assertNotNull(hooks.getConvention(CalleeId.ofAddress(1)));
        assertNotNull(hooks.getConvention(CalleeId.ofAddress(1)));
        assertNull(hooks.getConvention(CalleeId.ofAddress(2)));
        assertNull(hooks.getConvention(CalleeId.ofAddress(2)));
        assertEquals(2, calls.get());
    }

    @Test
    void detectorIsSerialized() throws Exception {
        Conventions conventions = new Conventions();
        Hooks hooks = new Hooks(conventions, new Signatures());
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger calls = new AtomicInteger();
        hooks.setConventionDetector((calleeId, cs) -> {
            assertEquals(1, inside.incrementAndGet());
            calls.incrementAndGet();
            inside.decrementAndGet();
        });

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                long address = i % 8;
                futures.add(executor.submit(() -> hooks.getConvention(CalleeId.ofAddress(address))));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(8, calls.get());
    }

    @Test
    void hookTermsAreCached() {
        Function function = new Function();
        IRBuilder ib = new IRBuilder(function, function.newBb(0x10L));
        Call call = ib.call(new IntConst(0x40, 64));
        Return ret = ib.ret();

        Conventions conventions = new Conventions();
        Hooks hooks = new Hooks(conventions, new Signatures());
        assertNull(hooks.getCallHook(call), "callee unknown");

        CalleeId callee = CalleeId.ofAddress(0x40);
        hooks.setCalleeId(call, callee);
        assertNull(hooks.getCallHook(call), "convention unknown");

        Convention convention = new Convention("sysv", Collections.singletonList(R0));
        conventions.setConvention(callee, convention);
        conventions.setConvention(hooks.getCalleeId(function), convention);

        CallHook callHook = hooks.getCallHook(call);
        assertNotNull(callHook);
        assertSame(callHook, hooks.getCallHook(call));
        Term argument = callHook.getArgumentTerm(R0);
        assertSame(argument, callHook.getArgumentTerm(R0));
        assertSame(call, argument.getStatement());
        assertTrue(argument.isRead());

        ReturnHook returnHook = hooks.getReturnHook(function, ret);
        assertNotNull(returnHook);
        Term returned = returnHook.getReturnValueTerm(R0);
        assertSame(returned, returnHook.getReturnValueTerm(R0));
        assertSame(ret, returned.getStatement());
    }
}
