package io.github.eutro.nativedec.core.dflow;

import io.github.eutro.nativedec.core.ir.IntConst;
import io.github.eutro.nativedec.core.ir.MemoryDomain;
import io.github.eutro.nativedec.core.ir.MemoryLocation;
import io.github.eutro.nativedec.core.ir.MemoryLocationAccess;
import io.github.eutro.nativedec.core.ir.Term;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DataflowTest {
    private static final MemoryLocation R0 = new MemoryLocation(MemoryDomain.FIRST_REGISTER, 0, 32);

    @Test
    void unrecordedTermsAreUnknown() {
        Dataflow dataflow = new Dataflow();
        Term term = new MemoryLocationAccess(R0);
        assertTrue(dataflow.getDefinitions(term).isEmpty());
        assertNull(dataflow.getMemoryLocation(term));
        assertFalse(dataflow.getValue(term).isConcrete());
        assertThrows(IllegalStateException.class, () -> dataflow.getValue(term).getConstant());
    }

    @Test
    void concreteValues() {
        Dataflow dataflow = new Dataflow();
        Term term = new IntConst(0x2a, 32);
        dataflow.setValue(term, Value.concrete(0x2a));
        assertTrue(dataflow.getValue(term).isConcrete());
        assertEquals(0x2a, dataflow.getValue(term).getConstant());
        assertEquals("0x2a", dataflow.getValue(term).toString());
    }
}
