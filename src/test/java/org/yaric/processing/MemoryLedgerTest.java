package org.yaric.processing;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MemoryLedgerTest {

    @Test
    void testReserveAndRelease() {
        MemoryLedger ledger = new MemoryLedger(100);

        ledger.reserve(60);
        assertEquals(60, ledger.committed());
        assertEquals(40, ledger.available());
        assertTrue(ledger.canReserve(40));
        assertFalse(ledger.canReserve(41));

        ledger.reserve(40);
        ledger.release(60);

        assertEquals(40, ledger.committed());
        assertEquals(100, ledger.peak());
    }

    @Test
    void testReserve_neverExceedsBudget() {
        MemoryLedger ledger = new MemoryLedger(100);
        ledger.reserve(70);

        assertThrows(IllegalStateException.class, () -> ledger.reserve(31));
        assertEquals(70, ledger.committed());
    }

    @Test
    void testFitsBudget() {
        MemoryLedger ledger = new MemoryLedger(100);
        ledger.reserve(100);

        assertTrue(ledger.fitsBudget(100));
        assertFalse(ledger.fitsBudget(101));
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new MemoryLedger(0));
        MemoryLedger ledger = new MemoryLedger(10);
        assertThrows(IllegalArgumentException.class, () -> ledger.reserve(-1));
        assertThrows(IllegalStateException.class, () -> ledger.release(1));
    }
}
