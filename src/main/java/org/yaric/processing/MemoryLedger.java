package org.yaric.processing;

import org.yaric.util.Utils;

/**
 * Bytes committed to items that are computing or waiting to be saved, against a fixed budget.
 * Not thread safe: only the scheduler loop reads or changes it.
 */
public final class MemoryLedger {

    private final long budget;
    private long committed;
    private long peak;

    public MemoryLedger(final long budget) {
        if (budget <= 0) {
            throw new IllegalArgumentException("Budget must be positive: " + budget);
        }
        this.budget = budget;
    }

    /** Whether the item could ever be admitted, even with nothing else committed. */
    public boolean fitsBudget(final long cost) {
        return cost <= budget;
    }

    public boolean canReserve(final long cost) {
        return committed + cost <= budget;
    }

    public void reserve(final long cost) {
        if (cost < 0) {
            throw new IllegalArgumentException("Negative reservation: " + cost);
        }
        if (!canReserve(cost)) {
            throw new IllegalStateException("Reserving " + cost + " bytes would exceed the budget: " + this);
        }
        committed += cost;
        peak = Math.max(peak, committed);
    }

    public void release(final long cost) {
        if (cost < 0 || cost > committed) {
            throw new IllegalStateException("Cannot release " + cost + " bytes: " + this);
        }
        committed -= cost;
    }

    public long budget() {
        return budget;
    }

    public long committed() {
        return committed;
    }

    public long available() {
        return budget - committed;
    }

    /** Highest value {@link #committed()} has reached. */
    public long peak() {
        return peak;
    }

    @Override
    public String toString() {
        return "MemoryLedger[committed=%s, budget=%s]".formatted(Utils.formatBytes(committed), Utils.formatBytes(budget));
    }
}
