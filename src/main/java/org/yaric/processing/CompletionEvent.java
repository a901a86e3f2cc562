package org.yaric.processing;

/**
 * Message from a worker thread (or a caller of {@link IndexCalculator#cancel()}) to the scheduler loop.
 */
sealed interface CompletionEvent {

    /** A calculation finished, successfully or not. */
    record ComputeCompleted(WorkItem item, ComputeOutcome outcome) implements CompletionEvent {
    }

    /** The staged output of a finished calculation was saved or discarded. */
    record PersistenceCompleted(WorkItem item, ComputeOutcome computeOutcome,
                                PersistenceOutcome persistenceOutcome) implements CompletionEvent {
    }

    /** Wakes the loop so it notices a cancellation. */
    record CancelRequested() implements CompletionEvent {
    }
}
