package org.yaric.processing;

import java.time.Duration;

/**
 * Result of saving (or discarding) one staged raster.
 *
 * @param outputLocation saved location, null unless saved
 * @param message        failure description, null unless saving failed
 */
public record PersistenceOutcome(boolean saved, String outputLocation, String message, Duration savingTime) {

    public static PersistenceOutcome saved(String outputLocation, Duration savingTime) {
        return new PersistenceOutcome(true, outputLocation, null, savingTime);
    }

    public static PersistenceOutcome failed(String message, Duration savingTime) {
        return new PersistenceOutcome(false, null, message, savingTime);
    }

    public static PersistenceOutcome discarded(Duration savingTime) {
        return new PersistenceOutcome(false, null, null, savingTime);
    }
}
