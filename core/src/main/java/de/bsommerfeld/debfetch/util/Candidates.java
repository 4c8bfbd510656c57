package de.bsommerfeld.debfetch.util;

import java.util.Optional;

/**
 * Ordered-candidate selection shared by checksum-algorithm and compression
 * selection.
 */
public final class Candidates {

    private Candidates() {
    }

    /**
     * Tries each candidate in iteration order and returns the first
     * non-empty result. Later candidates are never tried once one succeeds.
     */
    public static <T, R, E extends Exception> Optional<R> selectFirstAvailable(Iterable<T> candidates,
            Attempt<? super T, R, E> attempt) throws E {
        for (T candidate : candidates) {
            Optional<R> result = attempt.apply(candidate);
            if (result.isPresent()) {
                return result;
            }
        }
        return Optional.empty();
    }

    /**
     * A lookup that may fail with a checked exception. An empty result means
     * "not available, try the next candidate".
     */
    @FunctionalInterface
    public interface Attempt<T, R, E extends Exception> {
        Optional<R> apply(T candidate) throws E;
    }
}
