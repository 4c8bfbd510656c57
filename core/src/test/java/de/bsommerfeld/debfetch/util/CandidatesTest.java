package de.bsommerfeld.debfetch.util;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CandidatesTest {

    @Test
    void selectFirstAvailable_shouldReturnFirstHit() {
        Optional<String> result = Candidates.selectFirstAvailable(List.of("a", "b", "c"),
                c -> c.equals("a") ? Optional.empty() : Optional.of(c.toUpperCase()));

        assertEquals(Optional.of("B"), result);
    }

    @Test
    void selectFirstAvailable_shouldStopProbingAfterHit() {
        List<String> tried = new ArrayList<>();
        Candidates.selectFirstAvailable(List.of("gz", "bz2", "xz"), c -> {
            tried.add(c);
            return c.equals("bz2") ? Optional.of(c) : Optional.empty();
        });

        assertEquals(List.of("gz", "bz2"), tried);
    }

    @Test
    void selectFirstAvailable_shouldReturnEmptyWhenNothingMatches() {
        assertTrue(Candidates.selectFirstAvailable(List.of(1, 2, 3), c -> Optional.empty()).isEmpty());
    }

    @Test
    void selectFirstAvailable_shouldReturnEmptyForNoCandidates() {
        assertTrue(Candidates.selectFirstAvailable(List.<String>of(), Optional::of).isEmpty());
    }

    @Test
    void selectFirstAvailable_shouldPropagateAttemptFailures() {
        List<String> tried = new ArrayList<>();
        assertThrows(IOException.class, () -> Candidates.selectFirstAvailable(List.of("a", "b"), c -> {
            tried.add(c);
            throw new IOException("boom");
        }));
        assertEquals(List.of("a"), tried);
    }
}
