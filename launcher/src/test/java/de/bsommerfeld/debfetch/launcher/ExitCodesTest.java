package de.bsommerfeld.debfetch.launcher;

import de.bsommerfeld.debfetch.error.ErrorKind;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ExitCodesTest {

    @Test
    void of_shouldMapEachKindToDocumentedCode() {
        assertEquals(2, ExitCodes.of(ErrorKind.INVALID_REPOSITORY_SPEC));
        assertEquals(3, ExitCodes.of(ErrorKind.REPOSITORY_UNREACHABLE));
        assertEquals(4, ExitCodes.of(ErrorKind.SIGNATURE_VERIFICATION_FAILED));
        assertEquals(5, ExitCodes.of(ErrorKind.NO_CHECKSUM_SECTION));
        assertEquals(6, ExitCodes.of(ErrorKind.CHECKSUM_MISMATCH));
        assertEquals(7, ExitCodes.of(ErrorKind.PACKAGE_NOT_FOUND));
    }

    @Test
    void of_shouldNeverCollideWithSuccessOrUnexpected() {
        Set<Integer> codes = Arrays.stream(ErrorKind.values()).map(ExitCodes::of).collect(Collectors.toSet());

        assertEquals(ErrorKind.values().length, codes.size());
        assertFalse(codes.contains(ExitCodes.OK));
        assertFalse(codes.contains(ExitCodes.UNEXPECTED));
    }
}
