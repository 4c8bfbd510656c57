package de.bsommerfeld.debfetch.control;

import de.bsommerfeld.debfetch.error.SignatureVerificationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ClearsignedDocumentTest {

    private static final String SIGNATURE = """
            -----BEGIN PGP SIGNATURE-----

            iQIzBAEBCgAdFiEE
            =AbCd
            -----END PGP SIGNATURE-----
            """;

    private static final String SIGNED = """
            -----BEGIN PGP SIGNED MESSAGE-----
            Hash: SHA512

            Origin: Debian
            Suite: stable
            - -----not an armor line
            """ + SIGNATURE;

    @Test
    void signedContent_shouldStripArmorHeadersAndSignature() throws Exception {
        String content = ClearsignedDocument.signedContent(SIGNED);

        assertEquals("Origin: Debian\nSuite: stable\n-----not an armor line\n", content);
        assertFalse(content.contains("Hash:"));
        assertFalse(content.contains("PGP"));
    }

    @Test
    void signedContent_shouldHandleMultipleHashHeaders() throws Exception {
        String doc = "-----BEGIN PGP SIGNED MESSAGE-----\nHash: SHA256\nHash: SHA512\n\nA: 1\n" + SIGNATURE;
        assertEquals("A: 1\n", ClearsignedDocument.signedContent(doc));
    }

    @Test
    void signedContent_shouldAcceptCrlfAndTrailingBlankLines() throws Exception {
        String doc = (SIGNED + "\n\n").replace("\n", "\r\n");
        assertEquals("Origin: Debian\nSuite: stable\n-----not an armor line\n",
                ClearsignedDocument.signedContent(doc));
    }

    @Test
    void signedContent_shouldYieldParseableParagraph() throws Exception {
        ControlParagraph paragraph = ControlFileReader.parseAll(ClearsignedDocument.signedContent(SIGNED)).get(0);

        assertEquals("Debian", paragraph.get("Origin").orElseThrow());
        assertEquals("stable", paragraph.get("Suite").orElseThrow());
    }

    // -- rejection --

    @Test
    void signedContent_shouldRejectTextBeforeArmorLine() {
        String doc = "Origin: Evil\nSHA256:\n 00 1 main/binary-amd64/Packages\n\n" + SIGNED;

        SignatureVerificationException e = assertThrows(SignatureVerificationException.class,
                () -> ClearsignedDocument.signedContent(doc));
        assertTrue(e.getMessage().contains("text before the signed block"));
    }

    @Test
    void signedContent_shouldRejectLeadingBlankLines() {
        assertThrows(SignatureVerificationException.class,
                () -> ClearsignedDocument.signedContent("\n\n" + SIGNED));
    }

    @Test
    void signedContent_shouldRejectTextAfterSignature() {
        String doc = SIGNED + "\nOrigin: Evil\n";

        SignatureVerificationException e = assertThrows(SignatureVerificationException.class,
                () -> ClearsignedDocument.signedContent(doc));
        assertTrue(e.getMessage().contains("text after the signature block"));
    }

    @Test
    void signedContent_shouldRejectSecondSignedBlock() {
        assertThrows(SignatureVerificationException.class,
                () -> ClearsignedDocument.signedContent(SIGNED + SIGNED));
    }

    @Test
    void signedContent_shouldRejectUnescapedArmorLineInText() {
        String doc = "-----BEGIN PGP SIGNED MESSAGE-----\nHash: SHA512\n\nA: 1\n"
                + "-----BEGIN PGP SIGNED MESSAGE-----\nB: 2\n" + SIGNATURE;
        assertThrows(SignatureVerificationException.class, () -> ClearsignedDocument.signedContent(doc));
    }

    @Test
    void signedContent_shouldRejectUnknownArmorHeader() {
        String doc = "-----BEGIN PGP SIGNED MESSAGE-----\nOrigin: Evil\n\nA: 1\n" + SIGNATURE;
        assertThrows(SignatureVerificationException.class, () -> ClearsignedDocument.signedContent(doc));
    }

    @Test
    void signedContent_shouldRejectMissingOrUnterminatedSignature() {
        String head = "-----BEGIN PGP SIGNED MESSAGE-----\nHash: SHA512\n\nA: 1\n";

        assertThrows(SignatureVerificationException.class, () -> ClearsignedDocument.signedContent(head));
        assertThrows(SignatureVerificationException.class,
                () -> ClearsignedDocument.signedContent(head + "-----BEGIN PGP SIGNATURE-----\nxyz\n"));
    }

    @Test
    void signedContent_shouldRejectPlainDocument() {
        assertThrows(SignatureVerificationException.class,
                () -> ClearsignedDocument.signedContent("Origin: Debian\nSuite: stable\n"));
    }
}
