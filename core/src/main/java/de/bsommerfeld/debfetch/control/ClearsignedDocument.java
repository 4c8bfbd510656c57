package de.bsommerfeld.debfetch.control;

import de.bsommerfeld.debfetch.error.SignatureVerificationException;

import java.util.List;

/**
 * Extracts the signed text from an OpenPGP clear-signed document such as
 * {@code InRelease}.
 *
 * <p>
 * gpg only vouches for the text between the armor header and the signature
 * block, and silently ignores anything around it. The extraction is
 * therefore strict: the document must be exactly one clear-signed block.
 *
 * <h3>Accepted layout</h3>
 * <pre>
 * -----BEGIN PGP SIGNED MESSAGE-----   first line, nothing before it
 * Hash: SHA512                         zero or more Hash headers
 *                                      blank line
 * signed text                          lines starting with '-' are dash-escaped
 * -----BEGIN PGP SIGNATURE-----
 * ...
 * -----END PGP SIGNATURE-----          only blank lines may follow
 * </pre>
 * Anything else is rejected with {@link SignatureVerificationException}.
 *
 * <p>
 * This only unwraps the text. It does not check the signature; that is the
 * job of the trust verifier, which runs before the content is parsed.
 */
public final class ClearsignedDocument {

    static final String BEGIN_SIGNED = "-----BEGIN PGP SIGNED MESSAGE-----";
    static final String BEGIN_SIGNATURE = "-----BEGIN PGP SIGNATURE-----";
    static final String END_SIGNATURE = "-----END PGP SIGNATURE-----";

    private ClearsignedDocument() {
    }

    /**
     * Returns the signed content of a clear-signed document.
     *
     * @throws SignatureVerificationException if the document is not exactly
     *                                        one well-formed clear-signed block
     */
    public static String signedContent(String document) throws SignatureVerificationException {
        List<String> lines = document.lines().map(String::stripTrailing).toList();
        if (lines.isEmpty() || !lines.get(0).equals(BEGIN_SIGNED)) {
            throw reject("text before the signed block");
        }

        int index = 1;
        for (; index < lines.size() && !lines.get(index).isEmpty(); index++) {
            if (!lines.get(index).startsWith("Hash:")) {
                throw reject("unexpected armor header '" + lines.get(index) + "'");
            }
        }
        index++;

        StringBuilder content = new StringBuilder();
        int signatureStart = -1;
        for (; index < lines.size(); index++) {
            String line = lines.get(index);
            if (line.equals(BEGIN_SIGNATURE)) {
                signatureStart = index;
                break;
            }
            if (line.startsWith("-")) {
                // Unescaped dashes would be armor lines gpg does not sign
                if (!line.startsWith("- ")) {
                    throw reject("unescaped armor line '" + line + "' in signed text");
                }
                line = line.substring(2);
            }
            content.append(line).append('\n');
        }
        if (signatureStart < 0) {
            throw reject("no signature block");
        }

        int end = lines.subList(signatureStart, lines.size()).indexOf(END_SIGNATURE);
        if (end < 0) {
            throw reject("unterminated signature block");
        }
        for (index = signatureStart + end + 1; index < lines.size(); index++) {
            if (!lines.get(index).isEmpty()) {
                throw reject("text after the signature block");
            }
        }
        return content.toString();
    }

    private static SignatureVerificationException reject(String reason) {
        return new SignatureVerificationException("Malformed clear-signed document: " + reason);
    }
}
