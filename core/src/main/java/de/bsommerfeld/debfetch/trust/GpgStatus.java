package de.bsommerfeld.debfetch.trust;

import java.util.Optional;

/**
 * Machine-readable status emitted by {@code gpg --status-fd}.
 *
 * <p>
 * A signature is trusted only if both a {@code GOODSIG} and a
 * {@code VALIDSIG} line are present. {@code GOODSIG} alone is emitted for
 * signatures made with expired keys, and {@code VALIDSIG} carries the full
 * fingerprint of the key that actually made the signature.
 *
 * @param goodSignature  a {@code [GNUPG:] GOODSIG} line was seen
 * @param validSignature a {@code [GNUPG:] VALIDSIG} line was seen
 * @param signer         user id from the GOODSIG line, if any
 * @param fingerprint    fingerprint from the VALIDSIG line, if any
 */
public record GpgStatus(boolean goodSignature, boolean validSignature, Optional<String> signer,
        Optional<String> fingerprint) {

    private static final String PREFIX = "[GNUPG:] ";

    public static GpgStatus parse(String statusOutput) {
        boolean good = false;
        boolean valid = false;
        String signer = null;
        String fingerprint = null;

        for (String line : statusOutput.split("\\R")) {
            if (!line.startsWith(PREFIX))
                continue;

            String[] parts = line.substring(PREFIX.length()).split(" ", 3);
            switch (parts[0]) {
                case "GOODSIG" -> {
                    good = true;
                    if (parts.length == 3) {
                        signer = parts[2];
                    }
                }
                case "VALIDSIG" -> {
                    valid = true;
                    if (parts.length >= 2) {
                        fingerprint = parts[1];
                    }
                }
                default -> {
                }
            }
        }
        return new GpgStatus(good, valid, Optional.ofNullable(signer), Optional.ofNullable(fingerprint));
    }

    public boolean trusted() {
        return goodSignature && validSignature;
    }
}
