package de.bsommerfeld.debfetch.trust;

import de.bsommerfeld.debfetch.error.SignatureVerificationException;
import de.bsommerfeld.debfetch.release.FetchedRelease;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Verifies release signatures by running an external {@code gpg}.
 *
 * <h3>Isolation</h3>
 * Every gpg call runs with {@code --homedir} pointing at the
 * {@link TrustContext} directory and {@code --no-default-keyring}, so the
 * user's own keyrings and trust database are never consulted. The repository
 * key is imported into a keyring that exists only inside the context.
 *
 * <h3>Decision</h3>
 * The status stream ({@code --status-fd 1}) must contain both
 * {@code GOODSIG} and {@code VALIDSIG}; see {@link GpgStatus}. SHA-1 and
 * RIPEMD-160 are declared weak digests, so signatures relying on them are
 * rejected.
 */
public class GpgSignatureVerifier implements SignatureVerifier {

    private static final Logger LOG = LoggerFactory.getLogger(GpgSignatureVerifier.class);

    private static final List<String> WEAK_DIGESTS = List.of("SHA1", "RIPEMD160");

    private final String executable;
    private final Duration timeout;

    public GpgSignatureVerifier() {
        this("gpg", Duration.ofMinutes(2));
    }

    public GpgSignatureVerifier(String executable, Duration timeout) {
        this.executable = executable;
        this.timeout = timeout;
    }

    @Override
    public void verify(FetchedRelease release, TrustContext context) throws SignatureVerificationException {
        RepositoryKey key = context.key().orElseThrow(
                () -> new IllegalStateException("Signature verification requires a repository key"));

        try {
            importKey(key, context);

            Path document = context.write(release.fileName(), release.content());
            Path signature = null;
            if (!release.inlineSigned()) {
                byte[] detached = release.detachedSignature().orElseThrow(
                        () -> new SignatureVerificationException(
                                "No detached signature available for " + release.sourceUrl()));
                signature = context.write("Release.gpg", detached);
            }

            GpgStatus status = GpgStatus.parse(run(verifyCommand(context, document, signature), context));
            if (!status.trusted()) {
                LOG.info("Signature check failed for {} (GOODSIG={}, VALIDSIG={})",
                        release.sourceUrl(), status.goodSignature(), status.validSignature());
                throw new SignatureVerificationException(
                        "Signature check failed for " + release.sourceUrl() + " using key from " + key.origin());
            }
            LOG.info("Signature check ok for {}, signed by {} ({})", release.sourceUrl(),
                    status.signer().orElse("unknown"), status.fingerprint().orElse("unknown fingerprint"));
        } catch (IOException e) {
            throw new SignatureVerificationException("Unable to run " + executable + ": " + e.getMessage(), e);
        }
    }

    // =====================================================================
    // Commands
    // =====================================================================

    private void importKey(RepositoryKey key, TrustContext context)
            throws IOException, SignatureVerificationException {
        Path keyFile = context.write("repository.key", key.material());

        List<String> cmd = baseCommand(context);
        cmd.add("--import");
        cmd.add(keyFile.toString());

        ProcessResult result = execute(cmd, context);
        if (result.exitCode() != 0) {
            throw new SignatureVerificationException(
                    "Unable to import repository key from " + key.origin() + " (gpg exit code " + result.exitCode() + ")");
        }
        LOG.debug("Imported repository key from {} into {}", key.origin(), context.keyring());
    }

    List<String> verifyCommand(TrustContext context, Path document, Path detachedSignature) {
        List<String> cmd = baseCommand(context);
        for (String digest : WEAK_DIGESTS) {
            cmd.add("--weak-digest");
            cmd.add(digest);
        }
        cmd.add("--status-fd");
        cmd.add("1");
        cmd.add("--verify");
        if (detachedSignature != null) {
            cmd.add(detachedSignature.toString());
        }
        cmd.add(document.toString());
        return cmd;
    }

    private List<String> baseCommand(TrustContext context) {
        List<String> cmd = new ArrayList<>();
        cmd.add(executable);
        cmd.add("--homedir");
        cmd.add(context.directory().toString());
        cmd.add("--batch");
        cmd.add("--no-default-keyring");
        cmd.add("--keyring");
        cmd.add(context.keyring().toString());
        return cmd;
    }

    // =====================================================================
    // Process I/O
    // =====================================================================

    /** Runs a verification command and returns its status output. */
    private String run(List<String> cmd, TrustContext context) throws IOException, SignatureVerificationException {
        ProcessResult result = execute(cmd, context);
        LOG.debug("gpg status output:\n{}", result.stdout());
        return result.stdout();
    }

    /**
     * Starts the process with stdout and stderr captured to files inside the
     * context and waits for completion within the timeout. Output is read
     * only after the process has exited, so a hanging gpg cannot block past
     * the timeout. A process that does not finish in time is force-killed
     * together with its descendants.
     */
    private ProcessResult execute(List<String> cmd, TrustContext context)
            throws IOException, SignatureVerificationException {
        Path stdout = Files.createTempFile(context.directory(), "gpg-", ".out");
        Path stderr = Files.createTempFile(context.directory(), "gpg-", ".err");
        ProcessBuilder pb = new ProcessBuilder(cmd)
                .redirectOutput(stdout.toFile())
                .redirectError(stderr.toFile());
        pb.environment().put("LC_ALL", "C");

        Process process = pb.start();
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                kill(process);
                throw new SignatureVerificationException(executable + " timed out after " + timeout);
            }
        } catch (InterruptedException e) {
            kill(process);
            Thread.currentThread().interrupt();
            throw new SignatureVerificationException("Interrupted while waiting for " + executable, e);
        }

        LOG.debug("{} exited with {}: {}", executable, process.exitValue(), Files.readString(stderr).strip());
        return new ProcessResult(process.exitValue(), Files.readString(stdout, StandardCharsets.UTF_8));
    }

    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private record ProcessResult(int exitCode, String stdout) {}
}
