package de.bsommerfeld.debfetch.launcher;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.debfetch.api.PackageDownloader;
import de.bsommerfeld.debfetch.error.PackageDownloadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Downloads one package and prints the path of the verified file.
 *
 * <p>
 * Options given on the command line win over {@code debfetch.toml}. Library
 * errors are reported by kind and mapped to an exit code; the process is
 * never terminated from inside the pipeline.
 */
@Command(name = "debfetch", mixinStandardHelpOptions = true, version = "debfetch 1.0",
        description = "Downloads a single verified package from a Debian-style repository.")
public class FetchCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(FetchCommand.class);

    @Option(names = { "-r", "--repository" }, required = true,
            description = "Repository line, e.g. 'deb http://deb.debian.org/debian bullseye main'")
    String repository;

    @Option(names = { "-k", "--key" },
            description = "Repository key: URL, file or armored key. Without it nothing is verified.")
    String key;

    @Option(names = { "-a", "--arch" }, description = "Architecture to search, repeatable")
    List<String> architectures;

    @Option(names = { "-d", "--dest" }, description = "Destination directory")
    Path destination;

    @Option(names = { "-c", "--config" }, description = "Configuration file (default: ${DEFAULT-VALUE})")
    Path configPath = ConfigLoader.defaultLocation();

    @Parameters(index = "0", paramLabel = "PACKAGE", description = "Name of the package to download")
    String packageName;

    private final PrintStream out;

    public FetchCommand() {
        this(System.out);
    }

    FetchCommand(PrintStream out) {
        this.out = out;
    }

    @Override
    public Integer call() {
        FetcherConfig config;
        try {
            config = ConfigLoader.load(configPath);
        } catch (IOException e) {
            LOG.error("Failed to load configuration from {}: {}", configPath, e.getMessage());
            return ExitCodes.UNEXPECTED;
        }

        Injector injector = Guice.createInjector(new FetcherModule(config));
        PackageDownloaderFactory factory = injector.getInstance(PackageDownloaderFactory.class);

        List<String> archs = architectures != null && !architectures.isEmpty()
                ? architectures
                : config.getArchitectures();
        Path dest = destination != null ? destination : Path.of(config.getDestination());

        try {
            PackageDownloader downloader = factory.create(repository, key, archs);
            Path result = downloader.download(packageName, dest);
            out.println(result);
            return ExitCodes.OK;
        } catch (PackageDownloadException e) {
            LOG.error("{}: {}", e.kind(), e.getMessage());
            LOG.debug("Download failure", e);
            return ExitCodes.of(e.kind());
        }
    }
}
