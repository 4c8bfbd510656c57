package de.bsommerfeld.debfetch.launcher;

import picocli.CommandLine;

/**
 * Command-line entry point. Parsing and exit-code handling are delegated to
 * picocli; the work happens in {@link FetchCommand}.
 */
public final class LauncherMain {

    private LauncherMain() {
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new FetchCommand()).execute(args);
        System.exit(exitCode);
    }
}
