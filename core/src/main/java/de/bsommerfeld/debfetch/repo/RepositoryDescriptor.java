package de.bsommerfeld.debfetch.repo;

import de.bsommerfeld.debfetch.error.InvalidRepositorySpecException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Identifies a binary package repository as written in an APT sources line.
 *
 * <p>
 * Parses the one-line form {@code deb [options] uri distribution component...}
 * into a typed record and derives the URLs the download pipeline needs.
 * The base URI never carries a trailing slash, so joining paths onto it never
 * produces {@code //}.
 *
 * @param type         source type, always {@code deb}
 * @param baseUri      repository root without trailing slash
 * @param distribution suite or codename, e.g. {@code bullseye}
 * @param components   ordered, de-duplicated component names
 * @param options      bracketed source options such as {@code arch=amd64}
 */
public record RepositoryDescriptor(String type, String baseUri, String distribution,
        List<String> components, Map<String, String> options) {

    private static final Set<String> SUPPORTED_SCHEMES = Set.of("http", "https", "file");

    public RepositoryDescriptor {
        components = List.copyOf(components);
        options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    /**
     * Parses a repository specification line.
     *
     * @throws InvalidRepositorySpecException if the line does not contain a
     *                                        type, a well-formed URI, a
     *                                        distribution and at least one
     *                                        component
     */
    public static RepositoryDescriptor parse(String spec) throws InvalidRepositorySpecException {
        if (spec == null || spec.isBlank()) {
            throw new InvalidRepositorySpecException("Repository specification is empty");
        }
        String line = spec.strip();
        if (line.startsWith("#")) {
            throw new InvalidRepositorySpecException("Repository specification is commented out: " + spec);
        }

        List<String> tokens = new ArrayList<>(Arrays.asList(line.split("\\s+")));
        String type = tokens.remove(0);
        if (!type.equals("deb")) {
            throw new InvalidRepositorySpecException(
                    "Unsupported repository type '" + type + "' in: " + spec);
        }

        Map<String, String> options = parseOptions(tokens, spec);

        if (tokens.size() < 3) {
            throw new InvalidRepositorySpecException(
                    "Expected 'deb uri distribution component...', got: " + spec);
        }

        String baseUri = normalizeUri(tokens.get(0), spec);
        String distribution = tokens.get(1);
        if (distribution.endsWith("/")) {
            throw new InvalidRepositorySpecException(
                    "Flat repositories are not supported: " + spec);
        }

        Set<String> components = new LinkedHashSet<>(tokens.subList(2, tokens.size()));
        return new RepositoryDescriptor(type, baseUri, distribution, new ArrayList<>(components), options);
    }

    /** Returns {@code <base>/dists/<distribution>}. */
    public String distributionUrl() {
        return baseUri + "/dists/" + distribution;
    }

    /** Returns the URL of a file below the distribution directory. */
    public String distributionFileUrl(String relativePath) {
        return distributionUrl() + "/" + stripLeadingSlashes(relativePath);
    }

    /** Returns the URL of a pool file named by a control entry's {@code Filename}. */
    public String poolUrl(String filename) {
        return baseUri + "/" + stripLeadingSlashes(filename);
    }

    /** Reassembles the canonical one-line form. */
    public String toSourceLine() {
        StringBuilder sb = new StringBuilder(type);
        if (!options.isEmpty()) {
            sb.append(" [");
            options.forEach((k, v) -> sb.append(k).append('=').append(v).append(' '));
            sb.setLength(sb.length() - 1);
            sb.append(']');
        }
        sb.append(' ').append(baseUri).append(' ').append(distribution);
        components.forEach(c -> sb.append(' ').append(c));
        return sb.toString();
    }

    // =====================================================================
    // Parsing helpers
    // =====================================================================

    /**
     * Consumes a leading {@code [key=value ...]} group from the token list.
     * The group may span several whitespace-separated tokens.
     */
    private static Map<String, String> parseOptions(List<String> tokens, String spec)
            throws InvalidRepositorySpecException {
        Map<String, String> options = new LinkedHashMap<>();
        if (tokens.isEmpty() || !tokens.get(0).startsWith("[")) {
            return options;
        }

        StringBuilder group = new StringBuilder();
        while (!tokens.isEmpty()) {
            String token = tokens.remove(0);
            group.append(token).append(' ');
            if (token.endsWith("]")) {
                String body = group.toString().strip();
                for (String option : body.substring(1, body.length() - 1).strip().split("\\s+")) {
                    if (option.isEmpty())
                        continue;
                    int eq = option.indexOf('=');
                    if (eq <= 0) {
                        throw new InvalidRepositorySpecException(
                                "Malformed source option '" + option + "' in: " + spec);
                    }
                    options.put(option.substring(0, eq), option.substring(eq + 1));
                }
                return options;
            }
        }
        throw new InvalidRepositorySpecException("Unterminated option group in: " + spec);
    }

    private static String normalizeUri(String raw, String spec) throws InvalidRepositorySpecException {
        String trimmed = raw;
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }

        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException e) {
            throw new InvalidRepositorySpecException("Malformed repository URI '" + raw + "' in: " + spec, e);
        }

        String scheme = uri.getScheme() == null ? null : uri.getScheme().toLowerCase(Locale.ROOT);
        if (scheme == null || !SUPPORTED_SCHEMES.contains(scheme)) {
            throw new InvalidRepositorySpecException("Unsupported repository URI '" + raw + "' in: " + spec);
        }
        if (!scheme.equals("file") && (uri.getHost() == null || uri.getHost().isEmpty())) {
            throw new InvalidRepositorySpecException("Repository URI '" + raw + "' has no host");
        }
        return trimmed;
    }

    private static String stripLeadingSlashes(String path) {
        int i = 0;
        while (i < path.length() && path.charAt(i) == '/') {
            i++;
        }
        return path.substring(i);
    }
}
