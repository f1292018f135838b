package io.github.azauth.httpclient;

import io.github.azauth.AllowlistCompileException;
import io.github.azauth.util.Preconditions;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiled list of endpoints allowed to receive Azure access tokens.
 *
 * <p>Each pattern is a URL with a scheme, a host and an optional port:
 * <ul>
 *   <li>the scheme is matched exactly; wildcard schemes are not supported</li>
 *   <li>the port defaults to 80 for {@code http} and 443 for {@code https}; other schemes
 *       need an explicit port; wildcard ports are not supported</li>
 *   <li>each host label is a literal (case-insensitive) or {@code *}</li>
 * </ul>
 *
 * <p>A leading {@code *} label matches one or more labels, so {@code https://*.example.net}
 * matches subdomains at any depth but not {@code example.net} itself. Any other {@code *}
 * matches exactly one label. Patterns without wildcards match the host exactly.
 * A pattern made only of wildcards compiles but never matches.
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public final class EndpointAllowlist {

    private static final Logger logger = LoggerFactory.getLogger(EndpointAllowlist.class);

    private static final String WILDCARD = "*";

    private final List<AllowEntry> entries;

    private EndpointAllowlist(List<AllowEntry> entries) {
        this.entries = Collections.unmodifiableList(entries);
    }

    /**
     * Compiles endpoint patterns.
     *
     * @param patterns the patterns, e.g. {@code https://*.management.azure.com}
     * @return the allowlist
     * @throws AllowlistCompileException if a pattern is malformed
     */
    public static EndpointAllowlist compile(List<String> patterns) throws AllowlistCompileException {
        Preconditions.requireNonNull(patterns, "patterns");
        List<AllowEntry> entries = new ArrayList<>(patterns.size());
        for (String pattern : patterns) {
            entries.add(compileEntry(pattern));
        }
        logger.info("Compiled endpoint allowlist with {} entries", entries.size());
        return new EndpointAllowlist(entries);
    }

    /**
     * Returns whether a token may be sent to the URL.
     *
     * @param url the destination
     * @return true if some entry matches; false for null, relative or host-less URLs
     */
    public boolean isAllowed(URI url) {
        if (url == null || url.getScheme() == null || url.getRawAuthority() == null) {
            return false;
        }
        String scheme = url.getScheme().toLowerCase(Locale.ROOT);

        Authority authority;
        try {
            authority = Authority.parse(url.getRawAuthority());
        } catch (IllegalArgumentException e) {
            return false;
        }
        if (authority.host.isEmpty()) {
            return false;
        }

        int port;
        if (authority.port == null) {
            port = defaultPort(scheme);
            if (port < 0) {
                return false;
            }
        } else {
            try {
                port = parsePort(authority.port);
            } catch (IllegalArgumentException e) {
                return false;
            }
        }

        List<String> hostLabels = authority.labels();
        if (hostLabels.contains("")) {
            return false;
        }
        for (AllowEntry entry : entries) {
            if (entry.matches(scheme, port, hostLabels)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns whether a token may be sent to the URL.
     *
     * @param url the destination
     * @return true if some entry matches; false if the URL cannot be parsed
     */
    public boolean isAllowed(String url) {
        if (url == null) {
            return false;
        }
        try {
            return isAllowed(new URI(url));
        } catch (URISyntaxException e) {
            return false;
        }
    }

    /**
     * Returns the number of compiled entries.
     */
    public int size() {
        return entries.size();
    }

    private static AllowEntry compileEntry(String pattern) throws AllowlistCompileException {
        if (pattern == null || pattern.isBlank()) {
            throw new AllowlistCompileException(String.valueOf(pattern), "endpoint cannot be empty");
        }

        URI uri;
        try {
            uri = new URI(pattern.trim());
        } catch (URISyntaxException e) {
            throw new AllowlistCompileException(pattern, e.getReason(), e);
        }

        if (uri.getScheme() == null) {
            throw new AllowlistCompileException(pattern, "scheme is required");
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (uri.getRawAuthority() == null) {
            throw new AllowlistCompileException(pattern, "host is required");
        }

        Authority authority;
        try {
            authority = Authority.parse(uri.getRawAuthority());
        } catch (IllegalArgumentException e) {
            throw new AllowlistCompileException(pattern, e.getMessage(), e);
        }
        if (authority.host.isEmpty()) {
            throw new AllowlistCompileException(pattern, "host is required");
        }

        int port;
        if (authority.port == null) {
            port = defaultPort(scheme);
            if (port < 0) {
                throw new AllowlistCompileException(pattern, "scheme '" + scheme + "' requires explicit port");
            }
        } else if (WILDCARD.equals(authority.port)) {
            throw new AllowlistCompileException(pattern, "wildcard port not supported");
        } else {
            try {
                port = parsePort(authority.port);
            } catch (IllegalArgumentException e) {
                throw new AllowlistCompileException(pattern, e.getMessage(), e);
            }
        }

        List<String> labels = authority.labels();
        boolean anchored = false;
        for (String label : labels) {
            if (label.isEmpty()) {
                throw new AllowlistCompileException(pattern, "host has an empty label");
            }
            if (WILDCARD.equals(label)) {
                continue;
            }
            if (label.contains(WILDCARD)) {
                throw new AllowlistCompileException(pattern, "partial wildcard in label '" + label + "' not supported");
            }
            anchored = true;
        }
        if (!anchored) {
            logger.warn("Allow endpoint '{}' has only wildcard labels and will never match", pattern);
        }

        return new AllowEntry(scheme, port, labels, !anchored);
    }

    private static int defaultPort(String scheme) {
        switch (scheme) {
            case "http":
                return 80;
            case "https":
                return 443;
            default:
                return -1;
        }
    }

    private static int parsePort(String port) {
        int value;
        try {
            value = Integer.parseInt(port);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid port '" + port + "'", e);
        }
        if (value < 0 || value > 65535) {
            throw new IllegalArgumentException("port " + value + " out of range");
        }
        return value;
    }

    /**
     * Host and port split out of a raw URI authority. User info is discarded.
     */
    private static final class Authority {
        final String host;
        final String port;
        final boolean ipLiteral;

        private Authority(String host, String port, boolean ipLiteral) {
            this.host = host;
            this.port = port;
            this.ipLiteral = ipLiteral;
        }

        static Authority parse(String rawAuthority) {
            String hostPort = rawAuthority;
            int at = hostPort.lastIndexOf('@');
            if (at >= 0) {
                hostPort = hostPort.substring(at + 1);
            }

            if (hostPort.startsWith("[")) {
                int close = hostPort.indexOf(']');
                if (close < 0) {
                    throw new IllegalArgumentException("unterminated IPv6 address");
                }
                String host = hostPort.substring(1, close).toLowerCase(Locale.ROOT);
                String rest = hostPort.substring(close + 1);
                if (rest.isEmpty()) {
                    return new Authority(host, null, true);
                }
                if (!rest.startsWith(":")) {
                    throw new IllegalArgumentException("unexpected characters after IPv6 address");
                }
                return new Authority(host, emptyToNull(rest.substring(1)), true);
            }

            int colon = hostPort.lastIndexOf(':');
            if (colon >= 0) {
                return new Authority(hostPort.substring(0, colon).toLowerCase(Locale.ROOT),
                        emptyToNull(hostPort.substring(colon + 1)), false);
            }
            return new Authority(hostPort.toLowerCase(Locale.ROOT), null, false);
        }

        List<String> labels() {
            if (ipLiteral) {
                return List.of(host);
            }
            return Arrays.asList(host.split("\\.", -1));
        }

        private static String emptyToNull(String s) {
            return s.isEmpty() ? null : s;
        }
    }

    private static final class AllowEntry {
        final String scheme;
        final int port;
        final List<String> labels;
        final boolean neverMatch;

        AllowEntry(String scheme, int port, List<String> labels, boolean neverMatch) {
            this.scheme = scheme;
            this.port = port;
            this.labels = labels;
            this.neverMatch = neverMatch;
        }

        boolean matches(String candidateScheme, int candidatePort, List<String> hostLabels) {
            if (neverMatch || !scheme.equals(candidateScheme) || port != candidatePort) {
                return false;
            }

            int m = labels.size();
            int n = hostLabels.size();
            if (WILDCARD.equals(labels.get(0))) {
                // Leading wildcard absorbs every host label not aligned with the rest of the pattern
                int absorbed = n - (m - 1);
                if (absorbed < 1) {
                    return false;
                }
                for (int i = 1; i < m; i++) {
                    if (!labelMatches(labels.get(i), hostLabels.get(absorbed + i - 1))) {
                        return false;
                    }
                }
                return true;
            }

            if (n != m) {
                return false;
            }
            for (int i = 0; i < m; i++) {
                if (!labelMatches(labels.get(i), hostLabels.get(i))) {
                    return false;
                }
            }
            return true;
        }

        private static boolean labelMatches(String patternLabel, String hostLabel) {
            return WILDCARD.equals(patternLabel) || patternLabel.equals(hostLabel);
        }
    }
}
