package org.smileyface.minespec.safety;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether a URL may be fetched. Every outbound request, including each redirect hop, must
 * pass through {@link #isSafe(String, boolean)} first.
 *
 * <p>Checks run in order and fail closed: URL syntax and scheme, well-known metadata and local host
 * names, DNS resolution, every resolved address against private, loopback, link-local and cloud
 * metadata ranges, and finally (optionally) robots.txt. Verdicts are computed fresh on every call;
 * only robots.txt bodies are cached.</p>
 */
public class UrlSafetyGate {

    private static final Logger log = LogManager.getLogger();

    public static final int MAX_URL_LENGTH = 2048;

    private final HostResolver resolver;
    private final RobotsCache robotsCache;
    private final RobotsFetcher robotsFetcher;
    private final String userAgent;

    public UrlSafetyGate(HostResolver resolver, RobotsCache robotsCache, RobotsFetcher robotsFetcher,
                         String userAgent) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.robotsCache = Objects.requireNonNull(robotsCache, "robotsCache");
        this.robotsFetcher = Objects.requireNonNull(robotsFetcher, "robotsFetcher");
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
    }

    /**
     * @param url           absolute URL to check
     * @param respectRobots whether robots.txt of the target origin is consulted
     * @return {@link SafetyVerdict#allow()} or a deny verdict with its reason
     */
    public SafetyVerdict isSafe(String url, boolean respectRobots) {
        SafetyVerdict verdict = evaluate(url, respectRobots);
        if (!verdict.isAllowed()) {
            if (verdict.getReason() == DenyReason.ROBOTS_DISALLOWED) {
                log.info("Skipping {}: {}", abbreviate(url), verdict);
            } else {
                log.warn("Refused {}: {}", abbreviate(url), verdict);
            }
        }
        return verdict;
    }

    private SafetyVerdict evaluate(String url, boolean respectRobots) {
        URI uri;
        try {
            uri = parse(url);
        } catch (IllegalArgumentException e) {
            return SafetyVerdict.deny(DenyReason.INVALID_URL, e.getMessage());
        }
        String host = stripBrackets(uri.getHost());

        Optional<DenyReason> byName = AddressPolicy.classifyHost(host);
        if (byName.isPresent()) {
            return SafetyVerdict.deny(byName.get(), "host " + host);
        }

        List<InetAddress> addresses;
        try {
            addresses = resolver.resolve(host);
        } catch (UnknownHostException e) {
            return SafetyVerdict.deny(DenyReason.DNS_UNRESOLVED, "host " + host);
        } catch (RuntimeException e) {
            log.debug("Resolver failure for {}", host, e);
            return SafetyVerdict.deny(DenyReason.DNS_UNRESOLVED, "host " + host + ": " + e.getMessage());
        }
        if (addresses == null || addresses.isEmpty()) {
            return SafetyVerdict.deny(DenyReason.DNS_UNRESOLVED, "host " + host + " has no addresses");
        }
        for (InetAddress address : addresses) {
            if (address == null) {
                return SafetyVerdict.deny(DenyReason.DNS_UNRESOLVED, "host " + host + " returned a null address");
            }
            Optional<DenyReason> reason = AddressPolicy.classify(address);
            if (reason.isPresent()) {
                return SafetyVerdict.deny(reason.get(), host + " -> " + address.getHostAddress());
            }
        }

        if (respectRobots && !robotsAllow(uri)) {
            return SafetyVerdict.deny(DenyReason.ROBOTS_DISALLOWED, uri.getRawPath());
        }
        return SafetyVerdict.allow();
    }

    private boolean robotsAllow(URI uri) {
        String origin = origin(uri);
        String body = robotsCache.get(origin).orElseGet(() -> {
            String fetched = robotsFetcher.fetch(origin + "/robots.txt").orElse("");
            robotsCache.put(origin, fetched);
            return fetched;
        });
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null) {
            path = path + "?" + uri.getRawQuery();
        }
        return RobotsRules.parse(body, userAgent).isAllowed(path);
    }

    /**
     * Parses and syntactically validates a URL: http or https, a host, at most
     * {@value #MAX_URL_LENGTH} characters, no whitespace or control characters.
     *
     * @throws IllegalArgumentException describing the first problem found
     */
    static URI parse(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("empty URL");
        }
        if (url.length() > MAX_URL_LENGTH) {
            throw new IllegalArgumentException("URL longer than " + MAX_URL_LENGTH + " characters");
        }
        for (int i = 0; i < url.length(); i++) {
            char c = url.charAt(i);
            if (Character.isWhitespace(c) || Character.isISOControl(c)) {
                throw new IllegalArgumentException("URL contains whitespace or control characters");
            }
        }
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("malformed URL: " + e.getReason());
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("unsupported scheme '" + scheme + "'");
        }
        if (uri.getHost() == null || stripBrackets(uri.getHost()).isBlank()) {
            throw new IllegalArgumentException("URL has no host");
        }
        int port = uri.getPort();
        if (port != -1 && (port < 1 || port > 65535)) {
            throw new IllegalArgumentException("invalid port " + port);
        }
        return uri;
    }

    /** {@code scheme://host[:port]} of the URL, lower-cased. */
    static String origin(URI uri) {
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        return uri.getPort() == -1 ? scheme + "://" + host : scheme + "://" + host + ":" + uri.getPort();
    }

    private static String stripBrackets(String host) {
        if (host != null && host.startsWith("[") && host.endsWith("]")) {
            return host.substring(1, host.length() - 1);
        }
        return host;
    }

    private static String abbreviate(String url) {
        if (url == null) return "null";
        return url.length() > 200 ? url.substring(0, 200) + "..." : url;
    }
}
