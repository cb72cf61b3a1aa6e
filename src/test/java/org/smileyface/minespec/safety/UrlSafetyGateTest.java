package org.smileyface.minespec.safety;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class UrlSafetyGateTest {

    private final Map<String, List<InetAddress>> dns = new HashMap<>();
    private final AtomicInteger robotsFetches = new AtomicInteger();
    private String robotsBody = "";
    private UrlSafetyGate gate;

    @BeforeEach
    void setUp() throws Exception {
        dns.put("public.example", List.of(addr("public.example", 93, 184, 216, 34)));
        dns.put("rebind.example", List.of(addr("rebind.example", 93, 184, 216, 34), addr("rebind.example", 10, 0, 0, 5)));
        dns.put("internal.example", List.of(addr("internal.example", 192, 168, 1, 10)));
        dns.put("empty.example", List.of());
        HostResolver resolver = host -> {
            List<InetAddress> answer = dns.get(host);
            if (answer != null) return answer;
            if (host.matches("[0-9.]+") || host.contains(":")) {
                return List.of(InetAddress.getByName(host)); // literal, no lookup
            }
            throw new UnknownHostException(host);
        };
        RobotsFetcher fetcher = url -> {
            robotsFetches.incrementAndGet();
            return Optional.of(robotsBody);
        };
        gate = new UrlSafetyGate(resolver, new InMemoryRobotsCache(Duration.ofMinutes(5), Clock.systemUTC()),
                fetcher, "MineSpecHarvester/0.1");
    }

    private static InetAddress addr(String host, int a, int b, int c, int d) throws UnknownHostException {
        return InetAddress.getByAddress(host, new byte[]{(byte) a, (byte) b, (byte) c, (byte) d});
    }

    @Test
    void publicHostIsAllowed() {
        assertThat(gate.isSafe("https://public.example/specs/793f", false).isAllowed()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "ftp://public.example/file", "file:///etc/passwd", "javascript:alert(1)",
            "http://", "http://public.example/a b", "not a url", "http://public.example:99999/"})
    void malformedOrNonHttpUrlsAreInvalid(String url) {
        SafetyVerdict v = gate.isSafe(url, false);
        assertThat(v.isAllowed()).isFalse();
        assertThat(v.getReason()).isEqualTo(DenyReason.INVALID_URL);
    }

    @Test
    void overlongUrlIsInvalid() {
        String url = "https://public.example/" + "a".repeat(5000);
        assertThat(gate.isSafe(url, false).getReason()).isEqualTo(DenyReason.INVALID_URL);
    }

    @ParameterizedTest
    @CsvSource({
            "http://127.0.0.1/, PRIVATE_IP",
            "http://localhost:8080/admin, PRIVATE_IP",
            "http://api.localhost/, PRIVATE_IP",
            "http://10.1.2.3/, PRIVATE_IP",
            "http://172.20.0.1/, PRIVATE_IP",
            "http://192.168.0.1/, PRIVATE_IP",
            "http://100.64.0.1/, PRIVATE_IP",
            "http://0.0.0.0/, PRIVATE_IP",
            "http://[::1]/, PRIVATE_IP",
            "http://[fe80::1]/, PRIVATE_IP",
            "http://[fc00::1]/, PRIVATE_IP",
            "http://[::ffff:10.0.0.1]/, PRIVATE_IP",
            "http://[::ffff:127.0.0.1]/, PRIVATE_IP",
            "http://[::ffff:169.254.169.254]/, CLOUD_METADATA",
            "http://169.254.169.254/latest/meta-data/, CLOUD_METADATA",
            "http://100.100.100.200/, CLOUD_METADATA",
            "http://metadata.google.internal/computeMetadata/v1/, CLOUD_METADATA",
            "http://Metadata.Google.Internal/, CLOUD_METADATA",
            "http://[fd00:ec2::254]/, CLOUD_METADATA",
            "http://[64:ff9b::a9fe:a9fe]/, CLOUD_METADATA",
            "http://internal.example/, PRIVATE_IP",
            "http://nowhere.invalid/, DNS_UNRESOLVED",
            "http://empty.example/, DNS_UNRESOLVED"
    })
    void internalTargetsAreDenied(String url, DenyReason expected) {
        SafetyVerdict v = gate.isSafe(url, false);
        assertThat(v.isAllowed()).as(url).isFalse();
        assertThat(v.getReason()).as(url).isEqualTo(expected);
    }

    @Test
    void anyInternalAddressAmongSeveralDeniesTheHost() {
        SafetyVerdict v = gate.isSafe("https://rebind.example/", false);
        assertThat(v.getReason()).isEqualTo(DenyReason.PRIVATE_IP);
    }

    @Test
    void resolverFailureIsDeniedNotThrown() {
        UrlSafetyGate failing = new UrlSafetyGate(host -> {
            throw new IllegalStateException("resolver down");
        }, new InMemoryRobotsCache(Duration.ofMinutes(1), Clock.systemUTC()), url -> Optional.empty(), "ua");
        assertThat(failing.isSafe("https://public.example/", false).getReason()).isEqualTo(DenyReason.DNS_UNRESOLVED);
    }

    @Test
    void robotsDisallowIsReportedSeparatelyFromSecurityDenies() {
        robotsBody = "User-agent: *\nDisallow: /private\n";
        SafetyVerdict denied = gate.isSafe("https://public.example/private/page", true);
        assertThat(denied.getReason()).isEqualTo(DenyReason.ROBOTS_DISALLOWED);
        assertThat(gate.isSafe("https://public.example/public/page", true).isAllowed()).isTrue();
        assertThat(gate.isSafe("https://public.example/private/page", false).isAllowed()).isTrue();
    }

    @Test
    void robotsTxtIsFetchedOncePerOrigin() {
        robotsBody = "User-agent: *\nDisallow: /x\n";
        gate.isSafe("https://public.example/a", true);
        gate.isSafe("https://public.example/b", true);
        gate.isSafe("https://public.example/x", true);
        assertThat(robotsFetches.get()).isEqualTo(1);
    }

    @Test
    void securityChecksRunBeforeRobots() {
        robotsBody = "User-agent: *\nDisallow: /\n";
        assertThat(gate.isSafe("http://10.0.0.1/", true).getReason()).isEqualTo(DenyReason.PRIVATE_IP);
        assertThat(robotsFetches.get()).isZero();
    }
}
