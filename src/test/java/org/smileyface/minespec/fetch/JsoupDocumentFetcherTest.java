package org.smileyface.minespec.fetch;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.smileyface.minespec.config.HarvestProperties;
import org.smileyface.minespec.extractor.HtmlDocumentParser;
import org.smileyface.minespec.extractor.PdfDocumentParser;
import org.smileyface.minespec.model.ContentType;
import org.smileyface.minespec.model.RawDocument;
import org.smileyface.minespec.safety.InMemoryRobotsCache;
import org.smileyface.minespec.safety.SafetyVerdict;
import org.smileyface.minespec.safety.UrlSafetyGate;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class JsoupDocumentFetcherTest {

    private static final String SPEC_PAGE = "<html><body><h1>793F</h1>"
            + "<table><tr><td>Operating weight</td><td>180 000 kg</td></tr></table>"
            + "<p>Gross power 1976 kW</p></body></html>";

    private HttpServer server;
    private String base;
    private ScheduledExecutorService scheduler;
    private ExecutorService pool;
    private JsoupDocumentFetcher fetcher;

    private final AtomicInteger flakyHits = new AtomicInteger();
    private final AtomicInteger downHits = new AtomicInteger();
    private final AtomicInteger missingHits = new AtomicInteger();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/spec.html", ex -> send(ex, 200, "text/html; charset=UTF-8", bytes(SPEC_PAGE)));
        server.createContext("/hop", ex -> redirect(ex, 301, "/spec.html"));
        server.createContext("/loop", ex -> redirect(ex, 302, "/loop"));
        server.createContext("/to-metadata", ex -> redirect(ex, 302, "http://169.254.169.254/latest/meta-data/"));
        server.createContext("/flaky", ex -> {
            if (flakyHits.incrementAndGet() == 1) {
                send(ex, 503, "text/plain", bytes("busy"));
            } else {
                send(ex, 200, "text/html", bytes(SPEC_PAGE));
            }
        });
        server.createContext("/down", ex -> {
            downHits.incrementAndGet();
            send(ex, 503, "text/plain", bytes("down"));
        });
        server.createContext("/missing", ex -> {
            missingHits.incrementAndGet();
            send(ex, 404, "text/plain", bytes("not found"));
        });
        server.createContext("/big", ex -> send(ex, 200, "text/html", bytes("<p>" + "x".repeat(5000) + "</p>")));
        server.createContext("/brochure.pdf", ex -> send(ex, 200, "application/pdf", pdf("Operating weight: 180,000 kg")));
        server.createContext("/broken.pdf", ex -> send(ex, 200, "application/pdf", bytes("not a pdf at all")));
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();

        HarvestProperties props = new HarvestProperties();
        props.setUserAgent("TestBot/1.0");
        props.setRequestTimeoutMs(5000);
        props.setFetchDeadlineMs(10000);
        props.setMaxAttempts(3);
        props.setRetryBaseDelayMs(10);
        props.setRetryMaxDelayMs(50);
        props.setMaxRedirects(3);
        props.setMaxHtmlBytes(1000);
        props.setRespectRobots(false);

        scheduler = Executors.newSingleThreadScheduledExecutor();
        pool = Executors.newFixedThreadPool(4);
        UrlSafetyGate gate = new LoopbackAllowingGate(base);
        fetcher = new JsoupDocumentFetcher(gate, props,
                new BackoffRetry(scheduler, pool, props.getMaxAttempts(), props.getRetryBaseDelayMs(), props.getRetryMaxDelayMs()),
                new DomainThrottle(2), new HtmlDocumentParser(), new PdfDocumentParser());
    }

    @AfterEach
    void tearDown() {
        if (server != null) server.stop(0);
        scheduler.shutdownNow();
        pool.shutdownNow();
    }

    private FetchResult fetch(String path) throws Exception {
        return fetcher.fetchAsync(path.startsWith("http") ? path : base + path).get(15, TimeUnit.SECONDS);
    }

    @Test
    void fetchesAndParsesHtml() throws Exception {
        FetchResult result = fetch("/spec.html");

        assertThat(result.getStatus()).isEqualTo(FetchStatus.OK);
        assertThat(result.getHttpStatus()).isEqualTo(200);
        RawDocument doc = result.document().orElseThrow();
        assertThat(doc.getContentType()).isEqualTo(ContentType.HTML);
        assertThat(doc.getText()).contains("Gross power 1976 kW");
        assertThat(doc.getTables()).containsExactly(List.of(List.of("Operating weight", "180 000 kg")));
    }

    @Test
    void followsRedirectsAndReportsTheFinalUrl() throws Exception {
        FetchResult result = fetch("/hop");
        assertThat(result.getStatus()).isEqualTo(FetchStatus.OK);
        assertThat(result.getUrl()).isEqualTo(base + "/spec.html");
        assertThat(result.document().orElseThrow().getUrl()).isEqualTo(base + "/spec.html");
    }

    @Test
    void redirectToCloudMetadataIsDenied() throws Exception {
        FetchResult result = fetch("/to-metadata");
        assertThat(result.getStatus()).isEqualTo(FetchStatus.DENIED_SECURITY);
        assertThat(result.getUrl()).startsWith("http://169.254.169.254");
        assertThat(result.document()).isEmpty();
    }

    @Test
    void privateTargetIsDeniedWithoutRequest() throws Exception {
        FetchResult result = fetch("http://10.0.0.1/specs");
        assertThat(result.getStatus()).isEqualTo(FetchStatus.DENIED_SECURITY);
        assertThat(result.getDetail()).contains("PRIVATE_IP");
    }

    @Test
    void redirectLoopStops() throws Exception {
        FetchResult result = fetch("/loop");
        assertThat(result.getStatus()).isEqualTo(FetchStatus.ERROR_FETCH);
        assertThat(result.getDetail()).contains("redirects");
    }

    @Test
    void transientErrorsAreRetried() throws Exception {
        FetchResult result = fetch("/flaky");
        assertThat(result.getStatus()).isEqualTo(FetchStatus.OK);
        assertThat(flakyHits.get()).isEqualTo(2);
    }

    @Test
    void retriesStopAfterMaxAttempts() throws Exception {
        FetchResult result = fetch("/down");
        assertThat(result.getStatus()).isEqualTo(FetchStatus.ERROR_FETCH);
        assertThat(result.getHttpStatus()).isEqualTo(503);
        assertThat(downHits.get()).isEqualTo(3);
    }

    @Test
    void clientErrorsAreNotRetried() throws Exception {
        FetchResult result = fetch("/missing");
        assertThat(result.getStatus()).isEqualTo(FetchStatus.ERROR_FETCH);
        assertThat(result.getHttpStatus()).isEqualTo(404);
        assertThat(missingHits.get()).isEqualTo(1);
    }

    @Test
    void oversizedBodyIsRefused() throws Exception {
        assertThat(fetch("/big").getStatus()).isEqualTo(FetchStatus.TOO_LARGE);
    }

    @Test
    void readsPdfText() throws Exception {
        FetchResult result = fetch("/brochure.pdf");
        assertThat(result.getStatus()).isEqualTo(FetchStatus.OK);
        RawDocument doc = result.document().orElseThrow();
        assertThat(doc.getContentType()).isEqualTo(ContentType.PDF);
        assertThat(doc.getText()).contains("Operating weight: 180,000 kg");
    }

    @Test
    void unreadablePdfIsAParseError() throws Exception {
        assertThat(fetch("/broken.pdf").getStatus()).isEqualTo(FetchStatus.ERROR_PARSE);
    }

    @Test
    void blockingFetchReturnsDocumentOrEmpty() {
        Optional<RawDocument> ok = fetcher.fetch(base + "/spec.html");
        assertThat(ok).isPresent();
        assertThat(fetcher.fetch(base + "/missing")).isEmpty();
    }

    @Test
    void pdfIsRecognisedByTypeOrExtension() {
        assertThat(JsoupDocumentFetcher.isPdf("application/pdf", "https://a.example/x")).isTrue();
        assertThat(JsoupDocumentFetcher.isPdf(null, "https://a.example/793F.PDF?dl=1")).isTrue();
        assertThat(JsoupDocumentFetcher.isPdf("text/html", "https://a.example/793f")).isFalse();
    }

    /** Lets requests to the in-process server through; everything else goes through the real checks. */
    private static final class LoopbackAllowingGate extends UrlSafetyGate {
        private final String base;

        LoopbackAllowingGate(String base) {
            super(host -> List.of(InetAddress.getByName(host)),
                    new InMemoryRobotsCache(Duration.ofMinutes(5), Clock.systemUTC()),
                    url -> Optional.empty(), "TestBot/1.0");
            this.base = base;
        }

        @Override
        public SafetyVerdict isSafe(String url, boolean respectRobots) {
            if (url != null && url.startsWith(base + "/")) {
                return SafetyVerdict.allow();
            }
            return super.isSafe(url, respectRobots);
        }
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static void send(HttpExchange ex, int code, String contentType, byte[] body) throws IOException {
        ex.getResponseHeaders().add("Content-Type", contentType);
        ex.sendResponseHeaders(code, body.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(body);
        }
    }

    private static void redirect(HttpExchange ex, int code, String location) throws IOException {
        ex.getResponseHeaders().add("Location", location);
        ex.sendResponseHeaders(code, -1);
        ex.close();
    }

    private static byte[] pdf(String line) throws IOException {
        try (PDDocument doc = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            PDPage page = new PDPage();
            doc.addPage(page);
            try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                cs.beginText();
                cs.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                cs.newLineAtOffset(50, 700);
                cs.showText(line);
                cs.endText();
            }
            doc.save(out);
            return out.toByteArray();
        }
    }
}
