package org.smileyface.minespec.fetch;

import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.minespec.config.HarvestProperties;
import org.smileyface.minespec.extractor.HtmlDocumentParser;
import org.smileyface.minespec.extractor.PdfDocumentParser;
import org.smileyface.minespec.model.RawDocument;
import org.smileyface.minespec.safety.DenyReason;
import org.smileyface.minespec.safety.SafetyVerdict;
import org.smileyface.minespec.safety.UrlSafetyGate;

import java.io.IOException;
import java.net.URI;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fetches HTML pages and PDF brochures with jsoup.
 *
 * <p>Redirects are followed by hand so that every hop passes the {@link UrlSafetyGate} before it is
 * requested. Bodies above the configured limits are refused. Network errors, HTTP 5xx and 429 are
 * retried through {@link BackoffRetry}; other HTTP errors and safety denials are final.</p>
 */
public class JsoupDocumentFetcher implements DocumentFetcher {

    private static final Logger log = LoggerFactory.getLogger(JsoupDocumentFetcher.class);

    private final UrlSafetyGate gate;
    private final HarvestProperties properties;
    private final BackoffRetry retry;
    private final DomainThrottle throttle;
    private final HtmlDocumentParser htmlParser;
    private final PdfDocumentParser pdfParser;

    public JsoupDocumentFetcher(UrlSafetyGate gate, HarvestProperties properties, BackoffRetry retry,
                                DomainThrottle throttle, HtmlDocumentParser htmlParser, PdfDocumentParser pdfParser) {
        this.gate = Objects.requireNonNull(gate, "gate");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.retry = Objects.requireNonNull(retry, "retry");
        this.throttle = Objects.requireNonNull(throttle, "throttle");
        this.htmlParser = Objects.requireNonNull(htmlParser, "htmlParser");
        this.pdfParser = Objects.requireNonNull(pdfParser, "pdfParser");
    }

    @Override
    public CompletableFuture<FetchResult> fetchAsync(String url) {
        CompletableFuture<FetchResult> attempts = retry.execute(() -> fetchOnce(url));
        CompletableFuture<FetchResult> result = attempts
                .handle((r, t) -> r != null ? r : failureOf(url, t))
                .completeOnTimeout(FetchResult.failure(url, FetchStatus.ERROR_FETCH, "deadline exceeded"),
                        properties.getFetchDeadlineMs(), TimeUnit.MILLISECONDS);
        result.whenComplete((r, t) -> {
            if (!attempts.isDone()) attempts.cancel(true);
        });
        return result;
    }

    @Override
    public Optional<RawDocument> fetch(String url) {
        CompletableFuture<FetchResult> f = fetchAsync(url);
        try {
            return f.get(properties.getFetchDeadlineMs() + 1000L, TimeUnit.MILLISECONDS).document();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            f.cancel(true);
            return Optional.empty();
        } catch (ExecutionException | TimeoutException e) {
            f.cancel(true);
            log.warn("Fetch of {} did not complete: {}", url, e.toString());
            return Optional.empty();
        }
    }

    /**
     * One attempt, including the redirect chain.
     *
     * @throws TransientFetchException for failures worth another attempt
     */
    FetchResult fetchOnce(String url) throws TransientFetchException {
        Instant start = Instant.now();
        String current = url;
        for (int hop = 0; hop <= properties.getMaxRedirects(); hop++) {
            SafetyVerdict verdict = gate.isSafe(current, properties.isRespectRobots());
            if (!verdict.isAllowed()) {
                FetchStatus status = verdict.getReason() == DenyReason.ROBOTS_DISALLOWED
                        ? FetchStatus.SKIPPED_ROBOTS : FetchStatus.DENIED_SECURITY;
                return FetchResult.failure(current, status, verdict.toString());
            }
            final String target = current;
            Connection.Response res;
            try {
                res = throttle.withPermit(RawDocument.domainOf(target), permitWaitMs(), () -> execute(target));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return FetchResult.failure(target, FetchStatus.ERROR_FETCH, "interrupted");
            }
            int code = res.statusCode();
            if (code >= 300 && code < 400) {
                String location = res.header("Location");
                if (location == null || location.isBlank()) {
                    return FetchResult.failure(target, FetchStatus.ERROR_FETCH, code, "redirect without Location");
                }
                try {
                    current = URI.create(target).resolve(location.trim()).toString();
                } catch (IllegalArgumentException e) {
                    return FetchResult.failure(target, FetchStatus.ERROR_FETCH, code, "bad redirect target " + location);
                }
                log.debug("Redirect {} -> {} ({})", target, current, code);
                continue;
            }
            if (code == 429 || code >= 500) {
                throw new TransientFetchException("HTTP " + code + " from " + target, code);
            }
            if (code >= 400) {
                return FetchResult.failure(target, FetchStatus.ERROR_FETCH, code, "HTTP " + code);
            }
            FetchResult result = toDocument(target, res, code);
            log.debug("Fetched {} -> {} in {} ms", url, result.getStatus(),
                    Math.max(0, Instant.now().toEpochMilli() - start.toEpochMilli()));
            return result;
        }
        return FetchResult.failure(current, FetchStatus.ERROR_FETCH, "more than " + properties.getMaxRedirects() + " redirects");
    }

    // Wait for a domain permit at most one request timeout; a miss is retried after backoff.
    private long permitWaitMs() {
        int requestTimeout = properties.getRequestTimeoutMs();
        return requestTimeout > 0 ? Math.min(requestTimeout, properties.getFetchDeadlineMs()) : properties.getFetchDeadlineMs();
    }

    private Connection.Response execute(String target) throws TransientFetchException {
        long limit = Math.max(properties.getMaxHtmlBytes(), properties.getMaxPdfBytes());
        try {
            return Jsoup.connect(target)
                    .userAgent(Objects.toString(properties.getUserAgent(), "MineSpecHarvester/0.1"))
                    .timeout(Math.max(0, properties.getRequestTimeoutMs()))
                    .followRedirects(false)
                    .ignoreHttpErrors(true)
                    .ignoreContentType(true)
                    .maxBodySize((int) Math.min(Integer.MAX_VALUE, limit + 1))
                    .execute();
        } catch (IOException e) {
            throw new TransientFetchException("Fetch of " + target + " failed: " + e.getMessage(), e);
        }
    }

    private FetchResult toDocument(String finalUrl, Connection.Response res, int code) {
        boolean pdf = isPdf(res.contentType(), finalUrl);
        long limit = pdf ? properties.getMaxPdfBytes() : properties.getMaxHtmlBytes();
        String declared = res.header("Content-Length");
        if (declared != null && parseLong(declared) > limit) {
            return FetchResult.failure(finalUrl, FetchStatus.TOO_LARGE, code, "declared " + declared + " bytes");
        }
        byte[] body;
        try {
            body = res.bodyAsBytes();
        } catch (RuntimeException e) {
            return FetchResult.failure(finalUrl, FetchStatus.ERROR_FETCH, code, "body read failed: " + e.getMessage());
        }
        if (body.length > limit) {
            return FetchResult.failure(finalUrl, FetchStatus.TOO_LARGE, code, "body exceeds " + limit + " bytes");
        }
        Instant now = Instant.now();
        try {
            RawDocument doc = pdf
                    ? pdfParser.parse(finalUrl, body, now)
                    : htmlParser.parse(finalUrl, res.body(), now);
            return FetchResult.ok(finalUrl, doc, code);
        } catch (IOException | RuntimeException e) {
            log.warn("Could not parse {}: {}", finalUrl, e.toString());
            return FetchResult.failure(finalUrl, FetchStatus.ERROR_PARSE, code, e.getMessage());
        }
    }

    static boolean isPdf(String contentType, String url) {
        if (contentType != null && contentType.toLowerCase(Locale.ROOT).contains("pdf")) return true;
        return url.toLowerCase(Locale.ROOT).split("[?#]", 2)[0].endsWith(".pdf");
    }

    private static long parseLong(String s) {
        try {
            return Long.parseLong(s.trim());
        } catch (NumberFormatException e) {
            return -1L;
        }
    }

    private static FetchResult failureOf(String url, Throwable t) {
        Throwable cause = t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
        if (cause instanceof TransientFetchException tfe) {
            return FetchResult.failure(url, FetchStatus.ERROR_FETCH, tfe.getHttpStatus(), tfe.getMessage());
        }
        return FetchResult.failure(url, FetchStatus.ERROR_FETCH, String.valueOf(cause));
    }
}
