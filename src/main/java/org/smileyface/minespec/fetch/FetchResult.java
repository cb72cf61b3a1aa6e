package org.smileyface.minespec.fetch;

import org.smileyface.minespec.model.RawDocument;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable result of a fetch: the status, the parsed document when the status is {@link FetchStatus#OK},
 * and diagnostics.
 */
public final class FetchResult {

    private final String url;
    private final FetchStatus status;
    private final RawDocument document;
    private final Integer httpStatus;
    private final String detail;

    private FetchResult(String url, FetchStatus status, RawDocument document, Integer httpStatus, String detail) {
        this.url = url;
        this.status = Objects.requireNonNull(status, "status");
        this.document = document;
        this.httpStatus = httpStatus;
        this.detail = detail;
    }

    public static FetchResult ok(String url, RawDocument document, int httpStatus) {
        return new FetchResult(url, FetchStatus.OK, Objects.requireNonNull(document, "document"), httpStatus, null);
    }

    public static FetchResult failure(String url, FetchStatus status, Integer httpStatus, String detail) {
        if (status == FetchStatus.OK) {
            throw new IllegalArgumentException("A failure cannot have status OK");
        }
        return new FetchResult(url, status, null, httpStatus, detail);
    }

    public static FetchResult failure(String url, FetchStatus status, String detail) {
        return failure(url, status, null, detail);
    }

    public String getUrl() { return url; }
    public FetchStatus getStatus() { return status; }
    public Integer getHttpStatus() { return httpStatus; }
    public String getDetail() { return detail; }

    public Optional<RawDocument> document() {
        return Optional.ofNullable(document);
    }

    public boolean isOk() {
        return status == FetchStatus.OK;
    }

    @Override
    public String toString() {
        return "FetchResult{" +
                "url='" + url + '\'' +
                ", status=" + status +
                (httpStatus != null ? ", httpStatus=" + httpStatus : "") +
                (detail != null ? ", detail='" + detail + '\'' : "") +
                '}';
    }
}
