package org.smileyface.minespec.fetch;

import org.smileyface.minespec.model.RawDocument;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Fetches a URL and turns it into a {@link RawDocument}. Implementations must pass every request,
 * redirects included, through the URL safety gate.
 */
public interface DocumentFetcher {

    /**
     * Starts fetching {@code url}. The returned future always completes normally with a result,
     * never exceptionally; cancelling it stops pending retries.
     */
    CompletableFuture<FetchResult> fetchAsync(String url);

    /**
     * Fetches {@code url} and waits for the result.
     *
     * @return the document, or empty on denial, failure or timeout
     */
    Optional<RawDocument> fetch(String url);
}
