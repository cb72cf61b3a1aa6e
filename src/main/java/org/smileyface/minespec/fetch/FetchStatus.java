package org.smileyface.minespec.fetch;

/**
 * Outcome of fetching one URL.
 */
public enum FetchStatus {
    /** Successfully fetched and parsed. */
    OK,

    /** Refused by the safety gate (invalid URL, unresolvable or private host, cloud metadata). */
    DENIED_SECURITY,

    /** Skipped due to robots.txt disallow rules. */
    SKIPPED_ROBOTS,

    /** Failed to fetch (network error, timeout, HTTP error, too many redirects). */
    ERROR_FETCH,

    /** Fetched but the payload could not be parsed. */
    ERROR_PARSE,

    /** Body larger than the configured limit for its content type. */
    TOO_LARGE
}
