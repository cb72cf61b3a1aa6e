package org.smileyface.minespec.fetch;

import java.io.IOException;

/**
 * A fetch failure worth retrying: network errors, timeouts, HTTP 5xx and 429.
 */
public class TransientFetchException extends IOException {

    private final Integer httpStatus;

    public TransientFetchException(String message, Integer httpStatus) {
        super(message);
        this.httpStatus = httpStatus;
    }

    public TransientFetchException(String message, Throwable cause) {
        super(message, cause);
        this.httpStatus = null;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }
}
