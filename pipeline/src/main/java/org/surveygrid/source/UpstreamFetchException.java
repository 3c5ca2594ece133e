package org.surveygrid.source;

/**
 * The upstream source could not deliver observations: network failure,
 * non-success HTTP status, or a malformed response.
 */
public class UpstreamFetchException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public UpstreamFetchException(String message) {
        super(message);
    }

    public UpstreamFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
