package com.searchpager.client.exception;

/**
 * A response body did not have the expected shape, or could not be parsed at all.
 */
public class ResponseDecodeException extends SearchClientException {

    private static final long serialVersionUID = 1L;

    public ResponseDecodeException(String message) {
        super(message);
    }

    public ResponseDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
