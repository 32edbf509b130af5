package com.searchpager.client.exception;

/**
 * An in-flight request was aborted because the calling thread was interrupted.
 */
public class SearchCancelledException extends SearchClientException {

    private static final long serialVersionUID = 1L;

    public SearchCancelledException(String message) {
        super(message);
    }

    public SearchCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
