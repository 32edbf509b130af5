package com.searchpager.client.exception;

import java.io.IOException;

/**
 * Base class for every failure raised while talking to the search engine.
 */
public class SearchClientException extends IOException {

    private static final long serialVersionUID = 1L;

    public SearchClientException(String message) {
        super(message);
    }

    public SearchClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
