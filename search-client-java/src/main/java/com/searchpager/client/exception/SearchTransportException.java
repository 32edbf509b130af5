package com.searchpager.client.exception;

/**
 * The engine could not be reached or the connection failed mid-request.
 * Not retried by this client.
 */
public class SearchTransportException extends SearchClientException {

    private static final long serialVersionUID = 1L;

    private final String index;

    public SearchTransportException(String index, String message, Throwable cause) {
        super(message, cause);
        this.index = index;
    }

    public String getIndex() {
        return index;
    }
}
