package com.searchpager.client.exception;

import java.time.Duration;

/**
 * An in-flight request did not complete before its deadline and was cancelled.
 */
public class SearchTimeoutException extends SearchCancelledException {

    private static final long serialVersionUID = 1L;

    private final Duration deadline;

    public SearchTimeoutException(String index, Duration deadline) {
        super("Search on index [" + index + "] did not complete within " + deadline.toMillis() + "ms");
        this.deadline = deadline;
    }

    public Duration getDeadline() {
        return deadline;
    }
}
