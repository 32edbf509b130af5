package com.searchpager.client.exception;

import com.searchpager.client.model.User;

import java.util.List;

/**
 * Aborts a multi-page retrieval. Carries the documents accumulated before the
 * failing iteration so callers can decide whether a partial result is usable.
 */
public class PaginationException extends SearchClientException {

    private static final long serialVersionUID = 1L;

    private final String index;
    private final String strategy;
    private final int iteration;
    private final transient List<User> partialResults;

    public PaginationException(String index, String strategy, int iteration,
                               List<User> partialResults, Throwable cause) {
        super(strategy + " pagination of index [" + index + "] failed at iteration " + iteration
                + " after " + partialResults.size() + " documents: " + cause.getMessage(), cause);
        this.index = index;
        this.strategy = strategy;
        this.iteration = iteration;
        this.partialResults = List.copyOf(partialResults);
    }

    public String getIndex() {
        return index;
    }

    public String getStrategy() {
        return strategy;
    }

    /** Zero-based iteration that failed. */
    public int getIteration() {
        return iteration;
    }

    public List<User> getPartialResults() {
        return partialResults;
    }
}
