package com.searchpager.client.pagination;

/**
 * When a pagination loop ends before its configured bound.
 */
public enum StopCondition {

    /** Always run the configured number of requests, even past the last document. */
    FIXED_ITERATIONS,

    /** Stop after the first page that carries no hits. */
    EMPTY_PAGE,

    /** Stop once the engine-reported total is covered, or on an empty page. */
    TOTAL_REACHED
}
