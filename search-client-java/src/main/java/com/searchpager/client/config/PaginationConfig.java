package com.searchpager.client.config;

import com.searchpager.client.pagination.StopCondition;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Settings for the command-line retrieval run.
 */
@Data
@NoArgsConstructor
public class PaginationConfig {

    private Strategy strategy = Strategy.CURSOR;
    private int pageSize = 10;

    /** Upper bound of fetched records for the offset strategy. */
    private int recordBound = 100;

    /** Number of requests issued by the cursor strategy. */
    private int iterations = 10;

    private StopCondition stopCondition = StopCondition.FIXED_ITERATIONS;

    public enum Strategy {
        /** One page at offset 0. */
        SIMPLE,
        OFFSET,
        CURSOR
    }
}
