package com.searchpager.client.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * Outcome of a bulk store request.
 */
@Data
@AllArgsConstructor
public class BulkStoreResult {

    private final int submitted;

    /** Reasons reported for the items the engine rejected. */
    private final List<String> failures;

    private final long tookMillis;

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public int getStored() {
        return submitted - failures.size();
    }
}
