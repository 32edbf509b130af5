package com.searchpager.client.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Result of a single search invocation.
 *
 * <p>{@code truncated} is set when a document inside an otherwise valid response failed
 * to decode; {@code documents} then holds only the entries decoded before the failure.
 */
@Data
@Builder
@AllArgsConstructor
public class Page {

    @Builder.Default
    private List<User> documents = List.of();

    /** Total hits reported by the engine; may exceed the page size. */
    private long totalHits;

    /** Sort key of the last hit, unset for a page without hits. */
    @Builder.Default
    private Cursor cursor = Cursor.unset();

    /** Number of entries in {@code hits.hits}. */
    private int hitsReturned;

    /** Number of entries a decode was attempted on, including the failing one. */
    private int attempted;

    private boolean truncated;

    public static Page empty() {
        return Page.builder().build();
    }

    public int getDecoded() {
        return documents.size();
    }

    public boolean isEmpty() {
        return documents.isEmpty() && hitsReturned == 0;
    }
}
