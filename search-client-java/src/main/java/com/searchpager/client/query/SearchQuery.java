package com.searchpager.client.query;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.searchpager.client.model.Cursor;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * A built search: the JSON body plus the paging parameters sent alongside it.
 *
 * <p>{@code from} is {@code null} in cursor mode; the body then carries {@code search_after}.
 */
@Getter
@ToString
@AllArgsConstructor
public class SearchQuery {

    private final ObjectNode body;
    private final Integer from;
    private final int size;
    private final Cursor cursor;

    public boolean isCursorMode() {
        return cursor.isSet();
    }
}
