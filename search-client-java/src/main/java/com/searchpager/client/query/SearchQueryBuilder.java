package com.searchpager.client.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.searchpager.client.model.Cursor;

/**
 * Builds the match-all query sorted ascending by {@code ID}.
 *
 * <p>The sort clause is always present: search_after continuation is only correct over a
 * total, stable order.</p>
 */
public class SearchQueryBuilder {

    public static final String SORT_FIELD = "ID";

    private final ObjectMapper objectMapper;

    public SearchQueryBuilder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param offset page start, ignored when {@code cursor} is set
     * @param size   page size, must be positive
     * @param cursor sort key of the last document of the previous page, or unset
     */
    public SearchQuery build(int offset, int size, Cursor cursor) {
        if (size <= 0) {
            throw new IllegalArgumentException("Page size must be positive: " + size);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Offset must not be negative: " + offset);
        }

        ObjectNode body = objectMapper.createObjectNode();
        body.putObject("query").putObject("match_all");
        body.putArray("sort")
                .addObject()
                .putObject(SORT_FIELD)
                .put("order", "asc");

        if (cursor.isSet()) {
            addSortValue(body.putArray("search_after"), cursor.getValue());
            return new SearchQuery(body, null, size, cursor);
        }
        return new SearchQuery(body, offset, size, cursor);
    }

    private static void addSortValue(ArrayNode array, Object value) {
        if (value instanceof Long || value instanceof Integer) {
            array.add(((Number) value).longValue());
        } else if (value instanceof Number) {
            array.add(((Number) value).doubleValue());
        } else if (value instanceof Boolean) {
            array.add((Boolean) value);
        } else {
            array.add(value.toString());
        }
    }
}
