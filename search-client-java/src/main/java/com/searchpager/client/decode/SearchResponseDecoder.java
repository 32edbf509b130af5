package com.searchpager.client.decode;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.searchpager.client.exception.ResponseDecodeException;
import com.searchpager.client.model.Cursor;
import com.searchpager.client.model.Page;
import com.searchpager.client.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes a search response envelope into a {@link Page}.
 *
 * <p>Decoding happens in two phases. The envelope is first read into a {@link JsonNode} tree
 * because its shape varies (nested objects of variable depth). Each hit's {@code _source} is
 * then re-encoded to bytes and bound to {@link User}.</p>
 *
 * <p>Envelope problems ({@code hits.total.value} missing, {@code hits.hits} not an array, no
 * sort values on the last hit) fail the whole decode. A document that cannot be bound is
 * logged and ends the iteration: the page keeps the documents decoded so far, the engine
 * total and the cursor, and is flagged {@code truncated}.</p>
 */
public class SearchResponseDecoder {

    private static final Logger logger = LoggerFactory.getLogger(SearchResponseDecoder.class);

    private final ObjectMapper objectMapper;

    public SearchResponseDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Page decode(byte[] body) throws ResponseDecodeException {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new ResponseDecodeException("Error parsing the search response body", e);
        }
        if (root == null || !root.isObject()) {
            throw new ResponseDecodeException("Search response body is not a JSON object");
        }

        JsonNode hits = root.path("hits");
        long total = extractTotal(hits);
        if (total == 0) {
            return Page.empty();
        }

        JsonNode entries = hits.path("hits");
        if (!entries.isArray()) {
            throw new ResponseDecodeException("Missing or malformed hits.hits in search response: " + hits);
        }
        if (entries.isEmpty()) {
            return Page.builder().totalHits(total).build();
        }

        Cursor cursor = extractCursor(entries.get(entries.size() - 1));

        List<User> documents = new ArrayList<>(entries.size());
        int attempted = 0;
        boolean truncated = false;
        for (JsonNode hit : entries) {
            attempted++;
            try {
                documents.add(decodeSource(hit));
            } catch (IOException e) {
                logger.error("Error decoding document {} of {}, returning {} decoded documents. hit: {}",
                        attempted, entries.size(), documents.size(), hit, e);
                truncated = true;
                break;
            }
        }

        return Page.builder()
                .documents(List.copyOf(documents))
                .totalHits(total)
                .cursor(cursor)
                .hitsReturned(entries.size())
                .attempted(attempted)
                .truncated(truncated)
                .build();
    }

    private static long extractTotal(JsonNode hits) throws ResponseDecodeException {
        JsonNode value = hits.path("total").path("value");
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw new ResponseDecodeException("Missing or malformed hits.total.value in search response: " + hits);
        }
        long total = value.longValue();
        if (total < 0) {
            throw new ResponseDecodeException("Negative hits.total.value in search response: " + total);
        }
        return total;
    }

    private static Cursor extractCursor(JsonNode hit) throws ResponseDecodeException {
        JsonNode sort = hit.path("sort");
        if (!sort.isArray() || sort.isEmpty()) {
            throw new ResponseDecodeException("Missing sort values on hit: " + hit);
        }
        JsonNode first = sort.get(0);
        if (first.isIntegralNumber() && first.canConvertToLong()) {
            return Cursor.of(first.longValue());
        }
        if (first.isNumber()) {
            return Cursor.of(first.doubleValue());
        }
        if (first.isTextual()) {
            return Cursor.of(first.textValue());
        }
        if (first.isBoolean()) {
            return Cursor.of(first.booleanValue());
        }
        throw new ResponseDecodeException("Unsupported sort value on hit: " + hit);
    }

    private User decodeSource(JsonNode hit) throws IOException {
        JsonNode source = hit.path("_source");
        if (!source.isObject()) {
            throw new ResponseDecodeException("Hit has no _source object: " + hit.path("_id"));
        }
        byte[] bytes = objectMapper.writeValueAsBytes(source);
        return objectMapper.readValue(bytes, User.class);
    }
}
