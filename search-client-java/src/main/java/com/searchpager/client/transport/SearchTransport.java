package com.searchpager.client.transport;

import com.searchpager.client.exception.SearchClientException;
import com.searchpager.client.query.SearchQuery;

/**
 * Executes a built query against an index and hands back the raw response.
 */
public interface SearchTransport {

    /**
     * @param index target index; {@code null} or empty selects the configured default index
     * @return the successful response, never a non-2xx one
     * @throws SearchClientException on transport failure, engine-reported failure, timeout
     *                               or cancellation
     */
    RawSearchResponse search(String index, SearchQuery query) throws SearchClientException;
}
