package com.searchpager.client.pagination;

import com.searchpager.client.exception.SearchClientException;
import com.searchpager.client.model.Cursor;
import com.searchpager.client.model.Page;

/**
 * Fetches one page of documents.
 */
@FunctionalInterface
public interface PageLoader {

    /**
     * @param index  target index, empty for the default one
     * @param from   offset, ignored when {@code cursor} is set
     * @param size   page size
     * @param cursor continuation token, or {@link Cursor#unset()}
     */
    Page load(String index, int from, int size, Cursor cursor) throws SearchClientException;
}
