package com.searchpager.client.pagination;

import com.searchpager.client.exception.PaginationException;
import com.searchpager.client.exception.SearchCancelledException;
import com.searchpager.client.exception.SearchClientException;
import com.searchpager.client.model.Cursor;
import com.searchpager.client.model.Page;
import com.searchpager.client.model.User;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles a result set from repeated page loads.
 *
 * <p>Two strategies are supported:
 * <ul>
 *   <li><b>offset</b>: skip-and-take with a fixed page size, offsets {@code 0, size, 2*size, ...}
 *       below a record bound;</li>
 *   <li><b>cursor</b>: the first page at offset 0, every later page continues after the
 *       previous page's cursor ({@code search_after}).</li>
 * </ul>
 * Documents are appended in fetch order without dedup or re-sorting.
 *
 * <p>Any failure aborts the whole retrieval with a {@link PaginationException} that carries
 * the documents accumulated so far. A truncated page is not a failure; its documents are
 * kept and the loop continues.</p>
 *
 * <p>The driver holds no mutable state, so one instance can serve concurrent retrievals.</p>
 */
@Slf4j
public class PaginationDriver {

    static final String OFFSET = "offset";
    static final String CURSOR = "cursor";

    private final PageLoader loader;
    private final StopCondition stopCondition;

    public PaginationDriver(PageLoader loader) {
        this(loader, StopCondition.FIXED_ITERATIONS);
    }

    public PaginationDriver(PageLoader loader, StopCondition stopCondition) {
        this.loader = loader;
        this.stopCondition = stopCondition;
    }

    /**
     * Loads pages at offsets {@code 0, pageSize, 2*pageSize, ...} while the offset is below
     * {@code recordBound}. With {@link StopCondition#FIXED_ITERATIONS} this issues exactly
     * {@code ceil(recordBound / pageSize)} requests.
     */
    public List<User> paginateByOffset(String index, int pageSize, int recordBound) throws PaginationException {
        requirePositive("pageSize", pageSize);
        requireNonNegative("recordBound", recordBound);

        List<User> result = new ArrayList<>();
        int iteration = 0;
        // long so that the last step past a bound near Integer.MAX_VALUE cannot wrap
        for (long offset = 0; offset < recordBound; offset += pageSize, iteration++) {
            Page page = fetch(index, OFFSET, iteration, (int) offset, pageSize, Cursor.unset(), result);
            result.addAll(page.getDocuments());

            log.debug("Offset page {} (from={}) returned {} of {} total hits",
                    iteration, offset, page.getDecoded(), page.getTotalHits());
            if (shouldStop(page, offset + page.getHitsReturned())) {
                log.debug("Stopping offset pagination of {} after {} pages ({})", index, iteration + 1, stopCondition);
                break;
            }
        }

        log.info("Fetched {} documents from index {} using offset pagination", result.size(), index);
        return result;
    }

    /**
     * Loads the first page with an unset cursor, then {@code iterations - 1} more pages each
     * continuing after the previous cursor. An empty page keeps the last known cursor so later
     * requests never restart from the beginning.
     */
    public List<User> paginateByCursor(String index, int pageSize, int iterations) throws PaginationException {
        requirePositive("pageSize", pageSize);
        requireNonNegative("iterations", iterations);

        List<User> result = new ArrayList<>();
        Cursor cursor = Cursor.unset();
        long seen = 0;
        for (int iteration = 0; iteration < iterations; iteration++) {
            Page page = fetch(index, CURSOR, iteration, 0, pageSize, cursor, result);
            result.addAll(page.getDocuments());
            seen += page.getHitsReturned();

            if (page.getCursor().isSet()) {
                cursor = page.getCursor();
            }
            log.debug("Cursor page {} returned {} of {} total hits, next cursor {}",
                    iteration, page.getDecoded(), page.getTotalHits(), cursor);
            if (shouldStop(page, seen)) {
                log.debug("Stopping cursor pagination of {} after {} pages ({})", index, iteration + 1, stopCondition);
                break;
            }
        }

        log.info("Fetched {} documents from index {} using cursor pagination", result.size(), index);
        return result;
    }

    private Page fetch(String index, String strategy, int iteration, int from, int size,
                       Cursor cursor, List<User> accumulated) throws PaginationException {
        if (Thread.currentThread().isInterrupted()) {
            throw new PaginationException(index, strategy, iteration, accumulated,
                    new SearchCancelledException("Retrieval interrupted before iteration " + iteration));
        }
        try {
            return loader.load(index, from, size, cursor);
        } catch (SearchClientException e) {
            log.error("{} pagination of index {} failed at iteration {} with {} documents accumulated",
                    strategy, index, iteration, accumulated.size(), e);
            throw new PaginationException(index, strategy, iteration, accumulated, e);
        }
    }

    private boolean shouldStop(Page page, long covered) {
        switch (stopCondition) {
            case EMPTY_PAGE:
                return page.isEmpty();
            case TOTAL_REACHED:
                return page.isEmpty() || covered >= page.getTotalHits();
            case FIXED_ITERATIONS:
            default:
                return false;
        }
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }

    private static void requireNonNegative(String name, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
    }
}
