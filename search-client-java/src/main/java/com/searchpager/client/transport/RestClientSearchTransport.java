package com.searchpager.client.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.searchpager.client.config.ElasticsearchConfig;
import com.searchpager.client.exception.EngineFailureException;
import com.searchpager.client.exception.ResponseDecodeException;
import com.searchpager.client.exception.SearchCancelledException;
import com.searchpager.client.exception.SearchClientException;
import com.searchpager.client.exception.SearchTimeoutException;
import com.searchpager.client.exception.SearchTransportException;
import com.searchpager.client.query.SearchQuery;
import org.apache.http.HttpEntity;
import org.apache.http.util.EntityUtils;
import org.elasticsearch.client.Cancellable;
import org.elasticsearch.client.Request;
import org.elasticsearch.client.Response;
import org.elasticsearch.client.ResponseException;
import org.elasticsearch.client.ResponseListener;
import org.elasticsearch.client.RestClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link SearchTransport} on top of the low-level Elasticsearch {@link RestClient}.
 *
 * <p>Offset mode sends {@code from} and {@code size}; cursor mode sends only {@code size}
 * and relies on {@code search_after} in the body. Both ask for exact hit counts.</p>
 *
 * <p>Requests are issued asynchronously and awaited with a deadline so that both a timeout
 * and an interrupt of the calling thread cancel the in-flight HTTP exchange.</p>
 */
public class RestClientSearchTransport implements SearchTransport {

    private static final Logger logger = LoggerFactory.getLogger(RestClientSearchTransport.class);

    private static final TypeReference<Map<String, Object>> ERROR_BODY = new TypeReference<>() {
    };

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String defaultIndex;
    private final Duration queryTimeout;
    private final Duration deadline;
    private final boolean trackTotalHits;

    public RestClientSearchTransport(RestClient restClient, ObjectMapper objectMapper, ElasticsearchConfig config) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.defaultIndex = config.getDefaultIndex();
        this.queryTimeout = config.getMaxSearchQueryTimeout();
        this.deadline = config.getSearchDeadline();
        this.trackTotalHits = config.isTrackTotalHits();
    }

    @Override
    public RawSearchResponse search(String index, SearchQuery query) throws SearchClientException {
        String target = (index == null || index.isEmpty()) ? defaultIndex : index;
        String body = encode(query);

        Request request = new Request("POST", "/" + target + "/_search");
        if (!query.isCursorMode()) {
            request.addParameter("from", String.valueOf(query.getFrom()));
        }
        request.addParameter("size", String.valueOf(query.getSize()));
        request.addParameter("track_total_hits", String.valueOf(trackTotalHits));
        request.addParameter("timeout", queryTimeout.toMillis() + "ms");
        request.setJsonEntity(body);

        Response response = execute(target, request, body);
        int status = response.getStatusLine().getStatusCode();
        try {
            byte[] bytes = readEntity(response.getEntity());
            logger.debug("Search on index {} returned status {} ({} bytes)", target, status, bytes.length);
            return new RawSearchResponse(target, status, bytes);
        } catch (IOException e) {
            throw new SearchTransportException(target, "Error reading search response from index [" + target + "]", e);
        }
    }

    private Response execute(String index, Request request, String body) throws SearchClientException {
        CompletableFuture<Response> future = new CompletableFuture<>();
        Cancellable cancellable = restClient.performRequestAsync(request, new ResponseListener() {
            @Override
            public void onSuccess(Response response) {
                future.complete(response);
            }

            @Override
            public void onFailure(Exception exception) {
                future.completeExceptionally(exception);
            }
        });

        try {
            return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            cancellable.cancel();
            logger.warn("Search on index {} exceeded deadline of {}ms, request cancelled", index, deadline.toMillis());
            throw new SearchTimeoutException(index, deadline);
        } catch (InterruptedException e) {
            cancellable.cancel();
            Thread.currentThread().interrupt();
            throw new SearchCancelledException("Search on index [" + index + "] was interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ResponseException) {
                throw engineFailure(index, ((ResponseException) cause).getResponse(), body);
            }
            throw new SearchTransportException(index, "Search request to index [" + index + "] failed: "
                    + cause.getMessage(), cause);
        }
    }

    /**
     * Turns a non-success response into an {@link EngineFailureException}, or into a
     * {@link ResponseDecodeException} when the error body itself is unreadable.
     */
    SearchClientException engineFailure(String index, Response response, String query) {
        int status = response.getStatusLine().getStatusCode();
        logger.error("Search on index {} failed with status {}, query: {}", index, status, query);

        byte[] bytes;
        try {
            bytes = readEntity(response.getEntity());
        } catch (IOException e) {
            return new ResponseDecodeException("Error reading the failure response body (status " + status + ")", e);
        }
        if (bytes.length == 0) {
            return new EngineFailureException(index, status, null, null, Map.of(), query);
        }

        Map<String, Object> errorBody;
        try {
            errorBody = objectMapper.readValue(bytes, ERROR_BODY);
        } catch (IOException e) {
            return new ResponseDecodeException("Error parsing the failure response body (status " + status + ")", e);
        }
        if (errorBody == null) {
            return new ResponseDecodeException("Failure response body (status " + status + ") is not a JSON object");
        }

        String errorType = null;
        String reason = null;
        Object error = errorBody.get("error");
        if (error instanceof Map) {
            Map<?, ?> errorMap = (Map<?, ?>) error;
            errorType = errorMap.get("type") != null ? errorMap.get("type").toString() : null;
            reason = errorMap.get("reason") != null ? errorMap.get("reason").toString() : null;
        } else if (error != null) {
            reason = error.toString();
        }
        return new EngineFailureException(index, status, errorType, reason, errorBody, query);
    }

    private String encode(SearchQuery query) throws SearchClientException {
        try {
            return objectMapper.writeValueAsString(query.getBody());
        } catch (JsonProcessingException e) {
            throw new SearchClientException("Error encoding query: " + query, e);
        }
    }

    private static byte[] readEntity(HttpEntity entity) throws IOException {
        return entity != null ? EntityUtils.toByteArray(entity) : new byte[0];
    }
}
