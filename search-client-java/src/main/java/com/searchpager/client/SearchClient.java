package com.searchpager.client;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.IndexResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkOperation;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.indices.CreateIndexResponse;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.searchpager.client.config.ElasticsearchConfig;
import com.searchpager.client.decode.SearchResponseDecoder;
import com.searchpager.client.exception.EngineFailureException;
import com.searchpager.client.exception.SearchClientException;
import com.searchpager.client.model.BulkStoreResult;
import com.searchpager.client.model.Cursor;
import com.searchpager.client.model.Page;
import com.searchpager.client.model.User;
import com.searchpager.client.pagination.PageLoader;
import com.searchpager.client.query.SearchQuery;
import com.searchpager.client.query.SearchQueryBuilder;
import com.searchpager.client.transport.RawSearchResponse;
import com.searchpager.client.transport.RestClientSearchTransport;
import com.searchpager.client.transport.SearchTransport;
import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.elasticsearch.client.RestClient;
import org.elasticsearch.client.RestClientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Elasticsearch access layer for user documents.
 *
 * <p>One instance is created by the composition root and passed to every component that
 * needs the engine; it is safe for concurrent use. Search goes through the low-level REST
 * client so the raw envelope can be decoded by {@link SearchResponseDecoder}; index
 * administration and writes use the typed API client.</p>
 */
public class SearchClient implements PageLoader, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SearchClient.class);

    private final RestClient restClient;
    private final ElasticsearchTransport transport;
    private final ElasticsearchClient client;
    private final String defaultIndex;

    private final SearchQueryBuilder queryBuilder;
    private final SearchTransport searchTransport;
    private final SearchResponseDecoder decoder;

    public SearchClient(ElasticsearchConfig config) {
        this(buildRestClient(config), config, createObjectMapper());
    }

    SearchClient(RestClient restClient, ElasticsearchConfig config, ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.defaultIndex = config.getDefaultIndex();

        // Create transport with configured Jackson mapper
        this.transport = new RestClientTransport(restClient, new JacksonJsonpMapper(objectMapper));
        this.client = new ElasticsearchClient(transport);

        this.queryBuilder = new SearchQueryBuilder(objectMapper);
        this.searchTransport = new RestClientSearchTransport(restClient, objectMapper, config);
        this.decoder = new SearchResponseDecoder(objectMapper);

        logger.info("Connected to Elasticsearch at {}, default index {}", config.getHosts(), defaultIndex);
    }

    /**
     * Jackson mapper shared by the typed client and the response decoder. Timestamps are written
     * as RFC 3339 strings and read back without adjusting their offset. Scalars are bound
     * strictly: a quoted or fractional {@code ID} and a non-string {@code Username} are
     * rejected instead of coerced.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE);
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        objectMapper.disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
        objectMapper.coercionConfigFor(LogicalType.Integer)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail);
        objectMapper.coercionConfigFor(LogicalType.Textual)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        return objectMapper;
    }

    private static RestClient buildRestClient(ElasticsearchConfig config) {
        HttpHost[] hosts = config.getHosts().stream()
                .map(HttpHost::create)
                .toArray(HttpHost[]::new);

        RestClientBuilder builder = RestClient.builder(hosts)
                .setCompressionEnabled(config.isCompressionEnabled())
                .setRequestConfigCallback(rcb -> rcb
                        .setConnectTimeout(config.getConnectTimeoutMs())
                        .setSocketTimeout(config.getSocketTimeoutMs()));

        if (config.getUsername() != null && !config.getUsername().isEmpty()) {
            BasicCredentialsProvider credentialsProvider = new BasicCredentialsProvider();
            credentialsProvider.setCredentials(AuthScope.ANY,
                    new UsernamePasswordCredentials(config.getUsername(), config.getPassword()));
            builder.setHttpClientConfigCallback(hcb ->
                    hcb.setDefaultCredentialsProvider(credentialsProvider));
        }

        return builder.build();
    }

    /**
     * Loads one page of users sorted ascending by {@code ID}.
     *
     * @param index  target index, empty for the default one
     * @param from   offset, ignored when {@code cursor} is set
     * @param size   page size
     * @param cursor {@link Cursor#unset()} for skip-and-take, otherwise continue after it
     */
    @Override
    public Page load(String index, int from, int size, Cursor cursor) throws SearchClientException {
        SearchQuery query = queryBuilder.build(from, size, cursor);
        RawSearchResponse response = searchTransport.search(index, query);
        Page page = decoder.decode(response.getBody());
        if (page.isTruncated()) {
            logger.warn("Page from index {} truncated: {} of {} hits decoded, query: {}",
                    response.getIndex(), page.getDecoded(), page.getHitsReturned(), query.getBody());
        }
        return page;
    }

    /**
     * Create the index unless it already exists.
     *
     * @param mappingPath JSON file sent as the create-index body, or {@code null} for the
     *                    built-in user mapping
     * @return {@code true} if the index was created
     */
    public boolean createIndex(String index, String mappingPath) throws IOException {
        String target = resolve(index);
        try {
            boolean exists = client.indices().exists(e -> e.index(target)).value();
            if (exists) {
                logger.info("Index {} already exists", target);
                return false;
            }

            CreateIndexResponse response;
            if (mappingPath != null && !mappingPath.isBlank()) {
                try (InputStream mapping = Files.newInputStream(Path.of(mappingPath))) {
                    response = client.indices().create(c -> c
                            .index(target)
                            .withJson(mapping));
                }
            } else {
                response = client.indices().create(c -> c
                        .index(target)
                        .mappings(m -> m
                                .properties("ID", p -> p.long_(l -> l))
                                .properties("CreatedAt", p -> p.date(d -> d))
                                .properties("Username", p -> p.keyword(k -> k))));
            }

            logger.info("Created index {}: acknowledged={}", target, response.acknowledged());
            return true;
        } catch (ElasticsearchException e) {
            throw engineFailure(target, e);
        }
    }

    /**
     * Index a single user with an engine-generated id, visible to search on return.
     */
    public void store(String index, User user) throws IOException {
        String target = resolve(index);
        try {
            IndexResponse response = client.index(i -> i
                    .index(target)
                    .document(user)
                    .refresh(Refresh.True));

            logger.debug("Stored user {} in {}: result={}", user.getId(), target, response.result());
        } catch (ElasticsearchException e) {
            throw engineFailure(target, e);
        }
    }

    /**
     * Bulk index multiple users
     */
    public BulkStoreResult bulkStore(String index, List<User> users) throws IOException {
        if (users.isEmpty()) {
            return new BulkStoreResult(0, List.of(), 0);
        }
        String target = resolve(index);

        List<BulkOperation> operations = users.stream()
                .map(user -> BulkOperation.of(op -> op
                        .index(idx -> idx
                                .index(target)
                                .document(user))))
                .collect(Collectors.toList());

        BulkResponse response;
        try {
            response = client.bulk(b -> b.operations(operations));
        } catch (ElasticsearchException e) {
            throw engineFailure(target, e);
        }

        List<String> failures = response.items().stream()
                .map(BulkResponseItem::error)
                .filter(Objects::nonNull)
                .map(error -> error.type() + ": " + error.reason())
                .collect(Collectors.toList());

        if (response.errors()) {
            logger.error("Bulk indexing into {} had {} errors", target, failures.size());
            failures.forEach(failure -> logger.error("Error: {}", failure));
        } else {
            logger.info("Bulk indexed {} users in {}ms", users.size(), response.took());
        }
        return new BulkStoreResult(users.size(), failures, response.took());
    }

    /**
     * Store {@code count} users with ids {@code 0..count-1}, one request each.
     * Stops at the first failure.
     */
    public void seed(String index, int count) throws IOException {
        OffsetDateTime createdAt = OffsetDateTime.now();
        for (int i = 0; i < count; i++) {
            store(index, User.builder()
                    .id(i)
                    .createdAt(createdAt)
                    .username("user " + i)
                    .build());
        }
        logger.info("Seeded {} users into {}", count, resolve(index));
    }

    /**
     * Number of documents in the index
     */
    public long count(String index) throws IOException {
        String target = resolve(index);
        try {
            return client.count(c -> c.index(target)).count();
        } catch (ElasticsearchException e) {
            throw engineFailure(target, e);
        }
    }

    public String getDefaultIndex() {
        return defaultIndex;
    }

    private String resolve(String index) {
        return (index == null || index.isEmpty()) ? defaultIndex : index;
    }

    private static EngineFailureException engineFailure(String index, ElasticsearchException e) {
        String type = e.error() != null ? e.error().type() : null;
        String reason = e.error() != null ? e.error().reason() : e.getMessage();
        EngineFailureException failure = new EngineFailureException(index, e.status(), type, reason, Map.of(), null);
        failure.initCause(e);
        return failure;
    }

    @Override
    public void close() throws IOException {
        transport.close();
        restClient.close();
        logger.info("Elasticsearch client closed");
    }
}
