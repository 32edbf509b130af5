package com.searchpager.client;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.ResponseDefinitionBuilder;
import com.searchpager.client.config.ElasticsearchConfig;
import com.searchpager.client.exception.EngineFailureException;
import com.searchpager.client.model.BulkStoreResult;
import com.searchpager.client.model.Cursor;
import com.searchpager.client.model.Page;
import com.searchpager.client.model.User;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.OffsetDateTime;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.absent;
import static com.github.tomakehurst.wiremock.client.WireMock.any;
import static com.github.tomakehurst.wiremock.client.WireMock.anyRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.anyUrl;
import static com.github.tomakehurst.wiremock.client.WireMock.configureFor;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.head;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.put;
import static com.github.tomakehurst.wiremock.client.WireMock.putRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.stubFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.verify;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests {@link SearchClient} against a mock Elasticsearch HTTP API
 */
public class SearchClientTest {

    static final String SHARDS = "\"_shards\":{\"total\":1,\"successful\":1,\"failed\":0}";

    private WireMockServer wireMockServer;
    private SearchClient client;

    @BeforeEach
    public void setUp() {
        wireMockServer = new WireMockServer(options().dynamicPort());
        wireMockServer.start();
        configureFor("localhost", wireMockServer.port());

        client = new SearchClient(config(wireMockServer.port()));
    }

    @AfterEach
    public void tearDown() throws Exception {
        client.close();
        wireMockServer.stop();
    }

    static ElasticsearchConfig config(int port) {
        ElasticsearchConfig config = new ElasticsearchConfig();
        config.setHosts(List.of("http://localhost:" + port));
        config.setDefaultIndex("users");
        return config;
    }

    /**
     * A response the typed client accepts as coming from Elasticsearch
     */
    static ResponseDefinitionBuilder esResponse(int status, String body) {
        ResponseDefinitionBuilder response = aResponse()
                .withStatus(status)
                .withHeader("X-Elastic-Product", "Elasticsearch")
                .withHeader("Content-Type", "application/json");
        return body != null ? response.withBody(body) : response;
    }

    static String indexResponse(String id) {
        return "{\"_index\":\"users\",\"_id\":\"" + id + "\",\"_version\":1,\"result\":\"created\","
                + "\"forced_refresh\":true," + SHARDS + ",\"_seq_no\":0,\"_primary_term\":1}";
    }

    static String searchResponse(long total, long... ids) {
        StringBuilder hits = new StringBuilder();
        for (long id : ids) {
            if (hits.length() > 0) {
                hits.append(',');
            }
            hits.append("{\"_index\":\"users\",\"_id\":\"d").append(id).append("\",\"_score\":null,")
                    .append("\"_source\":{\"ID\":").append(id)
                    .append(",\"CreatedAt\":\"2024-03-01T12:00:00Z\",\"Username\":\"user ").append(id).append("\"},")
                    .append("\"sort\":[").append(id).append("]}");
        }
        return "{\"took\":1,\"timed_out\":false,\"hits\":{\"total\":{\"value\":" + total
                + ",\"relation\":\"eq\"},\"hits\":[" + hits + "]}}";
    }

    /**
     * Test if a page is loaded, decoded and carries the next cursor
     */
    @Test
    public void load() throws Exception {
        stubFor(post(urlPathEqualTo("/users/_search"))
                .willReturn(esResponse(200, searchResponse(12, 5, 6, 7))));

        Page page = client.load("", 5, 3, Cursor.unset());

        assertEquals(12, page.getTotalHits());
        assertEquals(3, page.getDocuments().size());
        assertEquals("user 6", page.getDocuments().get(1).getUsername());
        assertEquals(Cursor.of(7L), page.getCursor());
        verify(postRequestedFor(urlPathEqualTo("/users/_search"))
                .withQueryParam("from", equalTo("5"))
                .withQueryParam("size", equalTo("3")));
    }

    /**
     * Test if a continuation request carries the cursor and no offset
     */
    @Test
    public void loadAfterCursor() throws Exception {
        stubFor(post(urlPathEqualTo("/users/_search"))
                .willReturn(esResponse(200, searchResponse(12, 8, 9))));

        Page page = client.load("users", 100, 3, Cursor.of(7L));

        assertEquals(Cursor.of(9L), page.getCursor());
        verify(postRequestedFor(urlPathEqualTo("/users/_search"))
                .withQueryParam("from", absent())
                .withRequestBody(matchingJsonPath("$.search_after[0]", equalTo("7"))));
    }

    /**
     * Test if a document is indexed with a generated id and an immediate refresh
     */
    @Test
    public void store() throws Exception {
        stubFor(post(urlPathEqualTo("/users/_doc"))
                .willReturn(esResponse(201, indexResponse("abc"))));

        client.store("", new User(3, OffsetDateTime.parse("2024-03-01T12:00:00.5+01:00"), "user 3"));

        verify(postRequestedFor(urlPathEqualTo("/users/_doc"))
                .withQueryParam("refresh", equalTo("true"))
                .withRequestBody(equalToJson("{\"ID\":3,\"CreatedAt\":\"2024-03-01T12:00:00.5+01:00\","
                        + "\"Username\":\"user 3\"}")));
    }

    /**
     * Test if a rejected document surfaces as an engine failure
     */
    @Test
    public void storeRejected() {
        stubFor(post(urlPathEqualTo("/users/_doc"))
                .willReturn(esResponse(400, "{\"error\":{\"type\":\"mapper_parsing_exception\","
                        + "\"reason\":\"failed to parse field [ID]\"},\"status\":400}")));

        EngineFailureException e = assertThrows(EngineFailureException.class,
                () -> client.store("users", new User(1, OffsetDateTime.now(), "u")));

        assertEquals(400, e.getStatus());
        assertEquals("mapper_parsing_exception", e.getErrorType());
        assertEquals("users", e.getIndex());
    }

    /**
     * Test if seeding stores one document per user
     */
    @Test
    public void seed() throws Exception {
        stubFor(post(urlPathEqualTo("/users/_doc"))
                .willReturn(esResponse(201, indexResponse("x"))));

        client.seed("users", 3);

        verify(3, postRequestedFor(urlPathEqualTo("/users/_doc")));
        verify(postRequestedFor(urlPathEqualTo("/users/_doc"))
                .withRequestBody(matchingJsonPath("$.Username", equalTo("user 2"))));
    }

    /**
     * Test if per-item bulk errors are reported
     */
    @Test
    public void bulkStore() throws Exception {
        String body = "{\"took\":7,\"errors\":true,\"items\":["
                + "{\"index\":{\"_index\":\"users\",\"_id\":\"a\",\"_version\":1,\"result\":\"created\","
                + SHARDS + ",\"_seq_no\":0,\"_primary_term\":1,\"status\":201}},"
                + "{\"index\":{\"_index\":\"users\",\"status\":400,\"error\":{\"type\":\"mapper_parsing_exception\","
                + "\"reason\":\"failed to parse\"}}}]}";
        stubFor(post(urlPathEqualTo("/_bulk")).willReturn(esResponse(200, body)));

        OffsetDateTime now = OffsetDateTime.parse("2024-03-01T12:00:00Z");
        BulkStoreResult result = client.bulkStore("users",
                List.of(new User(1, now, "user 1"), new User(2, now, "user 2")));

        assertEquals(2, result.getSubmitted());
        assertEquals(1, result.getStored());
        assertTrue(result.hasFailures());
        assertEquals("mapper_parsing_exception: failed to parse", result.getFailures().get(0));
        assertEquals(7, result.getTookMillis());
    }

    @Test
    public void bulkStoreNothing() throws Exception {
        BulkStoreResult result = client.bulkStore("users", List.of());

        assertEquals(0, result.getSubmitted());
        verify(0, anyRequestedFor(anyUrl()));
    }

    /**
     * Test if a missing index is created with the built-in mapping
     */
    @Test
    public void createIndex() throws Exception {
        stubFor(head(urlPathEqualTo("/users")).willReturn(esResponse(404, null)));
        stubFor(put(urlPathEqualTo("/users")).willReturn(esResponse(200,
                "{\"acknowledged\":true,\"shards_acknowledged\":true,\"index\":\"users\"}")));

        assertTrue(client.createIndex("users", null));

        verify(putRequestedFor(urlPathEqualTo("/users"))
                .withRequestBody(matchingJsonPath("$.mappings.properties.ID.type", equalTo("long")))
                .withRequestBody(matchingJsonPath("$.mappings.properties.CreatedAt.type", equalTo("date")))
                .withRequestBody(matchingJsonPath("$.mappings.properties.Username.type", equalTo("keyword"))));
    }

    /**
     * Test if the mapping file is sent as the create-index body
     */
    @Test
    public void createIndexFromMappingFile() throws Exception {
        Path mapping = Paths.get(getClass().getClassLoader().getResource("users-mapping.json").toURI());
        stubFor(head(urlPathEqualTo("/people")).willReturn(esResponse(404, null)));
        stubFor(put(urlPathEqualTo("/people")).willReturn(esResponse(200,
                "{\"acknowledged\":true,\"shards_acknowledged\":true,\"index\":\"people\"}")));

        assertTrue(client.createIndex("people", mapping.toString()));

        verify(putRequestedFor(urlPathEqualTo("/people"))
                .withRequestBody(matchingJsonPath("$.mappings.properties.Username.type", equalTo("keyword"))));
    }

    @Test
    public void createIndexMissingMappingFile() {
        stubFor(head(urlPathEqualTo("/users")).willReturn(esResponse(404, null)));

        assertThrows(NoSuchFileException.class, () -> client.createIndex("users", "does/not/exist.json"));
    }

    /**
     * Test if an existing index is left alone
     */
    @Test
    public void createIndexExists() throws Exception {
        stubFor(head(urlPathEqualTo("/users")).willReturn(esResponse(200, null)));

        assertFalse(client.createIndex("users", null));

        verify(0, putRequestedFor(urlPathEqualTo("/users")));
    }

    @Test
    public void count() throws Exception {
        stubFor(any(urlPathEqualTo("/users/_count")).willReturn(esResponse(200,
                "{\"count\":42," + SHARDS + "}")));

        assertEquals(42, client.count(""));
    }
}
