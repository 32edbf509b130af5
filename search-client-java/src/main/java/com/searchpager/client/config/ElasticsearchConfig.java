package com.searchpager.client.config;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Elasticsearch cluster connection configuration.
 */
@Data
@NoArgsConstructor
public class ElasticsearchConfig {

    private List<String> hosts = new ArrayList<>(List.of("http://localhost:9200"));
    private String defaultIndex = "users";
    private String username;
    private String password;
    private int connectTimeoutMs = 5000;
    private int socketTimeoutMs = 30000;

    /** Server-side search timeout, also the base of the client-side deadline. */
    private long maxSearchQueryTimeoutMs = 30000;

    /** Extra time granted to a search on top of {@code maxSearchQueryTimeoutMs} before it is cancelled. */
    private long deadlineGraceMs = 1000;

    /** Request exact hit counts; pagination termination relies on them. */
    private boolean trackTotalHits = true;

    /** Plain-HTTP development clusters (e.g. LocalStack) need compression off. */
    private boolean compressionEnabled = false;

    /** Optional JSON file sent as the create-index body. */
    private String mappingSchemaPath;

    public Duration getMaxSearchQueryTimeout() {
        return Duration.ofMillis(maxSearchQueryTimeoutMs);
    }

    public Duration getSearchDeadline() {
        return Duration.ofMillis(maxSearchQueryTimeoutMs + deadlineGraceMs);
    }
}
