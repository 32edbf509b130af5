package com.searchpager.client.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Top-level configuration, read from YAML.
 *
 * <p>Values may be overridden from the environment with {@link #applyEnvironment(Function)}:
 * {@code ELASTICSEARCH_HOSTS} (comma separated), {@code ELASTICSEARCH_INDEX},
 * {@code ELASTICSEARCH_USERNAME}, {@code ELASTICSEARCH_PASSWORD} and {@code PAGE_SIZE}.</p>
 */
@Data
public class SearchPagerConfig {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ElasticsearchConfig elasticsearch = new ElasticsearchConfig();
    private PaginationConfig pagination = new PaginationConfig();
    private BootstrapConfig bootstrap = new BootstrapConfig();

    // ── Loading ──────────────────────────────────────────────────────────

    /**
     * Loads configuration from a YAML file on disk.
     */
    public static SearchPagerConfig load(String path) throws IOException {
        return YAML_MAPPER.readValue(new File(path), SearchPagerConfig.class);
    }

    /**
     * Loads configuration from a classpath resource.
     */
    public static SearchPagerConfig loadFromClasspath(String resource) throws IOException {
        try (InputStream is = SearchPagerConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException("Resource not found on classpath: " + resource);
            }
            return YAML_MAPPER.readValue(is, SearchPagerConfig.class);
        }
    }

    // ── Overrides ────────────────────────────────────────────────────────

    /**
     * Overrides values with the variables present in {@code env}.
     *
     * @param env variable lookup, usually {@code System::getenv}
     * @return this configuration
     */
    public SearchPagerConfig applyEnvironment(Function<String, String> env) {
        String hosts = env.apply("ELASTICSEARCH_HOSTS");
        if (hosts != null && !hosts.isBlank()) {
            elasticsearch.setHosts(Arrays.stream(hosts.split(","))
                    .map(String::trim)
                    .filter(h -> !h.isEmpty())
                    .collect(Collectors.toList()));
        }
        String index = env.apply("ELASTICSEARCH_INDEX");
        if (index != null && !index.isBlank()) {
            elasticsearch.setDefaultIndex(index);
        }
        String username = env.apply("ELASTICSEARCH_USERNAME");
        if (username != null) {
            elasticsearch.setUsername(username);
        }
        String password = env.apply("ELASTICSEARCH_PASSWORD");
        if (password != null) {
            elasticsearch.setPassword(password);
        }
        String pageSize = env.apply("PAGE_SIZE");
        if (pageSize != null && !pageSize.isBlank()) {
            pagination.setPageSize(Integer.parseInt(pageSize.trim()));
        }
        return this;
    }
}
