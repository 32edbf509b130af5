package com.searchpager.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.searchpager.client.config.BootstrapConfig;
import com.searchpager.client.config.PaginationConfig;
import com.searchpager.client.config.SearchPagerConfig;
import com.searchpager.client.exception.PaginationException;
import com.searchpager.client.model.Cursor;
import com.searchpager.client.model.Page;
import com.searchpager.client.model.User;
import com.searchpager.client.pagination.PaginationDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Command-line entry point: optionally prepares the index, then retrieves users with the
 * configured pagination strategy and prints them as JSON.
 */
public class SearchPagerApp {

    private static final Logger logger = LoggerFactory.getLogger(SearchPagerApp.class);

    static final String DEFAULT_CONFIG_RESOURCE = "search-pager.yaml";

    private final SearchPagerConfig config;
    private final SearchClient client;
    private final PaginationDriver driver;
    private final ObjectMapper objectMapper = SearchClient.createObjectMapper();

    public SearchPagerApp(SearchPagerConfig config, SearchClient client) {
        this.config = config;
        this.client = client;
        this.driver = new PaginationDriver(client, config.getPagination().getStopCondition());
    }

    /**
     * Run the bootstrap steps and the configured retrieval, and print its result as JSON.
     */
    public void run(PrintStream out) throws IOException {
        bootstrap();

        PaginationConfig pagination = config.getPagination();
        logger.info("Retrieving users from {} with {} strategy, page size {}",
                config.getElasticsearch().getDefaultIndex(), pagination.getStrategy(), pagination.getPageSize());

        if (pagination.getStrategy() == PaginationConfig.Strategy.SIMPLE) {
            print(loadFirstPage(), objectMapper, out);
        } else {
            print(paginate(), objectMapper, out);
        }
    }

    /**
     * Single page from the start of the index
     */
    public Page loadFirstPage() throws IOException {
        return client.load(config.getElasticsearch().getDefaultIndex(), 0,
                config.getPagination().getPageSize(), Cursor.unset());
    }

    /**
     * Accumulated users of an {@code OFFSET} or {@code CURSOR} retrieval
     */
    public List<User> paginate() throws PaginationException {
        PaginationConfig pagination = config.getPagination();
        String index = config.getElasticsearch().getDefaultIndex();
        if (pagination.getStrategy() == PaginationConfig.Strategy.OFFSET) {
            return driver.paginateByOffset(index, pagination.getPageSize(), pagination.getRecordBound());
        }
        return driver.paginateByCursor(index, pagination.getPageSize(), pagination.getIterations());
    }

    private void bootstrap() throws IOException {
        BootstrapConfig bootstrap = config.getBootstrap();
        String index = config.getElasticsearch().getDefaultIndex();
        if (bootstrap.isCreateIndex()) {
            client.createIndex(index, config.getElasticsearch().getMappingSchemaPath());
        }
        if (bootstrap.getSeedCount() > 0) {
            client.seed(index, bootstrap.getSeedCount());
        }
    }

    static void print(Object result, ObjectMapper objectMapper, PrintStream out) throws IOException {
        out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
    }

    /**
     * Main entry point
     *
     * @param args optional single argument: path to a YAML config file
     */
    public static void main(String[] args) throws Exception {
        SearchPagerConfig config;
        if (args.length > 0) {
            logger.info("Loading configuration from file: {}", args[0]);
            config = SearchPagerConfig.load(args[0]);
        } else {
            logger.info("Loading configuration from classpath: {}", DEFAULT_CONFIG_RESOURCE);
            config = SearchPagerConfig.loadFromClasspath(DEFAULT_CONFIG_RESOURCE);
        }
        config.applyEnvironment(System::getenv);

        logger.info("Starting search-pager with config:");
        logger.info("  Elasticsearch: {}/{}", config.getElasticsearch().getHosts(),
                config.getElasticsearch().getDefaultIndex());
        logger.info("  Pagination: {}", config.getPagination());

        ExecutorService executor = Executors.newSingleThreadExecutor(r -> new Thread(r, "search-pager-retrieval"));
        int exitCode = 0;
        try (SearchClient client = new SearchClient(config.getElasticsearch())) {
            SearchPagerApp app = new SearchPagerApp(config, client);
            Future<?> retrieval = executor.submit(() -> {
                app.run(System.out);
                return null;
            });

            // Interrupt the in-flight retrieval on SIGINT / SIGTERM and let it unwind
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutdown signal received");
                retrieval.cancel(true);
                executor.shutdown();
                try {
                    if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                        logger.warn("Retrieval did not stop within 10s");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));

            try {
                retrieval.get();
            } catch (CancellationException e) {
                logger.warn("Retrieval cancelled");
                exitCode = 130;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof PaginationException) {
                    logger.error("Retrieval failed, {} documents fetched before the failure",
                            ((PaginationException) cause).getPartialResults().size(), cause);
                } else {
                    logger.error("Retrieval failed", cause);
                }
                exitCode = 1;
            }
        } finally {
            executor.shutdown();
        }

        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }
}
