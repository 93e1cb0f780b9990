package eryxon.qrm.config;

import eryxon.qrm.event.ChangeEventSource;
import eryxon.qrm.event.LocalChangeFeed;
import eryxon.qrm.live.LifecycleManager;
import eryxon.qrm.live.LiveLoop;
import eryxon.qrm.live.LiveViews;
import eryxon.qrm.service.AggregationFetcher;
import eryxon.qrm.store.Database;
import eryxon.qrm.store.JdbcAggregationRpc;
import eryxon.qrm.store.JdbcCellDirectory;
import eryxon.qrm.store.JdbcRoutingQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires the live layer over the database.
 *
 * Usage:
 *
 * <pre>
 * try (Dependencies deps = Dependencies.create(QrmConfig.fromEnv())) {
 *     InterestHandle&lt;CellQrmMetrics&gt; handle = deps.lifecycleManager()
 *             .startInterest(deps.liveViews().cellMetrics(cellId, tenantId));
 *     // ... read handle ...
 *     handle.stop();
 * }
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final QrmConfig config;
    private final Database database;
    private final JdbcRoutingQuery routingQuery;
    private final JdbcCellDirectory cellDirectory;
    private final JdbcAggregationRpc aggregationRpc;
    private final AggregationFetcher fetcher;
    private final ChangeEventSource eventSource;
    private final LiveLoop loop;
    private final LifecycleManager lifecycleManager;
    private final LiveViews liveViews;

    private Dependencies(QrmConfig config, ChangeEventSource eventSource) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Adapters
        this.routingQuery = new JdbcRoutingQuery(database);
        this.cellDirectory = new JdbcCellDirectory(database);
        this.aggregationRpc = new JdbcAggregationRpc(database);

        // Live layer
        this.fetcher = new AggregationFetcher(aggregationRpc, cellDirectory, routingQuery, config);
        this.eventSource = eventSource;
        this.loop = new LiveLoop(config.stopTimeout());
        this.lifecycleManager = new LifecycleManager(eventSource, loop, config);
        this.liveViews = new LiveViews(fetcher);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config and event source.
     */
    public static Dependencies create(QrmConfig config, ChangeEventSource eventSource) {
        return new Dependencies(config, eventSource);
    }

    /**
     * Create dependencies fed by an in-process change feed.
     */
    public static Dependencies create(QrmConfig config) {
        return create(config, new LocalChangeFeed());
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(QrmConfig.fromEnv());
    }

    // Getters
    public QrmConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public JdbcRoutingQuery routingQuery() {
        return routingQuery;
    }

    public JdbcCellDirectory cellDirectory() {
        return cellDirectory;
    }

    public JdbcAggregationRpc aggregationRpc() {
        return aggregationRpc;
    }

    public AggregationFetcher fetcher() {
        return fetcher;
    }

    public ChangeEventSource eventSource() {
        return eventSource;
    }

    public LiveLoop loop() {
        return loop;
    }

    public LifecycleManager lifecycleManager() {
        return lifecycleManager;
    }

    public LiveViews liveViews() {
        return liveViews;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop interests before the loop they run on
        try {
            lifecycleManager.close();
        } catch (Exception e) {
            log.warn("Error closing lifecycle manager: {}", e.getMessage());
        }
        loop.close();
        fetcher.close();

        // Close database
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
