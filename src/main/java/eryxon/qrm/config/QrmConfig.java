package eryxon.qrm.config;

import eryxon.qrm.live.ViewKind;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Configuration holder for the live aggregation layer.
 * All settings have sensible defaults.
 */
public final class QrmConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/eryxon;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Fetch settings
    private int fetchThreads = 4;
    private String unknownCellName = "Unknown";

    // Live view settings
    private final Map<ViewKind, Duration> quietWindows = new EnumMap<>(ViewKind.class);
    private Duration stopTimeout = Duration.ofSeconds(5);

    private QrmConfig() {
        for (ViewKind kind : ViewKind.values()) {
            quietWindows.put(kind, kind.defaultQuietWindow());
        }
    }

    public static QrmConfig defaults() {
        return new QrmConfig();
    }

    public static QrmConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    static QrmConfig fromEnv(Map<String, String> env) {
        QrmConfig config = new QrmConfig();

        String dbUrl = env.get("QRM_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String poolSize = env.get("QRM_DB_POOL_SIZE");
        if (poolSize != null && !poolSize.isBlank()) {
            config.databasePoolSize = Integer.parseInt(poolSize.trim());
        }

        String fetchThreads = env.get("QRM_FETCH_THREADS");
        if (fetchThreads != null && !fetchThreads.isBlank()) {
            config.fetchThreads = Integer.parseInt(fetchThreads.trim());
        }

        String unknownCell = env.get("QRM_UNKNOWN_CELL_NAME");
        if (unknownCell != null && !unknownCell.isBlank()) {
            config.unknownCellName = unknownCell;
        }

        // QRM_DEBOUNCE_CELL_METRICS_MS, QRM_DEBOUNCE_JOB_ROUTING_MS, ...
        for (ViewKind kind : ViewKind.values()) {
            String window = env.get("QRM_DEBOUNCE_" + kind.name() + "_MS");
            if (window != null && !window.isBlank()) {
                config.quietWindows.put(kind, Duration.ofMillis(Long.parseLong(window.trim())));
            }
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int fetchThreads() {
        return fetchThreads;
    }

    public String unknownCellName() {
        return unknownCellName;
    }

    public Duration quietWindow(ViewKind kind) {
        return quietWindows.get(kind);
    }

    public Duration stopTimeout() {
        return stopTimeout;
    }

    // Fluent setters for testing/customization
    public QrmConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public QrmConfig withDatabasePoolSize(int poolSize) {
        this.databasePoolSize = poolSize;
        return this;
    }

    public QrmConfig withFetchThreads(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("fetchThreads must be positive");
        }
        this.fetchThreads = threads;
        return this;
    }

    public QrmConfig withUnknownCellName(String name) {
        this.unknownCellName = name;
        return this;
    }

    public QrmConfig withQuietWindow(ViewKind kind, Duration window) {
        if (window.isNegative()) {
            throw new IllegalArgumentException("quiet window must not be negative");
        }
        this.quietWindows.put(kind, window);
        return this;
    }

    /** Same quiet window for every view kind. */
    public QrmConfig withQuietWindow(Duration window) {
        for (ViewKind kind : ViewKind.values()) {
            withQuietWindow(kind, window);
        }
        return this;
    }

    public QrmConfig withStopTimeout(Duration timeout) {
        this.stopTimeout = timeout;
        return this;
    }

    @Override
    public String toString() {
        return "QrmConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", fetchThreads=" + fetchThreads +
                ", quietWindows=" + quietWindows +
                '}';
    }
}
