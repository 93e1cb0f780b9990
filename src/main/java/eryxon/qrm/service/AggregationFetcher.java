package eryxon.qrm.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import eryxon.qrm.config.QrmConfig;
import eryxon.qrm.error.PartialFanoutException;
import eryxon.qrm.error.QrmException;
import eryxon.qrm.error.TransportException;
import eryxon.qrm.model.CellQrmMetrics;
import eryxon.qrm.model.NextCellCapacity;
import eryxon.qrm.model.RoutingEntry;
import eryxon.qrm.repository.AggregationRpc;
import eryxon.qrm.repository.CellDirectory;
import eryxon.qrm.repository.RoutingQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs the blocking port calls on a fetch pool and turns their untyped results
 * into validated snapshots.
 *
 * Collection fetches are atomic: if any sub-fetch fails the whole future fails
 * with a {@link PartialFanoutException} naming every failing key. Every other
 * failure surfaces as a {@link QrmException}; anything else a port throws is
 * wrapped in a {@link TransportException}.
 */
public class AggregationFetcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AggregationFetcher.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final AggregationRpc rpc;
    private final CellDirectory cellDirectory;
    private final RoutingQuery routingQuery;
    private final ExecutorService pool;
    private final boolean ownsPool;
    private final String unknownCellName;

    public AggregationFetcher(AggregationRpc rpc, CellDirectory cellDirectory, RoutingQuery routingQuery,
            QrmConfig config) {
        this(rpc, cellDirectory, routingQuery, newPool(config.fetchThreads()), true, config.unknownCellName());
    }

    /**
     * Create a fetcher on a caller-managed pool.
     */
    public AggregationFetcher(AggregationRpc rpc, CellDirectory cellDirectory, RoutingQuery routingQuery,
            ExecutorService pool, String unknownCellName) {
        this(rpc, cellDirectory, routingQuery, pool, false, unknownCellName);
    }

    private AggregationFetcher(AggregationRpc rpc, CellDirectory cellDirectory, RoutingQuery routingQuery,
            ExecutorService pool, boolean ownsPool, String unknownCellName) {
        this.rpc = rpc;
        this.cellDirectory = cellDirectory;
        this.routingQuery = routingQuery;
        this.pool = pool;
        this.ownsPool = ownsPool;
        this.unknownCellName = unknownCellName;
    }

    // ---- single entity ----

    public CompletableFuture<CellQrmMetrics> fetchCellMetrics(String cellId, String tenantId) {
        return call("cell metrics " + cellId, () -> convert(
                rpc.computeCellMetrics(cellId, tenantId), CellQrmMetrics.class, CellQrmMetrics::validate));
    }

    public CompletableFuture<NextCellCapacity> fetchNextCellCapacity(String cellId, String tenantId) {
        return call("next cell capacity " + cellId, () -> convert(
                rpc.computeNextCellCapacity(cellId, tenantId), NextCellCapacity.class, NextCellCapacity::validate));
    }

    public CompletableFuture<List<RoutingEntry>> fetchPartRouting(String partId) {
        return call("part routing " + partId,
                () -> RoutingGrouper.groupByCell(routingQuery.operationsForPart(partId), unknownCellName));
    }

    public CompletableFuture<List<RoutingEntry>> fetchJobRouting(String jobId) {
        return call("job routing " + jobId,
                () -> RoutingGrouper.groupByCell(routingQuery.operationsForJob(jobId), unknownCellName));
    }

    // ---- collections ----

    /**
     * Metrics of every active cell of the tenant, keyed by cell ID.
     */
    public CompletableFuture<Map<String, CellQrmMetrics>> fetchAllCellMetrics(String tenantId) {
        return call("active cells of " + tenantId, () -> cellDirectory.activeCellIds(tenantId))
                .thenCompose(cellIds -> fetchAll(cellIds, cellId -> fetchCellMetrics(cellId, tenantId)));
    }

    /**
     * Routing of several jobs from one query, keyed by job ID. Every requested job
     * is present, with an empty routing when it has no operations.
     */
    public CompletableFuture<Map<String, List<RoutingEntry>>> fetchJobsRouting(List<String> jobIds) {
        if (jobIds.isEmpty()) {
            return CompletableFuture.completedFuture(Map.of());
        }
        return call("routing of " + jobIds.size() + " jobs", () -> RoutingGrouper.groupByJob(
                routingQuery.operationsForJobs(jobIds), jobIds, unknownCellName));
    }

    /**
     * Fetch every key concurrently. Completes with all results in key order, or
     * fails with a {@link PartialFanoutException} once every sub-fetch settled and
     * at least one failed.
     */
    public <V> CompletableFuture<Map<String, V>> fetchAll(Collection<String> keys,
            Function<String, CompletableFuture<V>> fetchOne) {
        Map<String, CompletableFuture<V>> futures = new LinkedHashMap<>();
        for (String key : keys) {
            CompletableFuture<V> future;
            try {
                future = fetchOne.apply(key);
            } catch (RuntimeException e) {
                future = CompletableFuture.failedFuture(e);
            }
            futures.put(key, future);
        }
        return CompletableFuture.allOf(futures.values().toArray(new CompletableFuture<?>[0]))
                .handle((ignored, error) -> collect(futures));
    }

    private <V> Map<String, V> collect(Map<String, CompletableFuture<V>> futures) {
        Map<String, V> results = new LinkedHashMap<>();
        Map<String, Throwable> failures = new LinkedHashMap<>();
        futures.forEach((key, future) -> {
            try {
                results.put(key, future.get());
            } catch (ExecutionException e) {
                failures.put(key, unwrap(e));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failures.put(key, e);
            }
        });
        if (!failures.isEmpty()) {
            log.warn("Fan-out: {} of {} sub-fetches failed: {}", failures.size(), futures.size(), failures.keySet());
            throw new PartialFanoutException(failures, results.size());
        }
        return results;
    }

    // ---- plumbing ----

    private <T> CompletableFuture<T> call(String what, Supplier<T> body) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return body.get();
            } catch (QrmException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new TransportException("Failed to fetch " + what + ": " + e.getMessage(), e);
            }
        }, pool);
    }

    static <T> T convert(JsonNode node, Class<T> type, Consumer<T> validator) {
        if (node == null || !node.isObject()) {
            throw new TransportException("Expected a JSON object for " + type.getSimpleName() + ", got "
                    + (node == null ? "nothing" : node.getNodeType()));
        }
        T value;
        try {
            value = MAPPER.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new TransportException("Malformed " + type.getSimpleName() + " payload: " + e.getMessage(), e);
        }
        try {
            validator.accept(value);
        } catch (IllegalArgumentException e) {
            throw new TransportException("Invalid " + type.getSimpleName() + " payload: " + e.getMessage(), e);
        }
        return value;
    }

    /**
     * Strip the {@link CompletionException}/{@link ExecutionException} wrappers a
     * future adds around the real failure.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static ExecutorService newPool(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "qrm-fetch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void close() {
        if (!ownsPool) {
            return;
        }
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                pool.shutdownNow();
                log.warn("Fetch pool forcefully stopped");
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
