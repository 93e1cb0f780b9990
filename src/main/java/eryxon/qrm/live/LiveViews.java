package eryxon.qrm.live;

import eryxon.qrm.event.EntityType;
import eryxon.qrm.event.NotificationFilter;
import eryxon.qrm.model.CellQrmMetrics;
import eryxon.qrm.model.NextCellCapacity;
import eryxon.qrm.model.RoutingEntry;
import eryxon.qrm.service.AggregationFetcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The live views of the dashboard.
 *
 * Every view subscribes tenant-wide (the event source filters on one column
 * only) and narrows down client-side where the notification can tell. A
 * notification missing the column a filter looks at is kept: an extra
 * recompute is cheaper than a missed update.
 */
public final class LiveViews {

    private final AggregationFetcher fetcher;

    public LiveViews(AggregationFetcher fetcher) {
        this.fetcher = fetcher;
    }

    /** Metrics of one cell: operations in that cell, and the cell row itself. */
    public LiveView<CellQrmMetrics> cellMetrics(String cellId, String tenantId) {
        return new DefinedView<>(
                SubscriptionKey.of(ViewKind.CELL_METRICS, tenantId, cellId),
                EnumSet.of(EntityType.OPERATIONS, EntityType.CELLS),
                NotificationFilter.column(EntityType.OPERATIONS, "cell_id", cellId)
                        .or(NotificationFilter.column(EntityType.CELLS, "id", cellId)),
                () -> fetcher.fetchCellMetrics(cellId, tenantId),
                CellQrmMetrics.class::cast);
    }

    /** Metrics of every active cell, keyed by cell ID. */
    public LiveView<Map<String, CellQrmMetrics>> allCellMetrics(String tenantId) {
        return new DefinedView<>(
                SubscriptionKey.of(ViewKind.ALL_CELL_METRICS, tenantId),
                EnumSet.of(EntityType.OPERATIONS, EntityType.CELLS),
                NotificationFilter.acceptAll(),
                () -> fetcher.fetchAllCellMetrics(tenantId),
                snapshot -> mapOf(snapshot, CellQrmMetrics.class::cast));
    }

    /**
     * Capacity of the cell after {@code cellId}. Any operation can move WIP into
     * the next cell and any cell change can change which cell is next.
     */
    public LiveView<NextCellCapacity> nextCellCapacity(String cellId, String tenantId) {
        return new DefinedView<>(
                SubscriptionKey.of(ViewKind.NEXT_CELL_CAPACITY, tenantId, cellId),
                EnumSet.of(EntityType.OPERATIONS, EntityType.CELLS),
                NotificationFilter.acceptAll(),
                () -> fetcher.fetchNextCellCapacity(cellId, tenantId),
                NextCellCapacity.class::cast);
    }

    /** Routing of one part: its operations, plus cell renames and re-sequencing. */
    public LiveView<List<RoutingEntry>> partRouting(String partId, String tenantId) {
        return new DefinedView<>(
                SubscriptionKey.of(ViewKind.PART_ROUTING, tenantId, partId),
                EnumSet.of(EntityType.OPERATIONS, EntityType.CELLS),
                NotificationFilter.column(EntityType.OPERATIONS, "part_id", partId)
                        .or(NotificationFilter.entity(EntityType.CELLS)),
                () -> fetcher.fetchPartRouting(partId),
                LiveViews::routingOf);
    }

    /**
     * Routing of one job. Operations reference parts, not jobs, so every
     * operation of the tenant is kept; part changes are narrowed by job.
     */
    public LiveView<List<RoutingEntry>> jobRouting(String jobId, String tenantId) {
        return new DefinedView<>(
                SubscriptionKey.of(ViewKind.JOB_ROUTING, tenantId, jobId),
                EnumSet.of(EntityType.OPERATIONS, EntityType.PARTS, EntityType.CELLS),
                NotificationFilter.entity(EntityType.OPERATIONS)
                        .or(NotificationFilter.column(EntityType.PARTS, "job_id", jobId))
                        .or(NotificationFilter.entity(EntityType.CELLS)),
                () -> fetcher.fetchJobRouting(jobId),
                LiveViews::routingOf);
    }

    /**
     * Routing of a set of jobs, keyed by job ID. Duplicates and order of
     * {@code jobIds} do not matter: equal sets give equal keys.
     */
    public LiveView<Map<String, List<RoutingEntry>>> jobsRouting(List<String> jobIds, String tenantId) {
        List<String> ids = List.copyOf(new TreeSet<>(jobIds));
        Set<String> idSet = Set.copyOf(ids);
        return new DefinedView<>(
                new SubscriptionKey(ViewKind.JOBS_ROUTING, tenantId, ids),
                EnumSet.of(EntityType.OPERATIONS, EntityType.PARTS, EntityType.CELLS),
                NotificationFilter.entity(EntityType.OPERATIONS)
                        .or(n -> n.entityType() == EntityType.PARTS
                                && (n.column("job_id") == null || idSet.contains(n.column("job_id"))))
                        .or(NotificationFilter.entity(EntityType.CELLS)),
                () -> fetcher.fetchJobsRouting(ids),
                snapshot -> mapOf(snapshot, LiveViews::routingOf));
    }

    private static List<RoutingEntry> routingOf(Object snapshot) {
        List<RoutingEntry> routing = new ArrayList<>();
        for (Object entry : (List<?>) snapshot) {
            routing.add((RoutingEntry) entry);
        }
        return Collections.unmodifiableList(routing);
    }

    private static <T> Map<String, T> mapOf(Object snapshot, Function<Object, T> values) {
        Map<String, T> map = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) snapshot).entrySet()) {
            map.put((String) entry.getKey(), values.apply(entry.getValue()));
        }
        return Collections.unmodifiableMap(map);
    }

    private record DefinedView<V>(
            SubscriptionKey key,
            Set<EntityType> entityTypes,
            NotificationFilter filter,
            Supplier<CompletableFuture<V>> compute,
            Function<Object, V> narrower) implements LiveView<V> {

        @Override
        public CompletableFuture<V> recompute() {
            return compute.get();
        }

        @Override
        public V narrow(Object snapshot) {
            return narrower.apply(snapshot);
        }
    }
}
