package eryxon.qrm.integration;

import eryxon.qrm.cache.LoadState;
import eryxon.qrm.config.Dependencies;
import eryxon.qrm.config.QrmConfig;
import eryxon.qrm.event.ChangeKind;
import eryxon.qrm.event.ChangeNotification;
import eryxon.qrm.event.EntityType;
import eryxon.qrm.event.LocalChangeFeed;
import eryxon.qrm.live.InterestHandle;
import eryxon.qrm.model.CapacityStatus;
import eryxon.qrm.model.CellQrmMetrics;
import eryxon.qrm.model.NextCellCapacity;
import eryxon.qrm.model.RoutingEntry;
import eryxon.qrm.store.StoreFixtures;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Live views over a real database, driven by an in-process change feed:
 * 1. Seed cells, jobs, parts and operations
 * 2. Start interests in metrics, capacity and routing views
 * 3. Change rows and publish the matching notifications
 * 4. Verify the views converge to the new state
 */
class LiveQrmIntegrationTest {

    private LocalChangeFeed feed;
    private Dependencies deps;
    private StoreFixtures fixtures;

    @BeforeEach
    void setUp() throws Exception {
        QrmConfig config = QrmConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-live-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withFetchThreads(2)
                .withQuietWindow(Duration.ofMillis(50));
        feed = new LocalChangeFeed();
        deps = Dependencies.create(config, feed);
        fixtures = new StoreFixtures(deps.database());

        fixtures.cell("c1", "t1", "Cutting", 1, 2, null, true, true)
                .cell("c2", "t1", "Welding", 2, 1, null, true, true)
                .job("j1", "t1", "J-001")
                .job("j2", "t1", "J-002")
                .part("p1", "t1", "j1")
                .part("p2", "t1", "j2")
                .operation("o1", "t1", "p1", "c1", "completed")
                .operation("o2", "t1", "p1", "c2", "not_started")
                .operation("o3", "t1", "p2", "c1", "in_progress");
    }

    @AfterEach
    void tearDown() {
        if (deps != null) {
            deps.close();
        }
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }

    private void operationChanged(String operationId, String partId, String cellId) {
        feed.publish(new ChangeNotification(EntityType.OPERATIONS, operationId, ChangeKind.UPDATE, "t1",
                Map.of("part_id", partId, "cell_id", cellId)));
    }

    @Test
    @DisplayName("Cell metrics follow operation status changes")
    void cellMetricsFollowChanges() throws Exception {
        InterestHandle<CellQrmMetrics> handle = deps.lifecycleManager()
                .startInterest(deps.liveViews().cellMetrics("c1", "t1"));

        await(() -> handle.read().status() == LoadState.READY);
        assertEquals(1, handle.read().value().currentWip());
        assertEquals(CapacityStatus.NORMAL, handle.read().value().status());

        fixtures.operation("o4", "t1", "p1", "c1", "not_started");
        operationChanged("o4", "p1", "c1");

        await(() -> handle.read().value().currentWip() == 2);
        assertEquals(CapacityStatus.AT_CAPACITY, handle.read().value().status());

        handle.stop();
        assertFalse(feed.isOpen("qrm-cell-t1-c1"));
    }

    @Test
    @DisplayName("Next-cell capacity and all-cell metrics")
    void capacityAndAllCells() throws Exception {
        InterestHandle<NextCellCapacity> capacity = deps.lifecycleManager()
                .startInterest(deps.liveViews().nextCellCapacity("c1", "t1"));
        InterestHandle<Map<String, CellQrmMetrics>> all = deps.lifecycleManager()
                .startInterest(deps.liveViews().allCellMetrics("t1"));

        await(() -> capacity.read().hasValue() && all.read().hasValue());
        assertEquals("c2", capacity.read().value().nextCellId());
        assertFalse(capacity.read().value().hasCapacity());
        assertTrue(capacity.read().value().blocksStart());
        assertEquals(List.of("c1", "c2"), List.copyOf(all.read().value().keySet()));

        fixtures.updateStatus("o2", "completed");
        operationChanged("o2", "p1", "c2");

        await(() -> Boolean.TRUE.equals(capacity.read().value().hasCapacity()));
        await(() -> all.read().value().get("c2").currentWip() == 0);
    }

    @Test
    @DisplayName("Part and job routing")
    void routingViews() throws Exception {
        InterestHandle<List<RoutingEntry>> part = deps.lifecycleManager()
                .startInterest(deps.liveViews().partRouting("p1", "t1"));
        InterestHandle<Map<String, List<RoutingEntry>>> jobs = deps.lifecycleManager()
                .startInterest(deps.liveViews().jobsRouting(List.of("j1", "j2"), "t1"));

        await(() -> part.read().hasValue() && jobs.read().hasValue());
        assertEquals(List.of(
                new RoutingEntry("c1", "Cutting", "#c1", 1, 1, 1),
                new RoutingEntry("c2", "Welding", "#c2", 2, 1, 0)), part.read().value());
        assertEquals(1, jobs.read().value().get("j2").size());

        fixtures.updateStatus("o2", "completed");
        operationChanged("o2", "p1", "c2");

        await(() -> part.read().value().stream().allMatch(RoutingEntry::isComplete));
        await(() -> jobs.read().value().get("j1").stream().allMatch(RoutingEntry::isComplete));
    }

    @Test
    @DisplayName("Consumers of one view share a channel")
    void sharedInterest() throws Exception {
        InterestHandle<CellQrmMetrics> a = deps.lifecycleManager()
                .startInterest(deps.liveViews().cellMetrics("c2", "t1"));
        InterestHandle<CellQrmMetrics> b = deps.lifecycleManager()
                .startInterest(deps.liveViews().cellMetrics("c2", "t1"));

        assertEquals(1, feed.openChannels());
        await(() -> b.read().hasValue());
        assertEquals(a.read().value(), b.read().value());

        a.stop();
        assertEquals(1, feed.openChannels());
        b.stop();
        assertEquals(0, feed.openChannels());
    }
}
