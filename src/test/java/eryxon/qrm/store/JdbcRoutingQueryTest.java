package eryxon.qrm.store;

import eryxon.qrm.error.TransportException;
import eryxon.qrm.model.OperationRow;
import eryxon.qrm.model.OperationStatus;
import org.junit.jupiter.api.*;

import java.util.Comparator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcRoutingQueryTest {

    private static Database db;
    private static JdbcRoutingQuery query;
    private static StoreFixtures fixtures;

    @BeforeAll
    static void setup() {
        // Use in-memory H2 for tests
        db = new Database("jdbc:h2:mem:test-routing;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        query = new JdbcRoutingQuery(db);
        fixtures = new StoreFixtures(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void seed() throws Exception {
        fixtures.clear();
        fixtures.cell("c1", "t1", "Cutting", 1, 5, null, false, true)
                .cell("c2", "t1", "Welding", 2, null, null, false, true)
                .job("j1", "t1", "J-001")
                .job("j2", "t1", "J-002")
                .part("p1", "t1", "j1")
                .part("p2", "t1", "j1")
                .part("p3", "t1", "j2")
                .operation("o1", "t1", "p1", "c1", "completed")
                .operation("o2", "t1", "p1", "c2", "in_progress")
                .operation("o3", "t1", "p2", "c1", "not_started")
                .operation("o4", "t1", "p3", "c2", "on_hold")
                .operation("o5", "t1", "p3", null, "not_started");
    }

    @Test
    void operationsForPartCarryCellAndJob() {
        List<OperationRow> rows = query.operationsForPart("p1").stream()
                .sorted(Comparator.comparing(OperationRow::id))
                .toList();

        assertEquals(2, rows.size());
        OperationRow first = rows.get(0);
        assertEquals("o1", first.id());
        assertEquals("j1", first.jobId());
        assertEquals("c1", first.cellId());
        assertEquals("Cutting", first.cellName());
        assertEquals("#c1", first.cellColor());
        assertEquals(1, first.cellSequence());
        assertEquals(OperationStatus.COMPLETED, first.status());
        assertEquals(2, rows.get(1).cellSequence());
    }

    @Test
    void durationsAreCarriedWhenKnown() throws Exception {
        fixtures.durations("o1", 45, 50);

        List<OperationRow> rows = query.operationsForPart("p1").stream()
                .sorted(Comparator.comparing(OperationRow::id))
                .toList();

        assertEquals(Integer.valueOf(45), rows.get(0).estimatedTime());
        assertEquals(Integer.valueOf(50), rows.get(0).actualTime());
        assertNull(rows.get(1).estimatedTime());
        assertNull(rows.get(1).actualTime());
    }

    @Test
    void operationsForJobSpanAllParts() {
        assertEquals(3, query.operationsForJob("j1").size());
        assertTrue(query.operationsForJob("missing").isEmpty());
    }

    @Test
    void operationWithoutCellHasNullCell() {
        OperationRow unassigned = query.operationsForJob("j2").stream()
                .filter(r -> r.id().equals("o5"))
                .findFirst()
                .orElseThrow();

        assertNull(unassigned.cellId());
        assertNull(unassigned.cellName());
    }

    @Test
    void operationsForSeveralJobs() {
        assertEquals(5, query.operationsForJobs(List.of("j1", "j2")).size());
        assertEquals(2, query.operationsForJobs(List.of("j2", "unknown")).size());
        assertTrue(query.operationsForJobs(List.of()).isEmpty());
    }

    @Test
    void unknownStatusIsATransportError() throws Exception {
        fixtures.operation("o9", "t1", "p2", "c1", "paused");

        assertThrows(TransportException.class, () -> query.operationsForPart("p2"));
    }
}
