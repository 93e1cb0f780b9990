package eryxon.qrm.service;

import eryxon.qrm.model.OperationRow;
import eryxon.qrm.model.OperationStatus;
import eryxon.qrm.model.RoutingEntry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RoutingGrouperTest {

    private static OperationRow op(String id, String jobId, String cellId, int cellSequence, OperationStatus status) {
        return OperationRow.builder()
                .id(id)
                .tenantId("t1")
                .jobId(jobId)
                .partId("p-" + jobId)
                .cellId(cellId)
                .cellName(cellId == null ? null : "Cell " + cellId)
                .cellSequence(cellSequence)
                .status(status)
                .build();
    }

    @Test
    void groupsAndOrdersBySequence() {
        List<OperationRow> rows = List.of(
                op("op-1", "j1", "A", 1, OperationStatus.COMPLETED),
                op("op-2", "j1", "B", 2, OperationStatus.IN_PROGRESS),
                op("op-3", "j1", "A", 1, OperationStatus.COMPLETED));

        List<RoutingEntry> routing = RoutingGrouper.groupByCell(rows, "Unknown");

        assertEquals(List.of(
                new RoutingEntry("A", "Cell A", null, 1, 2, 2),
                new RoutingEntry("B", "Cell B", null, 2, 1, 0)), routing);
    }

    @Test
    void resultDoesNotDependOnRowOrder() {
        List<OperationRow> rows = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            rows.add(op("op-" + i, "j1", "C" + (i % 4), 4 - i % 4,
                    i % 3 == 0 ? OperationStatus.COMPLETED : OperationStatus.NOT_STARTED));
        }
        List<RoutingEntry> expected = RoutingGrouper.groupByCell(rows, "Unknown");

        List<OperationRow> shuffled = new ArrayList<>(rows);
        Collections.reverse(shuffled);
        assertEquals(expected, RoutingGrouper.groupByCell(shuffled, "Unknown"));

        Collections.shuffle(shuffled, new java.util.Random(42));
        assertEquals(expected, RoutingGrouper.groupByCell(shuffled, "Unknown"));

        // Sorted ascending by sequence
        for (int i = 1; i < expected.size(); i++) {
            assertTrue(expected.get(i - 1).sequence() <= expected.get(i).sequence());
        }
    }

    @Test
    void equalSequencesBreakTiesByCellId() {
        List<RoutingEntry> routing = RoutingGrouper.groupByCell(List.of(
                op("op-1", "j1", "Z", 1, OperationStatus.NOT_STARTED),
                op("op-2", "j1", "M", 1, OperationStatus.NOT_STARTED)), "Unknown");

        assertEquals("M", routing.get(0).cellId());
        assertEquals("Z", routing.get(1).cellId());
    }

    @Test
    void sameInputSameOutput() {
        List<OperationRow> rows = List.of(
                op("op-1", "j1", "A", 1, OperationStatus.COMPLETED),
                op("op-2", "j1", "B", 2, OperationStatus.ON_HOLD));

        assertEquals(RoutingGrouper.groupByCell(rows, "Unknown"), RoutingGrouper.groupByCell(rows, "Unknown"));
    }

    @Test
    void rowsWithoutCellAreSkipped() {
        List<RoutingEntry> routing = RoutingGrouper.groupByCell(List.of(
                op("op-1", "j1", null, 0, OperationStatus.NOT_STARTED),
                op("op-2", "j1", "A", 1, OperationStatus.NOT_STARTED)), "Unknown");

        assertEquals(1, routing.size());
        assertEquals("A", routing.get(0).cellId());
    }

    @Test
    void emptyInputGivesEmptyRouting() {
        assertTrue(RoutingGrouper.groupByCell(List.of(), "Unknown").isEmpty());
    }

    @Test
    void missingCellNameUsesPlaceholder() {
        OperationRow row = op("op-1", "j1", "A", 1, OperationStatus.NOT_STARTED).toBuilder()
                .cellName(null)
                .build();

        List<RoutingEntry> routing = RoutingGrouper.groupByCell(List.of(row), "Unknown");

        assertEquals("Unknown", routing.get(0).cellName());
    }

    @Test
    void groupByJobReportsEveryRequestedJob() {
        List<OperationRow> rows = List.of(
                op("op-1", "j1", "A", 1, OperationStatus.COMPLETED),
                op("op-2", "j1", "B", 2, OperationStatus.IN_PROGRESS),
                op("op-3", "j2", "B", 2, OperationStatus.COMPLETED),
                op("op-4", "j9", "A", 1, OperationStatus.COMPLETED));

        Map<String, List<RoutingEntry>> byJob = RoutingGrouper.groupByJob(rows, List.of("j2", "j1", "j3"), "Unknown");

        assertEquals(List.of("j2", "j1", "j3"), new ArrayList<>(byJob.keySet()));
        assertEquals(2, byJob.get("j1").size());
        assertEquals(List.of(new RoutingEntry("B", "Cell B", null, 2, 1, 1)), byJob.get("j2"));
        assertTrue(byJob.get("j3").isEmpty());
        assertFalse(byJob.containsKey("j9"));
    }
}
