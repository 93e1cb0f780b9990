package eryxon.qrm.service;

import eryxon.qrm.model.OperationRow;
import eryxon.qrm.model.RoutingEntry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns operation rows into per-cell routing entries.
 *
 * Pure and single-pass: rows are accumulated by cell ID, then sorted by cell
 * sequence (cell ID breaks ties), so the result does not depend on row order.
 * Rows without a cell cannot be routed and are skipped.
 */
public final class RoutingGrouper {

    static final Comparator<RoutingEntry> BY_SEQUENCE = Comparator
            .comparingInt(RoutingEntry::sequence)
            .thenComparing(RoutingEntry::cellId);

    private RoutingGrouper() {
    }

    /**
     * Group rows by cell.
     *
     * @param rows            operation rows, any order
     * @param unknownCellName name used when a row carries no cell name
     * @return entries ordered by cell sequence; empty for empty input
     */
    public static List<RoutingEntry> groupByCell(Collection<OperationRow> rows, String unknownCellName) {
        Map<String, Accumulator> byCell = new HashMap<>();
        for (OperationRow row : rows) {
            accumulate(byCell, row, unknownCellName);
        }
        return toSortedEntries(byCell);
    }

    /**
     * Group rows by job, then by cell.
     *
     * @param rows            operation rows carrying their job ID
     * @param jobIds          jobs to report; each gets an entry, possibly empty
     * @param unknownCellName name used when a row carries no cell name
     * @return routing per requested job, in request order
     */
    public static Map<String, List<RoutingEntry>> groupByJob(Collection<OperationRow> rows,
            Collection<String> jobIds,
            String unknownCellName) {
        Map<String, Map<String, Accumulator>> byJob = new LinkedHashMap<>();
        for (String jobId : jobIds) {
            byJob.put(jobId, new HashMap<>());
        }
        for (OperationRow row : rows) {
            Map<String, Accumulator> byCell = byJob.get(row.jobId());
            if (byCell != null) {
                accumulate(byCell, row, unknownCellName);
            }
        }
        Map<String, List<RoutingEntry>> result = new LinkedHashMap<>();
        byJob.forEach((jobId, byCell) -> result.put(jobId, toSortedEntries(byCell)));
        return result;
    }

    private static void accumulate(Map<String, Accumulator> byCell, OperationRow row, String unknownCellName) {
        if (row.cellId() == null) {
            return;
        }
        Accumulator acc = byCell.computeIfAbsent(row.cellId(), id -> new Accumulator(
                id,
                row.cellName() != null ? row.cellName() : unknownCellName,
                row.cellColor(),
                row.cellSequence()));
        acc.operationCount++;
        if (row.isCompleted()) {
            acc.completedOperations++;
        }
    }

    private static List<RoutingEntry> toSortedEntries(Map<String, Accumulator> byCell) {
        List<RoutingEntry> entries = new ArrayList<>(byCell.size());
        for (Accumulator acc : byCell.values()) {
            entries.add(acc.toEntry());
        }
        entries.sort(BY_SEQUENCE);
        return List.copyOf(entries);
    }

    private static final class Accumulator {
        private final String cellId;
        private final String cellName;
        private final String cellColor;
        private final int sequence;
        private int operationCount;
        private int completedOperations;

        Accumulator(String cellId, String cellName, String cellColor, int sequence) {
            this.cellId = cellId;
            this.cellName = cellName;
            this.cellColor = cellColor;
            this.sequence = sequence;
        }

        RoutingEntry toEntry() {
            return new RoutingEntry(cellId, cellName, cellColor, sequence, operationCount, completedOperations);
        }
    }
}
