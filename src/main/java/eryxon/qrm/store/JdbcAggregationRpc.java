package eryxon.qrm.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import eryxon.qrm.error.TransportException;
import eryxon.qrm.model.CapacityStatus;
import eryxon.qrm.model.Cell;
import eryxon.qrm.model.CellQrmMetrics;
import eryxon.qrm.model.JobRef;
import eryxon.qrm.model.NextCellCapacity;
import eryxon.qrm.repository.AggregationRpc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Computes QRM aggregates directly over the operations table.
 * <p>
 * WIP of a cell is the number of distinct jobs that still have
 * {@code not_started} or {@code in_progress} operations in it.
 */
public class JdbcAggregationRpc implements AggregationRpc {

    private static final Logger log = LoggerFactory.getLogger(JdbcAggregationRpc.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Jobs listed per cell in the metrics payload */
    static final int JOBS_IN_CELL_LIMIT = 10;

    private static final String WIP_FILTER = """
                FROM operations o
                JOIN parts p ON o.part_id = p.id
                JOIN jobs j ON p.job_id = j.id
                WHERE o.cell_id = ?
                  AND o.tenant_id = ?
                  AND o.status IN ('not_started', 'in_progress')
            """;

    private final Database db;

    public JdbcAggregationRpc(Database db) {
        this.db = db;
    }

    @Override
    public JsonNode computeCellMetrics(String cellId, String tenantId) {
        try (Connection conn = db.getConnection()) {
            Cell cell = findCell(conn, cellId, tenantId)
                    .orElseThrow(() -> new TransportException(
                            "Cell " + cellId + " not found for tenant " + tenantId));

            int wip = countWip(conn, cellId, tenantId);
            CellQrmMetrics metrics = new CellQrmMetrics(
                    cell.id(),
                    cell.name(),
                    wip,
                    cell.wipLimit(),
                    cell.wipWarningThreshold(),
                    cell.enforceWipLimit(),
                    cell.showCapacityWarning(),
                    utilizationPercent(wip, cell.wipLimit()),
                    cell.capacityStatus(wip),
                    jobsInCell(conn, cellId, tenantId));

            log.debug("Cell {} metrics: wip={}, status={}", cellId, wip, metrics.status());
            return MAPPER.valueToTree(metrics);
        } catch (SQLException e) {
            throw new TransportException("Failed to compute metrics of cell " + cellId, e);
        }
    }

    @Override
    public JsonNode computeNextCellCapacity(String cellId, String tenantId) {
        try (Connection conn = db.getConnection()) {
            Optional<Cell> current = findCell(conn, cellId, tenantId);
            Optional<Cell> next = current.isPresent()
                    ? findNextActive(conn, tenantId, current.get().sequence())
                    : Optional.empty();

            NextCellCapacity capacity = next
                    .map(cell -> capacityOf(cell, countWip(conn, cell.id(), tenantId)))
                    .orElseGet(() -> new NextCellCapacity(true, false, null, null, null, null, null,
                            "No next cell in sequence"));

            return MAPPER.valueToTree(capacity);
        } catch (SQLException e) {
            throw new TransportException("Failed to compute next-cell capacity after " + cellId, e);
        }
    }

    static NextCellCapacity capacityOf(Cell next, int wip) {
        CapacityStatus status = next.capacityStatus(wip);
        boolean hasCapacity = true;
        boolean warning = false;
        String message;

        switch (status) {
            case NO_LIMIT -> message = "Next cell has no WIP limit";
            case AT_CAPACITY -> {
                hasCapacity = !next.enforceWipLimit();
                message = String.format("Cell \"%s\" is at capacity (%d/%d)", next.name(), wip, next.wipLimit());
            }
            case WARNING -> {
                warning = true;
                message = String.format("Cell \"%s\" is approaching capacity (%d/%d)", next.name(), wip,
                        next.wipLimit());
            }
            default -> message = String.format("Cell \"%s\" has capacity (%d/%d)", next.name(), wip, next.wipLimit());
        }

        return new NextCellCapacity(hasCapacity, warning, next.id(), next.name(), wip, next.wipLimit(),
                next.enforceWipLimit(), message);
    }

    /** Rounded percentage, null without a positive limit. */
    static Integer utilizationPercent(int wip, Integer wipLimit) {
        if (wipLimit == null || wipLimit <= 0) {
            return null;
        }
        return (int) Math.round(wip * 100.0 / wipLimit);
    }

    private Optional<Cell> findCell(Connection conn, String cellId, String tenantId) throws SQLException {
        String sql = "SELECT * FROM cells WHERE id = ? AND tenant_id = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, cellId);
            ps.setString(2, tenantId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(JdbcCellDirectory.mapRow(rs)) : Optional.empty();
            }
        }
    }

    private Optional<Cell> findNextActive(Connection conn, String tenantId, int afterSequence) throws SQLException {
        String sql = """
                    SELECT * FROM cells
                    WHERE tenant_id = ? AND active = TRUE AND sequence > ?
                    ORDER BY sequence, id
                    LIMIT 1
                """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, tenantId);
            ps.setInt(2, afterSequence);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(JdbcCellDirectory.mapRow(rs)) : Optional.empty();
            }
        }
    }

    private int countWip(Connection conn, String cellId, String tenantId) {
        String sql = "SELECT COUNT(DISTINCT j.id) " + WIP_FILTER;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, cellId);
            ps.setString(2, tenantId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new TransportException("Failed to count WIP of cell " + cellId, e);
        }
    }

    private List<JobRef> jobsInCell(Connection conn, String cellId, String tenantId) throws SQLException {
        String sql = "SELECT DISTINCT j.id, j.job_number " + WIP_FILTER
                + " ORDER BY j.job_number LIMIT " + JOBS_IN_CELL_LIMIT;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, cellId);
            ps.setString(2, tenantId);
            try (ResultSet rs = ps.executeQuery()) {
                List<JobRef> jobs = new ArrayList<>();
                while (rs.next()) {
                    jobs.add(new JobRef(rs.getString("id"), rs.getString("job_number")));
                }
                return jobs;
            }
        }
    }
}
