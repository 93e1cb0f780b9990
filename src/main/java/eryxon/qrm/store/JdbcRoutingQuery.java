package eryxon.qrm.store;

import eryxon.qrm.error.TransportException;
import eryxon.qrm.model.OperationRow;
import eryxon.qrm.model.OperationStatus;
import eryxon.qrm.repository.RoutingQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * JDBC implementation of RoutingQuery.
 */
public class JdbcRoutingQuery implements RoutingQuery {

    private static final Logger log = LoggerFactory.getLogger(JdbcRoutingQuery.class);

    private static final String SELECT_ROWS = """
                SELECT o.id, o.tenant_id, o.part_id, o.cell_id, o.sequence, o.status,
                       o.estimated_time, o.actual_time,
                       p.job_id,
                       c.name AS cell_name, c.color AS cell_color, c.sequence AS cell_sequence
                FROM operations o
                JOIN parts p ON o.part_id = p.id
                LEFT JOIN cells c ON o.cell_id = c.id
            """;

    private final Database db;

    public JdbcRoutingQuery(Database db) {
        this.db = db;
    }

    @Override
    public List<OperationRow> operationsForPart(String partId) {
        return query(SELECT_ROWS + " WHERE o.part_id = ?", List.of(partId), "part " + partId);
    }

    @Override
    public List<OperationRow> operationsForJob(String jobId) {
        return query(SELECT_ROWS + " WHERE p.job_id = ?", List.of(jobId), "job " + jobId);
    }

    @Override
    public List<OperationRow> operationsForJobs(Collection<String> jobIds) {
        if (jobIds.isEmpty()) {
            return List.of();
        }
        String placeholders = String.join(", ", Collections.nCopies(jobIds.size(), "?"));
        return query(SELECT_ROWS + " WHERE p.job_id IN (" + placeholders + ")", List.copyOf(jobIds),
                jobIds.size() + " jobs");
    }

    private List<OperationRow> query(String sql, List<String> params, String what) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            for (int i = 0; i < params.size(); i++) {
                ps.setString(i + 1, params.get(i));
            }
            try (ResultSet rs = ps.executeQuery()) {
                List<OperationRow> rows = new ArrayList<>();
                while (rs.next()) {
                    rows.add(mapRow(rs));
                }
                log.debug("Loaded {} operation rows for {}", rows.size(), what);
                return rows;
            }
        } catch (SQLException e) {
            throw new TransportException("Failed to load operations for " + what, e);
        }
    }

    private OperationRow mapRow(ResultSet rs) throws SQLException {
        String status = rs.getString("status");
        OperationStatus parsed;
        try {
            parsed = OperationStatus.fromWire(status);
        } catch (IllegalArgumentException e) {
            throw new TransportException("Operation " + rs.getString("id") + " has unknown status " + status, e);
        }
        return OperationRow.builder()
                .id(rs.getString("id"))
                .tenantId(rs.getString("tenant_id"))
                .jobId(rs.getString("job_id"))
                .partId(rs.getString("part_id"))
                .cellId(rs.getString("cell_id"))
                .cellName(rs.getString("cell_name"))
                .cellColor(rs.getString("cell_color"))
                .cellSequence(rs.getInt("cell_sequence"))
                .sequence(rs.getInt("sequence"))
                .status(parsed)
                .estimatedTime(JdbcCellDirectory.getNullableInt(rs, "estimated_time"))
                .actualTime(JdbcCellDirectory.getNullableInt(rs, "actual_time"))
                .build();
    }
}
