package eryxon.qrm.store;

import eryxon.qrm.error.TransportException;
import eryxon.qrm.model.Cell;
import eryxon.qrm.repository.CellDirectory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of CellDirectory.
 */
public class JdbcCellDirectory implements CellDirectory {

    private final Database db;

    public JdbcCellDirectory(Database db) {
        this.db = db;
    }

    @Override
    public List<String> activeCellIds(String tenantId) {
        return findActive(tenantId).stream().map(Cell::id).toList();
    }

    /**
     * Active cells of the tenant ordered by sequence.
     */
    public List<Cell> findActive(String tenantId) {
        String sql = "SELECT * FROM cells WHERE tenant_id = ? AND active = TRUE ORDER BY sequence, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, tenantId);
            try (ResultSet rs = ps.executeQuery()) {
                List<Cell> cells = new ArrayList<>();
                while (rs.next()) {
                    cells.add(mapRow(rs));
                }
                return cells;
            }
        } catch (SQLException e) {
            throw new TransportException("Failed to list active cells of tenant " + tenantId, e);
        }
    }

    public Optional<Cell> findById(String cellId) {
        String sql = "SELECT * FROM cells WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, cellId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new TransportException("Failed to find cell " + cellId, e);
        }
    }

    static Cell mapRow(ResultSet rs) throws SQLException {
        return new Cell(
                rs.getString("id"),
                rs.getString("tenant_id"),
                rs.getString("name"),
                rs.getString("color"),
                rs.getInt("sequence"),
                rs.getBoolean("active"),
                getNullableInt(rs, "wip_limit"),
                getNullableInt(rs, "wip_warning_threshold"),
                rs.getBoolean("enforce_wip_limit"),
                rs.getBoolean("show_capacity_warning"));
    }

    static Integer getNullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }
}
