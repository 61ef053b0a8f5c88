package io.meterfleet.registry.repository;

import io.meterfleet.registry.DatabaseManager;
import io.meterfleet.registry.model.MeasurementSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class MeasurementRepository {

    private static final Logger logger = LoggerFactory.getLogger(MeasurementRepository.class);

    private final DatabaseManager dbManager;

    public MeasurementRepository(DatabaseManager dbManager) {
        this.dbManager = dbManager;
    }

    public void insert(MeasurementSample sample) {
        String sql = "INSERT INTO measurements (device_id, timestamp, voltage, current, power, kwh) VALUES (?, ?, ?, ?, ?, ?)";

        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, sample.getDeviceId());
            stmt.setString(2, sample.getTimestamp().toString());
            stmt.setDouble(3, sample.getVoltage());
            stmt.setDouble(4, sample.getCurrent());
            stmt.setDouble(5, sample.getPower());
            stmt.setDouble(6, sample.getKwh());

            int affected = stmt.executeUpdate();
            if (affected == 0) {
                throw new SQLException("Inserting measurement failed, no rows affected.");
            }
            logger.debug("Inserted measurement for device {}", sample.getDeviceId());
        } catch (SQLException e) {
            logger.error("Failed to insert measurement for device {}", sample.getDeviceId(), e);
            throw new RuntimeException("Database operation failed", e);
        }
    }

    // Insertion order is sampling order: one writer per device, one sample per iteration
    public Optional<MeasurementSample> findLatest(String deviceId) {
        String sql = "SELECT * FROM measurements WHERE device_id = ? ORDER BY id DESC LIMIT 1";

        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, deviceId);

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapResultSetToSample(rs));
                }
            }
        } catch (SQLException e) {
            logger.error("Failed to find latest measurement for device {}", deviceId, e);
            throw new RuntimeException("Database operation failed", e);
        }

        return Optional.empty();
    }

    public List<MeasurementSample> findRecent(String deviceId, int limit, int offset) {
        String sql = deviceId != null
            ? "SELECT * FROM measurements WHERE device_id = ? ORDER BY id DESC LIMIT ? OFFSET ?"
            : "SELECT * FROM measurements ORDER BY id DESC LIMIT ? OFFSET ?";

        List<MeasurementSample> samples = new ArrayList<>();
        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            int index = 1;
            if (deviceId != null) {
                stmt.setString(index++, deviceId);
            }
            stmt.setInt(index++, limit);
            stmt.setInt(index, offset);

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    samples.add(mapResultSetToSample(rs));
                }
            }
            logger.debug("Retrieved {} measurements", samples.size());
            return samples;
        } catch (SQLException e) {
            logger.error("Failed to retrieve measurements", e);
            throw new RuntimeException("Database operation failed", e);
        }
    }

    public long count(String deviceId) {
        String sql = deviceId != null
            ? "SELECT COUNT(*) FROM measurements WHERE device_id = ?"
            : "SELECT COUNT(*) FROM measurements";

        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            if (deviceId != null) {
                stmt.setString(1, deviceId);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            logger.error("Failed to count measurements", e);
            throw new RuntimeException("Database operation failed", e);
        }
    }

    public long countDevices() {
        String sql = "SELECT COUNT(DISTINCT device_id) FROM measurements";

        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            logger.error("Failed to count devices with measurements", e);
            throw new RuntimeException("Database operation failed", e);
        }
    }

    public int deleteByDevice(String deviceId) {
        String sql = "DELETE FROM measurements WHERE device_id = ?";

        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, deviceId);
            int deleted = stmt.executeUpdate();
            logger.info("Deleted {} measurements for device {}", deleted, deviceId);
            return deleted;
        } catch (SQLException e) {
            logger.error("Failed to delete measurements for device {}", deviceId, e);
            throw new RuntimeException("Database operation failed", e);
        }
    }

    private MeasurementSample mapResultSetToSample(ResultSet rs) throws SQLException {
        return new MeasurementSample(
            rs.getString("device_id"),
            Instant.parse(rs.getString("timestamp")),
            rs.getDouble("voltage"),
            rs.getDouble("current"),
            rs.getDouble("power"),
            rs.getDouble("kwh")
        );
    }
}
