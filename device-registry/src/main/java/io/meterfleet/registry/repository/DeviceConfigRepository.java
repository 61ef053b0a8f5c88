package io.meterfleet.registry.repository;

import io.meterfleet.registry.DatabaseManager;
import io.meterfleet.registry.model.DeviceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class DeviceConfigRepository {

    private static final Logger logger = LoggerFactory.getLogger(DeviceConfigRepository.class);

    private final DatabaseManager dbManager;

    public DeviceConfigRepository(DatabaseManager dbManager) {
        this.dbManager = dbManager;
    }

    public void upsert(String deviceId, String deviceType, String status) {
        String sql = "INSERT INTO device_config (device_id, device_type, status) VALUES (?, ?, ?) " +
                     "ON CONFLICT (device_id) DO UPDATE SET device_type = excluded.device_type, " +
                     "status = excluded.status, updated_at = CURRENT_TIMESTAMP";

        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, deviceId);
            stmt.setString(2, deviceType);
            stmt.setString(3, status);
            stmt.executeUpdate();
            logger.debug("Device config saved: {} ({}) -> {}", deviceId, deviceType, status);
        } catch (SQLException e) {
            logger.error("Failed to save device config for {}", deviceId, e);
            throw new RuntimeException("Database operation failed", e);
        }
    }

    public Optional<DeviceConfig> findById(String deviceId) {
        String sql = "SELECT * FROM device_config WHERE device_id = ?";

        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, deviceId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapResultSetToConfig(rs));
                }
            }
        } catch (SQLException e) {
            logger.error("Failed to find device config for {}", deviceId, e);
            throw new RuntimeException("Database operation failed", e);
        }
        return Optional.empty();
    }

    public List<DeviceConfig> findAll() {
        String sql = "SELECT * FROM device_config ORDER BY device_id";
        List<DeviceConfig> configs = new ArrayList<>();

        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                configs.add(mapResultSetToConfig(rs));
            }
            return configs;
        } catch (SQLException e) {
            logger.error("Failed to list device configs", e);
            throw new RuntimeException("Database operation failed", e);
        }
    }

    public boolean delete(String deviceId) {
        String sql = "DELETE FROM device_config WHERE device_id = ?";

        try (Connection conn = dbManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, deviceId);
            boolean deleted = stmt.executeUpdate() > 0;
            if (deleted) {
                logger.info("Deleted device config for {}", deviceId);
            }
            return deleted;
        } catch (SQLException e) {
            logger.error("Failed to delete device config for {}", deviceId, e);
            throw new RuntimeException("Database operation failed", e);
        }
    }

    private DeviceConfig mapResultSetToConfig(ResultSet rs) throws SQLException {
        DeviceConfig config = new DeviceConfig(
            rs.getString("device_id"),
            rs.getString("device_type"),
            rs.getString("status")
        );
        config.setCreatedAt(parseTimestamp(rs.getString("created_at")));
        config.setUpdatedAt(parseTimestamp(rs.getString("updated_at")));
        return config;
    }

    // SQLite hands back "yyyy-MM-dd HH:mm:ss", PostgreSQL adds fractional seconds
    private static LocalDateTime parseTimestamp(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return LocalDateTime.parse(value.trim().replace(' ', 'T'));
        } catch (java.time.format.DateTimeParseException e) {
            logger.debug("Unparseable timestamp '{}' in device_config", value);
            return null;
        }
    }
}
