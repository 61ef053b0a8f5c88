package io.meterfleet.supervisor;

import io.meterfleet.registry.DeviceType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeviceStatusFileTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileIsEmpty() throws Exception {
        DeviceStatusFile.Snapshot snapshot = new DeviceStatusFile(tempDir.resolve("none.json")).load();

        assertThat(snapshot.getCounters()).isEmpty();
        assertThat(snapshot.getRecords()).isEmpty();
    }

    @Test
    void savedRecordsLoadBack() throws Exception {
        DeviceStatusFile file = new DeviceStatusFile(tempDir.resolve("status.json"));
        DeviceRecord pv = new DeviceRecord("pv001", DeviceType.PV, DeviceStatus.ACTIVE, "2024-05-01T10:00:00");
        DeviceRecord grid = new DeviceRecord("maingrid001", DeviceType.MAIN_GRID, DeviceStatus.STOPPED, "2024-05-01T10:05:00");

        file.save(Map.of("pv", 1, "maingrid", 1), List.of(pv, grid));
        DeviceStatusFile.Snapshot snapshot = file.load();

        assertThat(snapshot.getRecords()).containsEntry("pv001", pv).containsEntry("maingrid001", grid);
        assertThat(snapshot.getCounters()).containsEntry("maingrid", 1);
    }

    @Test
    void entriesWithUnknownTypeAreSkippedAndTypeFallsBackToIdPrefix() throws Exception {
        Path path = tempDir.resolve("status.json");
        Files.writeString(path, "{\"devices\": {"
            + "\"heatpump002\": {\"status\": \"active\"},"
            + "\"turbine001\": {\"device_type\": \"Wind\", \"status\": \"stopped\"},"
            + "\"pv001\": \"broken\""
            + "}}", StandardCharsets.UTF_8);

        DeviceStatusFile.Snapshot snapshot = new DeviceStatusFile(path).load();

        assertThat(snapshot.getRecords()).containsOnlyKeys("heatpump002");
        assertThat(snapshot.getRecords().get("heatpump002").getDeviceType()).isEqualTo(DeviceType.HEAT_PUMP);
        assertThat(snapshot.getRecords().get("heatpump002").getStatus()).isEqualTo(DeviceStatus.ACTIVE);
    }

    @Test
    void registrationFieldsAreKeptOnlyForRemainingDevices() throws Exception {
        DeviceStatusFile file = new DeviceStatusFile(tempDir.resolve("status.json"));
        DeviceRecord pv1 = new DeviceRecord("pv001", DeviceType.PV, DeviceStatus.STOPPED, "2024-05-01T10:00:00");
        DeviceRecord pv2 = new DeviceRecord("pv002", DeviceType.PV, DeviceStatus.STOPPED, "2024-05-01T10:00:00");
        file.save(Map.of("pv", 2), List.of(pv1, pv2));
        StatusFileRegistrationStore store = new StatusFileRegistrationStore(file);
        store.markRegistered("pv001", "iot_sim_pv001", Instant.parse("2024-05-01T10:01:00Z"));
        store.markRegistered("pv002", "iot_sim_pv002", Instant.parse("2024-05-01T10:01:00Z"));

        file.save(Map.of("pv", 2), List.of(pv1.withStatus(DeviceStatus.ACTIVE)));

        assertThat(store.find("pv001")).isPresent();
        assertThat(store.find("pv002")).isEmpty();
    }

    @Test
    void registrationOfUnknownDeviceFails() {
        DeviceStatusFile file = new DeviceStatusFile(tempDir.resolve("status.json"));
        StatusFileRegistrationStore store = new StatusFileRegistrationStore(file);

        assertThatThrownBy(() -> store.markRegistered("pv001", "iot_sim_pv001", Instant.now()))
            .hasMessageContaining("pv001");
    }
}
