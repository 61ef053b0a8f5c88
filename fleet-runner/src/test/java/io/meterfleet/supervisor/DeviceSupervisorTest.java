package io.meterfleet.supervisor;

import io.meterfleet.registry.DatabaseManager;
import io.meterfleet.registry.DeviceType;
import io.meterfleet.registry.JdbcMeasurementSink;
import io.meterfleet.registry.MeasurementSink;
import io.meterfleet.registry.model.DeviceConfig;
import io.meterfleet.registry.model.MeasurementSample;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DeviceSupervisorTest {

    @TempDir
    Path tempDir;

    private Path statusPath;
    private DeviceStatusFile statusFile;
    private DeviceSettings settings;
    private FakeWorkerLauncher launcher;
    private MeasurementSink sink;
    private DeviceSupervisor supervisor;

    @BeforeEach
    void setUp() {
        statusPath = tempDir.resolve("device_status.json");
        statusFile = new DeviceStatusFile(statusPath);
        settings = new DeviceSettings(tempDir.resolve("device_settings.json"));
        launcher = new FakeWorkerLauncher();
        sink = mock(MeasurementSink.class);
        supervisor = newSupervisor();
    }

    private DeviceSupervisor newSupervisor() {
        DeviceSupervisor created = new DeviceSupervisor(statusFile, settings, launcher, sink,
            Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
        created.reconcileOnStartup();
        created.setGracePeriod(Duration.ofMillis(50));
        created.setKillWait(Duration.ofMillis(50));
        return created;
    }

    private JSONObject readStatusFile() throws Exception {
        return new JSONObject(Files.readString(statusPath, StandardCharsets.UTF_8));
    }

    @Test
    void addDeviceNumbersEachTypeSeparately() throws Exception {
        assertThat(supervisor.addDevice("PV")).isEqualTo("pv001");
        assertThat(supervisor.addDevice("pv")).isEqualTo("pv002");
        assertThat(supervisor.addDevice("Heat Pump")).isEqualTo("heatpump001");
        assertThat(supervisor.addDevice("MAIN_GRID")).isEqualTo("maingrid001");

        assertThat(supervisor.getStatus("pv002")).hasValueSatisfying(record -> {
            assertThat(record.getStatus()).isEqualTo(DeviceStatus.STOPPED);
            assertThat(record.getDeviceType()).isEqualTo(DeviceType.PV);
        });
        JSONObject json = readStatusFile();
        assertThat(json.getJSONObject("counters").getInt("pv")).isEqualTo(2);
        assertThat(json.getJSONObject("devices").getJSONObject("heatpump001").getString("device_type"))
            .isEqualTo("Heat Pump");
        verify(sink).saveDeviceConfig("pv001", "PV", "stopped");
    }

    @Test
    void unknownDeviceTypeIsRejected() {
        assertThatThrownBy(() -> supervisor.addDevice("Wind Turbine"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Wind Turbine");
    }

    @Test
    void secondStartOfRunningDeviceIsRefused() {
        String deviceId = supervisor.addDevice("PV");
        settings.setMeasurementInterval(12);

        assertThat(supervisor.startDevice(deviceId)).isTrue();
        assertThat(supervisor.startDevice(deviceId)).isFalse();

        assertThat(launcher.getLaunched()).hasSize(1);
        WorkerSpec spec = launcher.getLaunched().get(0);
        assertThat(spec.getDeviceType()).isEqualTo(DeviceType.PV);
        assertThat(spec.getIntervalSeconds()).isEqualTo(12);
        assertThat(supervisor.getStatus(deviceId)).map(DeviceRecord::getStatus).contains(DeviceStatus.ACTIVE);
        verify(sink).saveDeviceConfig(deviceId, "PV", "active");
    }

    @Test
    void startRequiresResolvableType() {
        assertThat(supervisor.startDevice("windmill001")).isFalse();
        assertThat(launcher.getLaunched()).isEmpty();
    }

    @Test
    void startOfUnrecordedDeviceCreatesRecord() {
        assertThat(supervisor.startDevice("heatpump007")).isTrue();

        assertThat(supervisor.getStatus("heatpump007")).isPresent();
        assertThat(supervisor.addDevice("Heat Pump")).isEqualTo("heatpump008");
    }

    @Test
    void launchFailureLeavesDeviceStopped() {
        String deviceId = supervisor.addDevice("Main Grid");
        launcher.failNextLaunches(true);

        assertThat(supervisor.startDevice(deviceId)).isFalse();

        assertThat(supervisor.getStatus(deviceId)).map(DeviceRecord::getStatus).contains(DeviceStatus.STOPPED);
        assertThat(supervisor.isRunning(deviceId)).isFalse();
    }

    @Test
    void stopWithoutWorkerReportsFalseAndIsIdempotent() {
        String deviceId = supervisor.addDevice("PV");

        assertThat(supervisor.stopDevice(deviceId)).isFalse();
        assertThat(supervisor.stopDevice(deviceId)).isFalse();
        assertThat(supervisor.getStatus(deviceId)).map(DeviceRecord::getStatus).contains(DeviceStatus.STOPPED);
    }

    @Test
    void stopTerminatesGracefully() {
        String deviceId = supervisor.addDevice("PV");
        supervisor.startDevice(deviceId);
        FakeWorkerHandle handle = launcher.lastHandle();

        assertThat(supervisor.stopDevice(deviceId)).isTrue();

        assertThat(handle.getTerminateCalls()).isEqualTo(1);
        assertThat(handle.getKillCalls()).isZero();
        assertThat(supervisor.getStatus(deviceId)).map(DeviceRecord::getStatus).contains(DeviceStatus.STOPPED);
    }

    @Test
    void stopKillsWorkerThatIgnoresTerminate() {
        launcher.prepare(new FakeWorkerHandle().ignoringTerminate());
        String deviceId = supervisor.addDevice("PV");
        supervisor.startDevice(deviceId);
        FakeWorkerHandle handle = launcher.lastHandle();

        assertThat(supervisor.stopDevice(deviceId)).isTrue();

        assertThat(handle.getKillCalls()).isEqualTo(1);
        assertThat(handle.isAlive()).isFalse();
        assertThat(supervisor.isRunning(deviceId)).isFalse();
    }

    @Test
    void crashedWorkerIsReportedStoppedAndCanBeRestarted() {
        String deviceId = supervisor.addDevice("Heat Pump");
        supervisor.startDevice(deviceId);
        launcher.lastHandle().exit();

        assertThat(supervisor.getStatus(deviceId)).map(DeviceRecord::getStatus).contains(DeviceStatus.STOPPED);
        assertThat(supervisor.startDevice(deviceId)).isTrue();
        assertThat(launcher.getLaunched()).hasSize(2);
    }

    @Test
    void restartReconcilesActiveDevicesAndLegacyCounters() throws Exception {
        Files.writeString(statusPath, "{"
            + "\"counters\": {\"PV\": 3, \"pv\": 1, \"Heat Pump\": 1},"
            + "\"devices\": {"
            + "  \"pv001\": {\"device_type\": \"PV\", \"status\": \"active\", \"created_at\": \"2024-04-01T08:00:00\"},"
            + "  \"heatpump004\": {\"device_type\": \"Heat Pump\", \"status\": \"stopped\", \"created_at\": \"2024-04-02T08:00:00\"}"
            + "}}", StandardCharsets.UTF_8);

        DeviceSupervisor restarted = newSupervisor();

        assertThat(restarted.getStatus("pv001")).map(DeviceRecord::getStatus).contains(DeviceStatus.STOPPED);
        assertThat(restarted.getCounters()).containsExactlyInAnyOrderEntriesOf(Map.of("pv", 3, "heatpump", 4));
        assertThat(restarted.addDevice("PV")).isEqualTo("pv004");

        JSONObject json = readStatusFile();
        assertThat(json.getJSONObject("counters").keySet()).containsExactlyInAnyOrder("pv", "heatpump");
        assertThat(json.getJSONObject("devices").getJSONObject("pv001").getString("status")).isEqualTo("stopped");
        assertThat(json.getJSONObject("devices").getJSONObject("pv001").getString("created_at"))
            .isEqualTo("2024-04-01T08:00:00");
    }

    @Test
    void registrationRecordedByWorkerSurvivesSupervisorSave() throws Exception {
        String deviceId = supervisor.addDevice("PV");
        StatusFileRegistrationStore store = new StatusFileRegistrationStore(statusFile);
        store.markRegistered(deviceId, "iot_sim_pv001", Instant.parse("2024-05-01T10:01:00Z"));

        supervisor.startDevice(deviceId);
        supervisor.stopDevice(deviceId);

        assertThat(store.find(deviceId)).hasValueSatisfying(r ->
            assertThat(r.getDeviceName()).isEqualTo("iot_sim_pv001"));
    }

    @Test
    void deleteStopsWorkerAndPurgesStoredData() {
        String deviceId = supervisor.addDevice("PV");
        supervisor.startDevice(deviceId);
        FakeWorkerHandle handle = launcher.lastHandle();

        assertThat(supervisor.deleteDevice(deviceId)).isTrue();

        assertThat(handle.isAlive()).isFalse();
        assertThat(supervisor.getStatus(deviceId)).isEmpty();
        assertThat(supervisor.listAll()).isEmpty();
        verify(sink).deleteForDevice(deviceId);
        verify(sink).deleteDeviceConfig(deviceId);
    }

    @Test
    void unreadableStatusFileIsNotOverwritten() throws Exception {
        Files.writeString(statusPath, "{ \"counters\": {\"pv\": 3", StandardCharsets.UTF_8);
        supervisor = newSupervisor();

        String deviceId = supervisor.addDevice("PV");

        assertThat(deviceId).isEqualTo("pv001");
        assertThat(supervisor.getStatus(deviceId)).isPresent();
        assertThat(Files.readString(statusPath, StandardCharsets.UTF_8)).isEqualTo("{ \"counters\": {\"pv\": 3");
    }

    @Test
    void idsWithStoredDataAreNotReused() {
        when(sink.count("pv001")).thenReturn(120L);
        when(sink.findDeviceConfig("pv002")).thenReturn(Optional.of(mock(DeviceConfig.class)));

        assertThat(supervisor.addDevice("PV")).isEqualTo("pv003");
        assertThat(supervisor.getCounters()).containsEntry("pv", 3);
    }

    @Test
    void failingStoredDataCheckDoesNotBlockAdd() {
        when(sink.count(anyString())).thenThrow(new RuntimeException("Database operation failed"));

        assertThat(supervisor.addDevice("PV")).isEqualTo("pv001");
    }

    @Test
    void deletingUnknownDeviceSucceeds() {
        assertThat(supervisor.deleteDevice("pv099")).isTrue();
        assertThat(supervisor.getStatus("pv099")).isEmpty();
    }

    @Test
    void storageFailuresDoNotBreakLifecycle() {
        doThrow(new RuntimeException("Database operation failed")).when(sink)
            .saveDeviceConfig(anyString(), anyString(), anyString());

        String deviceId = supervisor.addDevice("PV");

        assertThat(supervisor.startDevice(deviceId)).isTrue();
        assertThat(supervisor.stopDevice(deviceId)).isTrue();
    }

    @Test
    void cleanupStopsEveryWorkerEvenWhenOneFails() {
        launcher.prepare(new FakeWorkerHandle().failingOnTerminate());
        String first = supervisor.addDevice("PV");
        String second = supervisor.addDevice("PV");
        supervisor.startDevice(first);
        supervisor.startDevice(second);
        FakeWorkerHandle secondHandle = launcher.lastHandle();

        supervisor.cleanup();

        assertThat(secondHandle.isAlive()).isFalse();
        assertThat(supervisor.isRunning(second)).isFalse();
        assertThat(supervisor.listAll()).extracting(DeviceRecord::getStatus)
            .containsOnly(DeviceStatus.STOPPED);
    }

    @Test
    void listAllIncludesDevicesAddedByAnotherWriter() throws Exception {
        supervisor.addDevice("PV");
        DeviceSupervisor other = new DeviceSupervisor(statusFile, settings, launcher, sink);
        other.reconcileOnStartup();
        other.addDevice("Main Grid");

        List<DeviceRecord> all = supervisor.listAll();

        assertThat(all).extracting(DeviceRecord::getDeviceId).containsExactly("maingrid001", "pv001");
    }

    @Test
    void measurementIntervalIsClamped() {
        assertThat(supervisor.setMeasurementInterval(1000)).isEqualTo(300);
        assertThat(supervisor.getMeasurementInterval()).isEqualTo(300);
        assertThat(supervisor.setMeasurementInterval(0)).isEqualTo(1);
    }

    @Test
    void deleteRemovesOnlyThatDevicesSamples() {
        DatabaseManager dbManager = new DatabaseManager("jdbc:sqlite:" + tempDir.resolve("fleet.db"), "", "");
        try (JdbcMeasurementSink jdbcSink = new JdbcMeasurementSink(dbManager)) {
            DeviceSupervisor jdbcSupervisor = new DeviceSupervisor(statusFile, settings, launcher, jdbcSink);
            String pv1 = jdbcSupervisor.addDevice("PV");
            String pv2 = jdbcSupervisor.addDevice("PV");
            Instant now = Instant.parse("2024-05-01T10:00:00Z");
            jdbcSink.insert(new MeasurementSample(pv1, now, 230, 10, 2300, 0.1));
            jdbcSink.insert(new MeasurementSample(pv1, now.plusSeconds(5), 230, 10, 2300, 0.2));
            jdbcSink.insert(new MeasurementSample(pv2, now, 220, 5, 1100, 0.05));

            jdbcSupervisor.deleteDevice(pv1);

            assertThat(jdbcSink.count(pv1)).isZero();
            assertThat(jdbcSink.count(pv2)).isEqualTo(1);
            assertThat(jdbcSink.findDeviceConfig(pv1)).isEmpty();
            assertThat(jdbcSink.findDeviceConfig(pv2)).isPresent();
        }
    }
}
