package io.meterfleet.runner;

import io.meterfleet.registry.DeviceType;
import io.meterfleet.registry.MeasurementSink;
import io.meterfleet.supervisor.DeviceSettings;
import io.meterfleet.supervisor.DeviceStatusFile;
import io.meterfleet.supervisor.DeviceSupervisor;
import io.meterfleet.supervisor.WorkerHandle;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class SimulatorMainTest {

    @TempDir
    Path tempDir;

    @Test
    void parsesDevicePlan() {
        Map<DeviceType, Integer> plan = SimulatorMain.parseDevicePlan("PV:2, HeatPump:1,maingrid, pv:1");

        assertThat(plan).containsEntry(DeviceType.PV, 3)
            .containsEntry(DeviceType.HEAT_PUMP, 1)
            .containsEntry(DeviceType.MAIN_GRID, 1);
        assertThat(SimulatorMain.parseDevicePlan(" ")).isEmpty();
    }

    @Test
    void rejectsInvalidPlans() {
        assertThatThrownBy(() -> SimulatorMain.parseDevicePlan("Wind:2")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SimulatorMain.parseDevicePlan("PV:two")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SimulatorMain.parseDevicePlan("PV:-1")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reusesExistingDevicesBeforeAddingNewOnes() {
        DeviceSupervisor supervisor = new DeviceSupervisor(
            new DeviceStatusFile(tempDir.resolve("device_status.json")),
            new DeviceSettings(tempDir.resolve("device_settings.json")),
            spec -> mock(WorkerHandle.class),
            mock(MeasurementSink.class));
        supervisor.addDevice("PV");
        supervisor.addDevice("Main Grid");

        Map<DeviceType, Integer> plan = new LinkedHashMap<>();
        plan.put(DeviceType.PV, 2);
        plan.put(DeviceType.HEAT_PUMP, 1);
        List<String> selected = SimulatorMain.selectDevices(supervisor, plan);

        assertThat(selected).containsExactly("pv001", "pv002", "heatpump001");
        assertThat(supervisor.listAll()).hasSize(4);
    }
}
