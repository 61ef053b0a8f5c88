package io.meterfleet.supervisor;

import java.io.IOException;

@FunctionalInterface
public interface WorkerLauncher {

    WorkerHandle launch(WorkerSpec spec) throws IOException;
}
