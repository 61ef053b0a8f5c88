package io.meterfleet.supervisor;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

class FakeWorkerLauncher implements WorkerLauncher {

    private final List<WorkerSpec> launched = new ArrayList<>();
    private final List<FakeWorkerHandle> handles = new ArrayList<>();
    private final Deque<FakeWorkerHandle> prepared = new ArrayDeque<>();
    private boolean failing = false;

    FakeWorkerLauncher prepare(FakeWorkerHandle handle) {
        prepared.add(handle);
        return this;
    }

    void failNextLaunches(boolean failing) {
        this.failing = failing;
    }

    @Override
    public WorkerHandle launch(WorkerSpec spec) throws IOException {
        if (failing) {
            throw new IOException("Cannot run program");
        }
        FakeWorkerHandle handle = prepared.isEmpty() ? new FakeWorkerHandle() : prepared.poll();
        launched.add(spec);
        handles.add(handle);
        return handle;
    }

    List<WorkerSpec> getLaunched() {
        return launched;
    }

    FakeWorkerHandle lastHandle() {
        return handles.get(handles.size() - 1);
    }
}
