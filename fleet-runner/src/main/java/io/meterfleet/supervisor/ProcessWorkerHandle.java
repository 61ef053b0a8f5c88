package io.meterfleet.supervisor;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

class ProcessWorkerHandle implements WorkerHandle {

    private final Process process;

    ProcessWorkerHandle(Process process) {
        this.process = process;
    }

    @Override
    public long pid() {
        return process.pid();
    }

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }

    @Override
    public void terminate() {
        process.destroy();
    }

    @Override
    public void kill() {
        process.destroyForcibly();
    }

    @Override
    public boolean awaitExit(Duration timeout) throws InterruptedException {
        return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
