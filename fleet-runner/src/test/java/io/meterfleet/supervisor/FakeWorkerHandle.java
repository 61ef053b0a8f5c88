package io.meterfleet.supervisor;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

class FakeWorkerHandle implements WorkerHandle {

    private static final AtomicLong PIDS = new AtomicLong(1000);

    private final long pid = PIDS.incrementAndGet();
    private volatile boolean alive = true;
    private volatile boolean ignoresTerminate = false;
    private volatile boolean failsOnTerminate = false;
    private volatile int terminateCalls;
    private volatile int killCalls;

    FakeWorkerHandle ignoringTerminate() {
        ignoresTerminate = true;
        return this;
    }

    FakeWorkerHandle failingOnTerminate() {
        failsOnTerminate = true;
        return this;
    }

    void exit() {
        alive = false;
    }

    @Override
    public long pid() {
        return pid;
    }

    @Override
    public boolean isAlive() {
        return alive;
    }

    @Override
    public void terminate() {
        terminateCalls++;
        if (failsOnTerminate) {
            throw new IllegalStateException("signal failed");
        }
        if (!ignoresTerminate) {
            alive = false;
        }
    }

    @Override
    public void kill() {
        killCalls++;
        alive = false;
    }

    @Override
    public boolean awaitExit(Duration timeout) {
        return !alive;
    }

    int getTerminateCalls() {
        return terminateCalls;
    }

    int getKillCalls() {
        return killCalls;
    }
}
