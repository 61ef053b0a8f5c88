package io.meterfleet.supervisor;

import java.time.Duration;

/**
 * A running worker process as seen by the supervisor.
 */
public interface WorkerHandle {

    long pid();

    boolean isAlive();

    /**
     * Asks the worker to shut down gracefully (SIGTERM).
     */
    void terminate();

    /**
     * Kills the worker (SIGKILL).
     */
    void kill();

    /**
     * @return true if the worker has exited within the timeout
     */
    boolean awaitExit(Duration timeout) throws InterruptedException;
}
