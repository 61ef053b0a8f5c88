package io.meterfleet.uplink;

import java.io.IOException;
import java.time.Instant;
import java.util.Optional;

/**
 * Durable record of which devices the platform already knows, keyed by device id.
 */
public interface RegistrationStore {

    Optional<RegistrationRecord> find(String deviceId) throws IOException;

    void markRegistered(String deviceId, String deviceName, Instant registeredAt) throws IOException;
}
