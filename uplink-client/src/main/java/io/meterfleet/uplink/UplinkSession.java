package io.meterfleet.uplink;

import io.meterfleet.registry.model.MeasurementSample;
import org.eclipse.paho.client.mqttv3.IMqttActionListener;
import org.eclipse.paho.client.mqttv3.IMqttAsyncClient;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.IMqttToken;
import org.eclipse.paho.client.mqttv3.MqttCallback;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * MQTT uplink of one simulated device to the telemetry platform.
 *
 * <p>All mutable state is guarded by {@code stateLock}. Paho callbacks carry the generation of
 * the connect attempt that created them; callbacks from an older generation are ignored, which
 * keeps a late acknowledgment of a timed-out attempt from resurrecting the session. No blocking
 * Paho call is made while the lock is held.
 */
public class UplinkSession implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(UplinkSession.class);

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_ACK_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(60);
    public static final Duration DEFAULT_RESTART_DELAY = Duration.ofSeconds(5);
    public static final int KEEP_ALIVE_SECONDS = 60;

    private final String deviceId;
    private final String clientId;
    private final UplinkSettings settings;
    private final RegistrationStore registrationStore;
    private final MqttClientFactory clientFactory;
    private final ReconnectPolicy reconnectPolicy;
    private final Duration connectTimeout;
    private final Duration ackTimeout;
    private final Duration heartbeatInterval;
    private final Duration restartDelay;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;

    private final ReentrantLock stateLock = new ReentrantLock();
    private final Condition stateChanged = stateLock.newCondition();

    private IMqttAsyncClient client;
    private long connectGeneration;
    private ConnectionState connectionState = ConnectionState.DISCONNECTED;
    private RegistrationState registrationState = RegistrationState.UNREGISTERED;
    private final boolean autoReconnectConfigured;
    private boolean autoReconnect;
    private boolean reconnecting;
    private boolean reconnectExhausted;
    private int reconnectAttempts;
    private ConnectFailure lastFailure;
    private Instant lastMessageAt;
    private Instant lastHeartbeatAt;
    private ScheduledFuture<?> heartbeatTask;
    private ScheduledFuture<?> reconnectTask;
    private boolean closed;

    private UplinkSession(Builder builder) {
        this.deviceId = builder.deviceId;
        this.settings = builder.settings;
        this.clientId = settings.deviceName(deviceId);
        this.registrationStore = builder.registrationStore;
        this.clientFactory = builder.clientFactory;
        this.reconnectPolicy = builder.reconnectPolicy;
        this.connectTimeout = builder.connectTimeout;
        this.ackTimeout = builder.ackTimeout;
        this.heartbeatInterval = builder.heartbeatInterval;
        this.restartDelay = builder.restartDelay;
        this.clock = builder.clock;
        this.autoReconnectConfigured = builder.autoReconnect;
        this.autoReconnect = builder.autoReconnect;

        AtomicInteger threadCount = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "uplink-" + deviceId + "-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        logger.info("UplinkSession initialized for broker: {}, clientId: {}", settings.getServerUri(), clientId);
    }

    /**
     * Opens the connection and blocks until the broker acknowledges it or the connect timeout
     * elapses.
     *
     * @return true when the session is connected
     */
    public boolean connect() {
        return connect(false);
    }

    /**
     * A reconnect attempt keeps the auto-reconnect flag as it is and gives up when the
     * reconnection was cancelled after it was scheduled.
     */
    private boolean connect(boolean reconnectAttempt) {
        long generation;
        IMqttAsyncClient previous;
        IMqttAsyncClient target;
        stateLock.lock();
        try {
            if (closed) {
                logger.warn("Connect requested on closed session {}", clientId);
                return false;
            }
            if (reconnectAttempt && (!reconnecting || !autoReconnect)) {
                logger.debug("Reconnection of {} cancelled", clientId);
                return false;
            }
            if (connectionState == ConnectionState.CONNECTED) {
                return true;
            }
            if (connectionState == ConnectionState.CONNECTING) {
                return awaitOutcome(connectGeneration);
            }
            if (!reconnectAttempt) {
                autoReconnect = autoReconnectConfigured;
            }
            connectionState = ConnectionState.CONNECTING;
            generation = ++connectGeneration;
            previous = client;
            client = null;
            try {
                client = clientFactory.create(settings.getServerUri(), clientId);
            } catch (MqttException e) {
                failAttempt(generation, ConnectFailure.fromException(e), e);
                return false;
            }
            client.setCallback(new SessionCallback(generation));
            target = client;
        } finally {
            stateLock.unlock();
        }
        closeClient(previous);

        logger.info("Connecting to MQTT broker {} (clientId: {})...", settings.getServerUri(), clientId);
        MqttConnectOptions options;
        try {
            options = buildConnectOptions();
        } catch (GeneralSecurityException | IOException e) {
            failAttempt(generation, ConnectFailure.TLS_ERROR, e);
            return false;
        }
        try {
            target.connect(options, null, new ConnectListener(generation));
        } catch (MqttException e) {
            failAttempt(generation, ConnectFailure.fromException(e), e);
            return false;
        }

        boolean connected;
        stateLock.lock();
        try {
            connected = awaitOutcome(generation);
        } finally {
            stateLock.unlock();
        }
        if (connected && isRegistered()) {
            subscribeCommands();
        }
        return connected;
    }

    // Caller holds stateLock.
    private boolean awaitOutcome(long generation) {
        long remaining = connectTimeout.toNanos();
        try {
            while (connectGeneration == generation && connectionState == ConnectionState.CONNECTING && remaining > 0) {
                remaining = stateChanged.awaitNanos(remaining);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for connection of {}", clientId);
        }
        if (connectGeneration == generation && connectionState == ConnectionState.CONNECTING) {
            IMqttAsyncClient stale = client;
            client = null;
            connectGeneration++;
            lastFailure = ConnectFailure.TIMEOUT;
            connectionState = ConnectionState.DISCONNECTED;
            stateChanged.signalAll();
            logger.error("No connect acknowledgment from {} within {}s (clientId: {})",
                settings.getServerUri(), connectTimeout.getSeconds(), clientId);
            scheduler.execute(() -> closeClient(stale));
            return false;
        }
        return connectionState == ConnectionState.CONNECTED;
    }

    private MqttConnectOptions buildConnectOptions() throws GeneralSecurityException, IOException {
        MqttConnectOptions options = new MqttConnectOptions();
        options.setCleanSession(true);
        options.setAutomaticReconnect(false);
        options.setKeepAliveInterval(KEEP_ALIVE_SECONDS);
        options.setConnectionTimeout((int) Math.max(1, connectTimeout.getSeconds()));
        options.setMqttVersion(MqttConnectOptions.MQTT_VERSION_3_1_1);
        if (settings.hasCredentials()) {
            options.setUserName(settings.getQualifiedUsername());
            String password = settings.getPassword();
            options.setPassword(password == null ? new char[0] : password.toCharArray());
        }
        if (settings.isUseSsl()) {
            options.setSocketFactory(UplinkSslContextFactory.create(settings).getSocketFactory());
        }
        return options;
    }

    private void onConnected(long generation) {
        stateLock.lock();
        try {
            if (generation != connectGeneration) {
                logger.debug("Ignoring stale connect acknowledgment for {}", clientId);
                return;
            }
            connectionState = ConnectionState.CONNECTED;
            lastFailure = null;
            reconnecting = false;
            reconnectExhausted = false;
            reconnectAttempts = 0;
            startHeartbeat();
            stateChanged.signalAll();
        } finally {
            stateLock.unlock();
        }
        logger.info("Connected to MQTT broker successfully (clientId: {})", clientId);
    }

    private void failAttempt(long generation, ConnectFailure failure, Throwable cause) {
        stateLock.lock();
        try {
            if (generation != connectGeneration) {
                return;
            }
            lastFailure = failure;
            connectionState = ConnectionState.DISCONNECTED;
            stateChanged.signalAll();
        } finally {
            stateLock.unlock();
        }
        logFailure(failure, cause);
    }

    private void logFailure(ConnectFailure failure, Throwable cause) {
        String detail = cause == null ? "" : cause.getMessage();
        switch (failure) {
            case BAD_CREDENTIALS:
            case NOT_AUTHORIZED:
                logger.error("Broker refused {} ({}): check username, password and tenant", clientId, failure.getDescription());
                break;
            case TLS_ERROR:
                logger.error("TLS failure for {}: {}", clientId, detail);
                logger.error("  - Verify the CA certificate matches the broker certificate");
                logger.error("  - Verify the client certificate and key belong together and are not expired");
                break;
            case PROTOCOL_MISMATCH:
            case BAD_CLIENT_ID:
            case SERVER_UNAVAILABLE:
                logger.error("Broker rejected connection of {}: {}", clientId, failure.getDescription());
                break;
            default:
                logger.error("Failed to connect {} to {}: {} ({})", clientId, settings.getServerUri(),
                    failure.getDescription(), detail);
                break;
        }
        if (cause != null) {
            logger.debug("Full connection error stack trace", cause);
        }
    }

    /**
     * Announces the device to the platform. Without {@code force} a device already recorded in
     * the registration store is not announced again.
     */
    public boolean register(String deviceType, String deviceName, boolean force) {
        if (!isConnected()) {
            logger.warn("Cannot register {}: not connected", deviceName);
            return false;
        }
        if (!force) {
            try {
                Optional<RegistrationRecord> existing = registrationStore.find(deviceId);
                if (existing.isPresent()) {
                    logger.info("Device {} already registered as {} at {}", deviceId,
                        existing.get().getDeviceName(), existing.get().getRegisteredAt());
                    setRegistered();
                    return subscribeCommands();
                }
            } catch (IOException e) {
                logger.warn("Could not read registration record of {}, registering again: {}", deviceId, e.getMessage());
            }
        }

        if (!publish(SmartRest.registration(deviceName, deviceType), 1, true)) {
            logger.error("Registration of {} failed", deviceName);
            return false;
        }
        try {
            registrationStore.markRegistered(deviceId, deviceName, clock.instant());
        } catch (IOException e) {
            logger.error("Registration of {} sent but could not be recorded: {}", deviceName, e.getMessage());
        }
        setRegistered();
        logger.info("Registration sent for device: {} ({})", deviceName, deviceType);
        return subscribeCommands();
    }

    private void setRegistered() {
        stateLock.lock();
        try {
            registrationState = RegistrationState.REGISTERED;
        } finally {
            stateLock.unlock();
        }
    }

    private boolean subscribeCommands() {
        IMqttAsyncClient target = connectedClient();
        if (target == null) {
            return false;
        }
        try {
            IMqttToken token = target.subscribe(SmartRest.COMMAND_TOPIC, 1);
            token.waitForCompletion(ackTimeout.toMillis());
            logger.info("Subscribed to topic: {}", SmartRest.COMMAND_TOPIC);
            return true;
        } catch (MqttException e) {
            logger.warn("Failed to subscribe {} to {}: {}", clientId, SmartRest.COMMAND_TOPIC, e.getMessage());
            return false;
        }
    }

    /**
     * Makes one inline connect attempt when the session is down, automatic reconnection is
     * enabled and no background reconnection is running.
     *
     * @return true when the session is connected afterwards
     */
    public boolean ensureConnected() {
        if (isConnected()) {
            return true;
        }
        boolean inlineAttempt;
        stateLock.lock();
        try {
            inlineAttempt = autoReconnect && !reconnecting && !closed;
        } finally {
            stateLock.unlock();
        }
        return inlineAttempt && connect();
    }

    /**
     * Forwards one sample, connecting first through {@link #ensureConnected()}.
     */
    public boolean sendMeasurement(MeasurementSample sample) {
        if (!ensureConnected()) {
            logger.debug("Measurement of {} not sent: not connected", deviceId);
            return false;
        }
        return publish(SmartRest.measurement(sample), 0, false);
    }

    public boolean sendAlarm(String alarmType, String text, AlarmSeverity severity) {
        boolean sent = publish(SmartRest.alarm(severity, alarmType, text), 1, true);
        if (sent) {
            logger.info("Alarm {} ({}) raised for {}", alarmType, severity, deviceId);
        }
        return sent;
    }

    private boolean publish(String payload, int qos, boolean awaitAck) {
        IMqttAsyncClient target = connectedClient();
        if (target == null) {
            return false;
        }
        MqttMessage message = new MqttMessage(payload.getBytes(StandardCharsets.UTF_8));
        message.setQos(qos);
        message.setRetained(false);
        try {
            IMqttDeliveryToken token = target.publish(SmartRest.PUBLISH_TOPIC, message);
            if (awaitAck) {
                token.waitForCompletion(ackTimeout.toMillis());
            }
        } catch (MqttException e) {
            logger.warn("Publish from {} failed (reason code: {}): {}", clientId, e.getReasonCode(), e.getMessage());
            return false;
        }
        stateLock.lock();
        try {
            lastMessageAt = clock.instant();
        } finally {
            stateLock.unlock();
        }
        logger.debug("Published to topic '{}': {}", SmartRest.PUBLISH_TOPIC, payload);
        return true;
    }

    private IMqttAsyncClient connectedClient() {
        stateLock.lock();
        try {
            return connectionState == ConnectionState.CONNECTED ? client : null;
        } finally {
            stateLock.unlock();
        }
    }

    // Caller holds stateLock.
    private void startHeartbeat() {
        stopHeartbeat();
        long periodMs = heartbeatInterval.toMillis();
        heartbeatTask = scheduler.scheduleAtFixedRate(() -> {
            try {
                heartbeatTick();
            } catch (RuntimeException e) {
                logger.error("Error sending heartbeat", e);
            }
        }, periodMs, periodMs, TimeUnit.MILLISECONDS);
        logger.debug("Heartbeat started for {} with interval: {}ms", clientId, periodMs);
    }

    // Caller holds stateLock.
    private void stopHeartbeat() {
        if (heartbeatTask != null) {
            heartbeatTask.cancel(false);
            heartbeatTask = null;
        }
    }

    /**
     * Sends a heartbeat unless the session published something within the last interval.
     *
     * @return true when a heartbeat went out
     */
    boolean heartbeatTick() {
        Instant now = clock.instant();
        stateLock.lock();
        try {
            if (connectionState != ConnectionState.CONNECTED) {
                return false;
            }
            if (lastMessageAt != null && Duration.between(lastMessageAt, now).compareTo(heartbeatInterval) < 0) {
                logger.trace("Recent traffic from {}, heartbeat skipped", clientId);
                return false;
            }
        } finally {
            stateLock.unlock();
        }
        if (!publish(SmartRest.HEARTBEAT, 0, false)) {
            logger.warn("Heartbeat of {} failed", clientId);
            return false;
        }
        stateLock.lock();
        try {
            lastHeartbeatAt = now;
        } finally {
            stateLock.unlock();
        }
        logger.debug("Heartbeat sent for device: {}", deviceId);
        return true;
    }

    private void onConnectionLost(long generation, Throwable cause) {
        stateLock.lock();
        try {
            if (generation != connectGeneration || connectionState != ConnectionState.CONNECTED) {
                return;
            }
            connectionState = ConnectionState.DISCONNECTED;
            stopHeartbeat();
            stateChanged.signalAll();
            logger.warn("Connection lost for {}: {}", clientId, cause == null ? "unknown cause" : cause.getMessage());
            if (autoReconnect && !closed && !reconnecting) {
                reconnecting = true;
                reconnectAttempts = 0;
                scheduleReconnectAttempt();
            }
        } finally {
            stateLock.unlock();
        }
    }

    // Caller holds stateLock.
    private void scheduleReconnectAttempt() {
        Duration delay = reconnectPolicy.delayForAttempt(reconnectAttempts + 1);
        logger.info("Reconnecting {} in {} ms (attempt {}/{})", clientId, delay.toMillis(),
            reconnectAttempts + 1, reconnectPolicy.getMaxAttempts());
        reconnectTask = scheduler.schedule(this::runReconnectAttempt, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void runReconnectAttempt() {
        stateLock.lock();
        try {
            if (!reconnecting || !autoReconnect || closed) {
                return;
            }
            reconnectAttempts++;
        } finally {
            stateLock.unlock();
        }

        boolean connected = connect(true);

        stateLock.lock();
        try {
            if (connected) {
                logger.info("Reconnected {} to {}", clientId, settings.getServerUri());
                return;
            }
            if (!reconnecting || !autoReconnect || closed) {
                return;
            }
            if (reconnectAttempts >= reconnectPolicy.getMaxAttempts()) {
                reconnecting = false;
                autoReconnect = false;
                reconnectExhausted = true;
                reconnectTask = null;
                logger.error("Giving up on {} after {} reconnection attempts; automatic reconnection disabled",
                    clientId, reconnectAttempts);
                return;
            }
            scheduleReconnectAttempt();
        } finally {
            stateLock.unlock();
        }
    }

    private void handleCommands(String payload) {
        for (String line : SmartRest.lines(payload)) {
            if (SmartRest.isRestartCommand(line)) {
                logger.info("Restart operation received for {}", deviceId);
                scheduler.execute(this::executeRestart);
            } else {
                logger.info("Ignoring unsupported operation for {}: {}", deviceId, line);
            }
        }
    }

    private void executeRestart() {
        if (!publish(SmartRest.RESTART_EXECUTING, 1, true)) {
            logger.warn("Could not report restart of {} as executing", deviceId);
            return;
        }
        scheduler.schedule(() -> {
            if (publish(SmartRest.RESTART_SUCCESSFUL, 1, true)) {
                logger.info("Simulated restart of {} completed", deviceId);
            } else {
                logger.warn("Could not report restart of {} as successful", deviceId);
            }
        }, restartDelay.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Leaves the broker and stops background work. Automatic reconnection stays off until the
     * next {@link #connect()}.
     */
    public void disconnect() {
        IMqttAsyncClient detached;
        stateLock.lock();
        try {
            autoReconnect = false;
            reconnecting = false;
            if (reconnectTask != null) {
                reconnectTask.cancel(false);
                reconnectTask = null;
            }
            stopHeartbeat();
            connectGeneration++;
            detached = client;
            client = null;
            connectionState = ConnectionState.DISCONNECTED;
            registrationState = RegistrationState.UNREGISTERED;
            stateChanged.signalAll();
        } finally {
            stateLock.unlock();
        }
        if (detached == null) {
            return;
        }
        if (detached.isConnected()) {
            logger.info("Disconnecting MQTT client {}...", clientId);
            try {
                detached.disconnect().waitForCompletion(ackTimeout.toMillis());
                logger.info("MQTT client {} disconnected", clientId);
            } catch (MqttException e) {
                logger.warn("Clean disconnect of {} failed: {}", clientId, e.getMessage());
            }
        }
        closeClient(detached);
    }

    private void closeClient(IMqttAsyncClient target) {
        if (target == null) {
            return;
        }
        try {
            if (target.isConnected()) {
                target.disconnectForcibly(0, ackTimeout.toMillis());
            }
            target.close();
        } catch (MqttException e) {
            logger.warn("Error closing MQTT client {}: {}", clientId, e.getMessage());
        }
    }

    @Override
    public void close() {
        disconnect();
        stateLock.lock();
        try {
            closed = true;
        } finally {
            stateLock.unlock();
        }
        logger.debug("Stopping uplink executor of {}...", clientId);
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isConnected() {
        return getConnectionState() == ConnectionState.CONNECTED;
    }

    public ConnectionState getConnectionState() {
        stateLock.lock();
        try {
            return connectionState;
        } finally {
            stateLock.unlock();
        }
    }

    public RegistrationState getRegistrationState() {
        stateLock.lock();
        try {
            return registrationState;
        } finally {
            stateLock.unlock();
        }
    }

    public boolean isRegistered() {
        return getRegistrationState() == RegistrationState.REGISTERED;
    }

    public boolean isReconnecting() {
        stateLock.lock();
        try {
            return reconnecting;
        } finally {
            stateLock.unlock();
        }
    }

    public boolean isAutoReconnect() {
        stateLock.lock();
        try {
            return autoReconnect;
        } finally {
            stateLock.unlock();
        }
    }

    public boolean isReconnectExhausted() {
        stateLock.lock();
        try {
            return reconnectExhausted;
        } finally {
            stateLock.unlock();
        }
    }

    public int getReconnectAttempts() {
        stateLock.lock();
        try {
            return reconnectAttempts;
        } finally {
            stateLock.unlock();
        }
    }

    public Optional<ConnectFailure> getLastFailure() {
        stateLock.lock();
        try {
            return Optional.ofNullable(lastFailure);
        } finally {
            stateLock.unlock();
        }
    }

    public Optional<Instant> getLastMessageAt() {
        stateLock.lock();
        try {
            return Optional.ofNullable(lastMessageAt);
        } finally {
            stateLock.unlock();
        }
    }

    public Optional<Instant> getLastHeartbeatAt() {
        stateLock.lock();
        try {
            return Optional.ofNullable(lastHeartbeatAt);
        } finally {
            stateLock.unlock();
        }
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getClientId() {
        return clientId;
    }

    private final class ConnectListener implements IMqttActionListener {

        private final long generation;

        ConnectListener(long generation) {
            this.generation = generation;
        }

        @Override
        public void onSuccess(IMqttToken asyncActionToken) {
            onConnected(generation);
        }

        @Override
        public void onFailure(IMqttToken asyncActionToken, Throwable exception) {
            failAttempt(generation, ConnectFailure.fromException(exception), exception);
        }
    }

    private final class SessionCallback implements MqttCallback {

        private final long generation;

        SessionCallback(long generation) {
            this.generation = generation;
        }

        @Override
        public void connectionLost(Throwable cause) {
            onConnectionLost(generation, cause);
        }

        @Override
        public void messageArrived(String topic, MqttMessage message) {
            String payload = new String(message.getPayload(), StandardCharsets.UTF_8);
            logger.debug("Received message on topic '{}': {}", topic, payload);
            if (SmartRest.COMMAND_TOPIC.equals(topic)) {
                handleCommands(payload);
            }
        }

        @Override
        public void deliveryComplete(IMqttDeliveryToken token) {
            // delivery results are read from the publish tokens
        }
    }

    public static class Builder {
        private String deviceId;
        private UplinkSettings settings;
        private RegistrationStore registrationStore;
        private MqttClientFactory clientFactory = MqttClientFactory.paho();
        private ReconnectPolicy reconnectPolicy = ReconnectPolicy.defaults();
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private Duration ackTimeout = DEFAULT_ACK_TIMEOUT;
        private Duration heartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL;
        private Duration restartDelay = DEFAULT_RESTART_DELAY;
        private Clock clock = Clock.systemUTC();
        private boolean autoReconnect = true;

        public Builder deviceId(String deviceId) {
            this.deviceId = deviceId;
            return this;
        }

        public Builder settings(UplinkSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder registrationStore(RegistrationStore registrationStore) {
            this.registrationStore = registrationStore;
            return this;
        }

        public Builder clientFactory(MqttClientFactory clientFactory) {
            this.clientFactory = clientFactory;
            return this;
        }

        public Builder reconnectPolicy(ReconnectPolicy reconnectPolicy) {
            this.reconnectPolicy = reconnectPolicy;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder ackTimeout(Duration ackTimeout) {
            this.ackTimeout = ackTimeout;
            return this;
        }

        public Builder heartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        public Builder restartDelay(Duration restartDelay) {
            this.restartDelay = restartDelay;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder autoReconnect(boolean autoReconnect) {
            this.autoReconnect = autoReconnect;
            return this;
        }

        public UplinkSession build() {
            if (deviceId == null || deviceId.isEmpty()) {
                throw new IllegalArgumentException("deviceId is required");
            }
            if (settings == null || !settings.isConfigured()) {
                throw new IllegalArgumentException("Uplink settings with a broker host are required");
            }
            if (registrationStore == null) {
                throw new IllegalArgumentException("registrationStore is required");
            }
            if (heartbeatInterval.isZero() || heartbeatInterval.isNegative()) {
                throw new IllegalArgumentException("Heartbeat interval must be positive: " + heartbeatInterval);
            }
            return new UplinkSession(this);
        }
    }
}
