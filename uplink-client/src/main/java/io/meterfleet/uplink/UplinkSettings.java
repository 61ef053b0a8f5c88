package io.meterfleet.uplink;

import org.json.JSONObject;

/**
 * Process-wide uplink configuration as stored in the uplink settings file. Missing keys fall
 * back to the defaults below; unknown keys are ignored.
 */
public class UplinkSettings {

    public static final int DEFAULT_PORT = 1883;
    public static final int DEFAULT_SSL_PORT = 8883;
    public static final String DEFAULT_DEVICE_PREFIX = "iot_sim_";

    private boolean enabled = false;
    private String brokerHost = "";
    private int brokerPort = DEFAULT_PORT;
    private String username = "";
    private String password = "";
    private String tenant = "";
    private boolean useSsl = false;
    private String caCertPath = "";
    private String clientCertPath = "";
    private String clientKeyPath = "";
    private String clientKeyPassword = "";
    private String devicePrefix = DEFAULT_DEVICE_PREFIX;

    public static UplinkSettings defaults() {
        return new UplinkSettings();
    }

    public static UplinkSettings fromJson(JSONObject json) {
        UplinkSettings settings = new UplinkSettings();
        settings.enabled = json.optBoolean("enabled", settings.enabled);
        settings.brokerHost = json.optString("broker_host", settings.brokerHost);
        settings.brokerPort = json.optInt("broker_port", settings.brokerPort);
        settings.username = json.optString("username", settings.username);
        settings.password = json.optString("password", settings.password);
        settings.tenant = json.optString("tenant", settings.tenant);
        settings.useSsl = json.optBoolean("use_ssl", settings.useSsl);
        settings.caCertPath = json.optString("ca_cert_path", settings.caCertPath);
        settings.clientCertPath = json.optString("client_cert_path", settings.clientCertPath);
        settings.clientKeyPath = json.optString("client_key_path", settings.clientKeyPath);
        settings.clientKeyPassword = json.optString("client_key_password", settings.clientKeyPassword);
        settings.devicePrefix = json.optString("device_prefix", settings.devicePrefix);
        return settings;
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("enabled", enabled);
        json.put("broker_host", brokerHost);
        json.put("broker_port", brokerPort);
        json.put("username", username);
        json.put("password", password);
        json.put("tenant", tenant);
        json.put("use_ssl", useSsl);
        json.put("ca_cert_path", caCertPath);
        json.put("client_cert_path", clientCertPath);
        json.put("client_key_path", clientKeyPath);
        json.put("client_key_password", clientKeyPassword);
        json.put("device_prefix", devicePrefix);
        return json;
    }

    /**
     * TLS on the plain default port means the platform's TLS port.
     */
    public int getEffectivePort() {
        if (useSsl && brokerPort == DEFAULT_PORT) {
            return DEFAULT_SSL_PORT;
        }
        return brokerPort;
    }

    public String getServerUri() {
        return (useSsl ? "ssl://" : "tcp://") + brokerHost + ":" + getEffectivePort();
    }

    /**
     * The platform expects {@code <tenant>/<user>} as MQTT user name.
     */
    public String getQualifiedUsername() {
        if (tenant == null || tenant.isBlank()) {
            return username;
        }
        return tenant + "/" + username;
    }

    public boolean hasCredentials() {
        return username != null && !username.isBlank();
    }

    public boolean isConfigured() {
        return brokerHost != null && !brokerHost.isBlank();
    }

    public String deviceName(String deviceId) {
        return devicePrefix + deviceId;
    }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getBrokerHost() { return brokerHost; }
    public void setBrokerHost(String brokerHost) { this.brokerHost = brokerHost; }

    public int getBrokerPort() { return brokerPort; }
    public void setBrokerPort(int brokerPort) { this.brokerPort = brokerPort; }

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }

    public String getTenant() { return tenant; }
    public void setTenant(String tenant) { this.tenant = tenant; }

    public boolean isUseSsl() { return useSsl; }
    public void setUseSsl(boolean useSsl) { this.useSsl = useSsl; }

    public String getCaCertPath() { return caCertPath; }
    public void setCaCertPath(String caCertPath) { this.caCertPath = caCertPath; }

    public String getClientCertPath() { return clientCertPath; }
    public void setClientCertPath(String clientCertPath) { this.clientCertPath = clientCertPath; }

    public String getClientKeyPath() { return clientKeyPath; }
    public void setClientKeyPath(String clientKeyPath) { this.clientKeyPath = clientKeyPath; }

    public String getClientKeyPassword() { return clientKeyPassword; }
    public void setClientKeyPassword(String clientKeyPassword) { this.clientKeyPassword = clientKeyPassword; }

    public String getDevicePrefix() { return devicePrefix; }
    public void setDevicePrefix(String devicePrefix) { this.devicePrefix = devicePrefix; }

    @Override
    public String toString() {
        return "UplinkSettings{" +
                "enabled=" + enabled +
                ", broker='" + getServerUri() + '\'' +
                ", username='" + getQualifiedUsername() + '\'' +
                ", useSsl=" + useSsl +
                ", devicePrefix='" + devicePrefix + '\'' +
                '}';
    }
}
