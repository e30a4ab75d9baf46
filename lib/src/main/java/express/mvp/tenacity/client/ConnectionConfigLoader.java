package express.mvp.tenacity.client;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import express.mvp.tenacity.client.error.BackoffStrategy;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Reads and writes {@link ConnectionConfig} as JSON.
 *
 * <p>Keys are the option names with a unit suffix for sizes and durations:
 *
 * <pre>{@code
 * {
 *   "ServerAddress": "tcp://127.0.0.1:4000",
 *   "ConnectTimeoutMs": 5000,
 *   "MaxRetryAttempts": 3,
 *   "RetryBaseDelayMs": 1000,
 *   "BackoffStrategy": "Linear",
 *   "KeepaliveIntervalMs": 30000,
 *   "ReconnectDelayMs": 5000,
 *   "CompressionThresholdBytes": 512,
 *   "MaxFrameSizeBytes": 4194304,
 *   "EnableJitter": false
 * }
 * }</pre>
 *
 * <p>Missing keys keep their defaults. Unknown keys are logged and ignored. Wrong value types
 * raise {@link ConfigurationException}.
 */
public final class ConnectionConfigLoader {

    private static final Logger LOGGER = Logger.getLogger(ConnectionConfigLoader.class.getName());

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private static final Set<String> KNOWN_KEYS = Set.of(
            "ClientName",
            "ServerAddress",
            "ConnectTimeoutMs",
            "MaxRetryAttempts",
            "RetryBaseDelayMs",
            "BackoffStrategy",
            "MaxRetryDelayMs",
            "EnableJitter",
            "KeepaliveIntervalMs",
            "EnableKeepalive",
            "ReconnectDelayMs",
            "EnableAutoReconnect",
            "ProbeTimeoutMs",
            "HeartbeatAckRequired",
            "CompressionThresholdBytes",
            "EnableCompression",
            "MaxFrameSizeBytes",
            "SendQueueCapacity",
            "DisconnectTimeoutMs",
            "GracefulCloseTimeoutMs",
            "ReadPollIntervalMs");

    private ConnectionConfigLoader() {
        // Utility class
    }

    /**
     * Loads a configuration file.
     *
     * @param file path of a UTF-8 JSON file
     * @return the configuration
     * @throws ConfigurationException if the file cannot be read or holds invalid settings
     */
    public static ConnectionConfig load(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(GSON.fromJson(reader, JsonObject.class), file.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration file " + file, e);
        } catch (JsonParseException e) {
            throw new ConfigurationException("Malformed JSON in " + file, e);
        }
    }

    /**
     * Parses a configuration from JSON text.
     *
     * @param json the JSON document
     * @return the configuration
     * @throws ConfigurationException if the document holds invalid settings
     */
    public static ConnectionConfig fromJson(String json) {
        try {
            return parse(GSON.fromJson(json, JsonObject.class), "<string>");
        } catch (JsonParseException e) {
            throw new ConfigurationException("Malformed configuration JSON", e);
        }
    }

    /**
     * Writes a configuration as pretty-printed JSON.
     *
     * @param config the configuration
     * @return the JSON document
     */
    public static String toJson(ConnectionConfig config) {
        JsonObject json = new JsonObject();
        json.addProperty("ClientName", config.clientName());
        json.addProperty("ServerAddress", config.serverAddress().toString());
        json.addProperty("ConnectTimeoutMs", config.connectTimeout().toMillis());
        json.addProperty("MaxRetryAttempts", config.maxRetryAttempts());
        json.addProperty("RetryBaseDelayMs", config.retryBaseDelay().toMillis());
        json.addProperty("BackoffStrategy", displayName(config.backoffStrategy()));
        json.addProperty("MaxRetryDelayMs", config.maxRetryDelay().toMillis());
        json.addProperty("EnableJitter", config.enableJitter());
        json.addProperty("KeepaliveIntervalMs", config.keepaliveInterval().toMillis());
        json.addProperty("EnableKeepalive", config.enableKeepalive());
        json.addProperty("ReconnectDelayMs", config.reconnectDelay().toMillis());
        json.addProperty("EnableAutoReconnect", config.enableAutoReconnect());
        json.addProperty("ProbeTimeoutMs", config.probeTimeout().toMillis());
        json.addProperty("HeartbeatAckRequired", config.heartbeatAckRequired());
        json.addProperty("CompressionThresholdBytes", config.compressionThreshold());
        json.addProperty("EnableCompression", config.compressionEnabled());
        json.addProperty("MaxFrameSizeBytes", config.maxFrameSize());
        json.addProperty("SendQueueCapacity", config.sendQueueCapacity());
        json.addProperty("DisconnectTimeoutMs", config.disconnectTimeout().toMillis());
        json.addProperty("GracefulCloseTimeoutMs", config.gracefulCloseTimeout().toMillis());
        json.addProperty("ReadPollIntervalMs", config.readPollInterval().toMillis());
        return GSON.toJson(json);
    }

    private static ConnectionConfig parse(JsonObject json, String source) {
        if (json == null) {
            throw new ConfigurationException("Empty configuration in " + source);
        }
        for (Map.Entry<String, JsonElement> entry : json.entrySet()) {
            if (!KNOWN_KEYS.contains(entry.getKey())) {
                LOGGER.warning("Ignoring unknown configuration key '" + entry.getKey()
                        + "' in " + source);
            }
        }
        ConnectionConfig.Builder builder = ConnectionConfig.builder();
        try {
            if (json.has("ClientName")) {
                builder.clientName(json.get("ClientName").getAsString());
            }
            if (json.has("ServerAddress")) {
                builder.serverAddress(json.get("ServerAddress").getAsString());
            }
            if (json.has("ConnectTimeoutMs")) {
                builder.connectTimeout(millis(json, "ConnectTimeoutMs"));
            }
            if (json.has("MaxRetryAttempts")) {
                builder.maxRetryAttempts(json.get("MaxRetryAttempts").getAsInt());
            }
            if (json.has("RetryBaseDelayMs")) {
                builder.retryBaseDelay(millis(json, "RetryBaseDelayMs"));
            }
            if (json.has("BackoffStrategy")) {
                builder.backoffStrategy(strategy(json.get("BackoffStrategy").getAsString()));
            }
            if (json.has("MaxRetryDelayMs")) {
                builder.maxRetryDelay(millis(json, "MaxRetryDelayMs"));
            }
            if (json.has("EnableJitter")) {
                builder.enableJitter(json.get("EnableJitter").getAsBoolean());
            }
            if (json.has("KeepaliveIntervalMs")) {
                builder.keepaliveInterval(millis(json, "KeepaliveIntervalMs"));
            }
            if (json.has("EnableKeepalive")) {
                builder.enableKeepalive(json.get("EnableKeepalive").getAsBoolean());
            }
            if (json.has("ReconnectDelayMs")) {
                builder.reconnectDelay(millis(json, "ReconnectDelayMs"));
            }
            if (json.has("EnableAutoReconnect")) {
                builder.enableAutoReconnect(json.get("EnableAutoReconnect").getAsBoolean());
            }
            if (json.has("ProbeTimeoutMs")) {
                builder.probeTimeout(millis(json, "ProbeTimeoutMs"));
            }
            if (json.has("HeartbeatAckRequired")) {
                builder.heartbeatAckRequired(json.get("HeartbeatAckRequired").getAsBoolean());
            }
            if (json.has("CompressionThresholdBytes")) {
                builder.compressionThreshold(json.get("CompressionThresholdBytes").getAsInt());
            }
            if (json.has("EnableCompression")) {
                builder.compressionEnabled(json.get("EnableCompression").getAsBoolean());
            }
            if (json.has("MaxFrameSizeBytes")) {
                builder.maxFrameSize(json.get("MaxFrameSizeBytes").getAsInt());
            }
            if (json.has("SendQueueCapacity")) {
                builder.sendQueueCapacity(json.get("SendQueueCapacity").getAsInt());
            }
            if (json.has("DisconnectTimeoutMs")) {
                builder.disconnectTimeout(millis(json, "DisconnectTimeoutMs"));
            }
            if (json.has("GracefulCloseTimeoutMs")) {
                builder.gracefulCloseTimeout(millis(json, "GracefulCloseTimeoutMs"));
            }
            if (json.has("ReadPollIntervalMs")) {
                builder.readPollInterval(millis(json, "ReadPollIntervalMs"));
            }
        } catch (UnsupportedOperationException | IllegalStateException | NumberFormatException e) {
            throw new ConfigurationException("Invalid value type in " + source + ": " + e.getMessage(), e);
        }
        return builder.build();
    }

    private static Duration millis(JsonObject json, String key) {
        return Duration.ofMillis(json.get(key).getAsLong());
    }

    private static BackoffStrategy strategy(String value) {
        try {
            return BackoffStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(
                    "Unknown BackoffStrategy '" + value + "', expected Linear or Exponential", e);
        }
    }

    private static String displayName(BackoffStrategy strategy) {
        String name = strategy.name();
        return name.charAt(0) + name.substring(1).toLowerCase(Locale.ROOT);
    }
}
