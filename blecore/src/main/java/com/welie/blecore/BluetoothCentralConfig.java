package com.welie.blecore;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Timeouts, registry and notification settings for a {@link BluetoothCentralManager}.
 *
 * <p>Build one with {@link #builder()} or load it from a properties file. Property keys:
 * <ul>
 *     <li>{@code blecore.connect.timeout.ms}</li>
 *     <li>{@code blecore.discovery.timeout.ms}</li>
 *     <li>{@code blecore.command.timeout.ms}</li>
 *     <li>{@code blecore.disconnect.timeout.ms}</li>
 *     <li>{@code blecore.registry.staleness.ms}</li>
 *     <li>{@code blecore.registry.prune.interval.ms}</li>
 *     <li>{@code blecore.notification.buffer.size}</li>
 *     <li>{@code blecore.scan.rssi.threshold}</li>
 *     <li>{@code blecore.scan.options} (comma separated)</li>
 *     <li>{@code blecore.reconnect.max.attempts}, {@code blecore.reconnect.initial.delay.ms},
 *     {@code blecore.reconnect.multiplier}, {@code blecore.reconnect.max.delay.ms}, {@code blecore.reconnect.jitter}</li>
 * </ul>
 * Missing keys keep their default value.
 */
public final class BluetoothCentralConfig {

    public static final long DEFAULT_CONNECT_TIMEOUT = 30000L;
    public static final long DEFAULT_DISCOVERY_TIMEOUT = 10000L;
    public static final long DEFAULT_COMMAND_TIMEOUT = 5000L;
    public static final long DEFAULT_DISCONNECT_TIMEOUT = 2000L;
    public static final long DEFAULT_STALENESS_WINDOW = 30000L;
    public static final long DEFAULT_PRUNE_INTERVAL = 5000L;
    public static final int DEFAULT_NOTIFICATION_BUFFER_SIZE = 64;
    public static final int DEFAULT_RSSI_THRESHOLD = -80;

    static final String PREFIX = "blecore.";

    private final long connectTimeoutMillis;
    private final long discoveryTimeoutMillis;
    private final long commandTimeoutMillis;
    private final long disconnectTimeoutMillis;
    private final long stalenessWindowMillis;
    private final long pruneIntervalMillis;
    private final int notificationBufferSize;
    private final int rssiThreshold;
    @NotNull
    private final Set<String> scanOptions;
    @NotNull
    private final ReconnectPolicy reconnectPolicy;

    private BluetoothCentralConfig(@NotNull Builder builder) {
        this.connectTimeoutMillis = builder.connectTimeoutMillis;
        this.discoveryTimeoutMillis = builder.discoveryTimeoutMillis;
        this.commandTimeoutMillis = builder.commandTimeoutMillis;
        this.disconnectTimeoutMillis = builder.disconnectTimeoutMillis;
        this.stalenessWindowMillis = builder.stalenessWindowMillis;
        this.pruneIntervalMillis = builder.pruneIntervalMillis;
        this.notificationBufferSize = builder.notificationBufferSize;
        this.rssiThreshold = builder.rssiThreshold;
        this.scanOptions = Collections.unmodifiableSet(new HashSet<>(builder.scanOptions));
        this.reconnectPolicy = builder.reconnectPolicy;
    }

    @NotNull
    public static BluetoothCentralConfig defaults() {
        return builder().build();
    }

    @NotNull
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Read a configuration from a properties file on the classpath.
     *
     * @param resourceName name of the resource, e.g. "blecore.properties"
     * @return the configuration
     * @throws IOException if the resource does not exist or cannot be read
     */
    @NotNull
    public static BluetoothCentralConfig load(@NotNull String resourceName) throws IOException {
        Objects.requireNonNull(resourceName, "no valid resource name provided");
        final ClassLoader classLoader = BluetoothCentralConfig.class.getClassLoader();
        try (InputStream inputStream = classLoader.getResourceAsStream(resourceName)) {
            if (inputStream == null) {
                throw new IOException(String.format("resource '%s' not found", resourceName));
            }
            final Properties properties = new Properties();
            properties.load(inputStream);
            return fromProperties(properties);
        }
    }

    @NotNull
    public static BluetoothCentralConfig fromProperties(@NotNull Properties properties) {
        Objects.requireNonNull(properties, "no valid properties provided");
        final Builder builder = builder();
        final Long connectTimeout = getLong(properties, "connect.timeout.ms");
        if (connectTimeout != null) builder.connectTimeout(connectTimeout);
        final Long discoveryTimeout = getLong(properties, "discovery.timeout.ms");
        if (discoveryTimeout != null) builder.discoveryTimeout(discoveryTimeout);
        final Long commandTimeout = getLong(properties, "command.timeout.ms");
        if (commandTimeout != null) builder.commandTimeout(commandTimeout);
        final Long disconnectTimeout = getLong(properties, "disconnect.timeout.ms");
        if (disconnectTimeout != null) builder.disconnectTimeout(disconnectTimeout);
        final Long staleness = getLong(properties, "registry.staleness.ms");
        if (staleness != null) builder.stalenessWindow(staleness);
        final Long pruneInterval = getLong(properties, "registry.prune.interval.ms");
        if (pruneInterval != null) builder.pruneInterval(pruneInterval);
        final Long bufferSize = getLong(properties, "notification.buffer.size");
        if (bufferSize != null) builder.notificationBufferSize(bufferSize.intValue());
        final Long rssiThreshold = getLong(properties, "scan.rssi.threshold");
        if (rssiThreshold != null) builder.rssiThreshold(rssiThreshold.intValue());

        final String options = properties.getProperty(PREFIX + "scan.options");
        if (options != null && !options.trim().isEmpty()) {
            for (String option : options.split(",")) {
                builder.scanOption(option.trim());
            }
        }

        final Long maxAttempts = getLong(properties, "reconnect.max.attempts");
        if (maxAttempts != null && maxAttempts > 0) {
            final Long initialDelay = getLong(properties, "reconnect.initial.delay.ms");
            final Double multiplier = getDouble(properties, "reconnect.multiplier");
            final Long maxDelay = getLong(properties, "reconnect.max.delay.ms");
            final Double jitter = getDouble(properties, "reconnect.jitter");
            final long initial = initialDelay != null ? initialDelay : 1000L;
            builder.reconnectPolicy(new ReconnectPolicy(
                    maxAttempts.intValue(),
                    initial,
                    multiplier != null ? multiplier : 2.0,
                    maxDelay != null ? maxDelay : Math.max(initial, 30000L),
                    jitter != null ? jitter : 0.0));
        }
        return builder.build();
    }

    @Nullable
    private static Long getLong(@NotNull Properties properties, @NotNull String key) {
        final String value = properties.getProperty(PREFIX + key);
        if (value == null) return null;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("invalid value '%s' for %s%s", value, PREFIX, key), e);
        }
    }

    @Nullable
    private static Double getDouble(@NotNull Properties properties, @NotNull String key) {
        final String value = properties.getProperty(PREFIX + key);
        if (value == null) return null;
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("invalid value '%s' for %s%s", value, PREFIX, key), e);
        }
    }

    public long getConnectTimeoutMillis() {
        return connectTimeoutMillis;
    }

    public long getDiscoveryTimeoutMillis() {
        return discoveryTimeoutMillis;
    }

    public long getCommandTimeoutMillis() {
        return commandTimeoutMillis;
    }

    public long getDisconnectTimeoutMillis() {
        return disconnectTimeoutMillis;
    }

    public long getStalenessWindowMillis() {
        return stalenessWindowMillis;
    }

    public long getPruneIntervalMillis() {
        return pruneIntervalMillis;
    }

    public int getNotificationBufferSize() {
        return notificationBufferSize;
    }

    public int getRssiThreshold() {
        return rssiThreshold;
    }

    public @NotNull Set<String> getScanOptions() {
        return scanOptions;
    }

    public @NotNull ReconnectPolicy getReconnectPolicy() {
        return reconnectPolicy;
    }

    @Override
    public String toString() {
        return "BluetoothCentralConfig{" +
                "connectTimeout=" + connectTimeoutMillis +
                ", discoveryTimeout=" + discoveryTimeoutMillis +
                ", commandTimeout=" + commandTimeoutMillis +
                ", disconnectTimeout=" + disconnectTimeoutMillis +
                ", staleness=" + stalenessWindowMillis +
                ", pruneInterval=" + pruneIntervalMillis +
                ", notificationBufferSize=" + notificationBufferSize +
                ", rssiThreshold=" + rssiThreshold +
                ", scanOptions=" + scanOptions +
                ", reconnectPolicy=" + reconnectPolicy +
                '}';
    }

    public static final class Builder {
        private long connectTimeoutMillis = DEFAULT_CONNECT_TIMEOUT;
        private long discoveryTimeoutMillis = DEFAULT_DISCOVERY_TIMEOUT;
        private long commandTimeoutMillis = DEFAULT_COMMAND_TIMEOUT;
        private long disconnectTimeoutMillis = DEFAULT_DISCONNECT_TIMEOUT;
        private long stalenessWindowMillis = DEFAULT_STALENESS_WINDOW;
        private long pruneIntervalMillis = DEFAULT_PRUNE_INTERVAL;
        private int notificationBufferSize = DEFAULT_NOTIFICATION_BUFFER_SIZE;
        private int rssiThreshold = DEFAULT_RSSI_THRESHOLD;
        private final Set<String> scanOptions = new HashSet<>();
        private ReconnectPolicy reconnectPolicy = ReconnectPolicy.NONE;

        private Builder() {
        }

        public Builder connectTimeout(long millis) {
            this.connectTimeoutMillis = requirePositive(millis, "connect timeout");
            return this;
        }

        public Builder discoveryTimeout(long millis) {
            this.discoveryTimeoutMillis = requirePositive(millis, "discovery timeout");
            return this;
        }

        public Builder commandTimeout(long millis) {
            this.commandTimeoutMillis = requirePositive(millis, "command timeout");
            return this;
        }

        public Builder disconnectTimeout(long millis) {
            this.disconnectTimeoutMillis = requirePositive(millis, "disconnect timeout");
            return this;
        }

        public Builder stalenessWindow(long millis) {
            this.stalenessWindowMillis = requirePositive(millis, "staleness window");
            return this;
        }

        public Builder pruneInterval(long millis) {
            this.pruneIntervalMillis = requirePositive(millis, "prune interval");
            return this;
        }

        public Builder notificationBufferSize(int size) {
            this.notificationBufferSize = (int) requirePositive(size, "notification buffer size");
            return this;
        }

        public Builder rssiThreshold(int threshold) {
            this.rssiThreshold = checkRssiThreshold(threshold);
            return this;
        }

        public Builder scanOption(@NotNull String option) {
            Objects.requireNonNull(option, "no valid scan option provided");
            this.scanOptions.add(option);
            return this;
        }

        public Builder scanOptions(@NotNull String... options) {
            Objects.requireNonNull(options, "no valid scan options provided");
            this.scanOptions.addAll(Arrays.asList(options));
            return this;
        }

        public Builder reconnectPolicy(@NotNull ReconnectPolicy policy) {
            this.reconnectPolicy = Objects.requireNonNull(policy, "no valid reconnect policy provided");
            return this;
        }

        @NotNull
        public BluetoothCentralConfig build() {
            return new BluetoothCentralConfig(this);
        }

        private static long requirePositive(long value, @NotNull String what) {
            if (value <= 0) {
                throw new IllegalArgumentException(String.format("%s must be positive", what));
            }
            return value;
        }
    }

    static int checkRssiThreshold(int threshold) {
        if (threshold < -127 || threshold > 20) {
            throw new IllegalArgumentException(String.format("rssi threshold %d out of range", threshold));
        }
        return threshold;
    }
}
