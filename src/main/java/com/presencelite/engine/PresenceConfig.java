package com.presencelite.engine;

import com.presencelite.model.DeviceType;
import com.presencelite.model.TrustTier;
import com.presencelite.policy.PrecisionPolicy;

/**
 * Settings for one presence node.
 *
 * @param channelId              shared space the node joins; also names the Kafka topic
 * @param updateIntervalMs       periodic self-broadcast cadence
 * @param locationThrottleMs     minimum gap between location-triggered broadcasts
 * @param presenceTtlSeconds     TTL stamped on every outgoing broadcast
 * @param defaultPublicPrecision characters disclosed to public-tier viewers, from 1 up to
 *                               {@code PrecisionPolicy.precisionFor(PUBLIC)}
 */
public record PresenceConfig(
    String channelId,
    String displayName,
    String color,
    DeviceType deviceType,
    long updateIntervalMs,
    long locationThrottleMs,
    int presenceTtlSeconds,
    boolean shareLocationByDefault,
    int defaultPublicPrecision
) {
    public static final long DEFAULT_UPDATE_INTERVAL_MS = 5_000;
    public static final long DEFAULT_LOCATION_THROTTLE_MS = 1_000;
    public static final int DEFAULT_PRESENCE_TTL_SECONDS = 60;
    public static final int DEFAULT_PUBLIC_PRECISION = 2;

    public PresenceConfig {
        if (channelId == null || channelId.isBlank()) {
            throw new IllegalArgumentException("channelId must not be blank");
        }
        if (!channelId.matches("[A-Za-z0-9._-]+")) {
            throw new IllegalArgumentException("channelId may only contain letters, digits, '.', '_' and '-': " + channelId);
        }
        if (updateIntervalMs <= 0) {
            throw new IllegalArgumentException("updateIntervalMs must be positive, got " + updateIntervalMs);
        }
        if (locationThrottleMs < 0) {
            throw new IllegalArgumentException("locationThrottleMs must not be negative, got " + locationThrottleMs);
        }
        if (presenceTtlSeconds <= 0) {
            throw new IllegalArgumentException("presenceTtlSeconds must be positive, got " + presenceTtlSeconds);
        }
        int publicCeiling = PrecisionPolicy.precisionFor(TrustTier.PUBLIC);
        if (defaultPublicPrecision < PrecisionPolicy.MIN_PRECISION || defaultPublicPrecision > publicCeiling) {
            throw new IllegalArgumentException("defaultPublicPrecision must be between "
                + PrecisionPolicy.MIN_PRECISION + " and " + publicCeiling + ", got " + defaultPublicPrecision);
        }
        if (deviceType == null) {
            deviceType = DeviceType.UNKNOWN;
        }
    }

    public static Builder builder(String channelId) {
        return new Builder(channelId);
    }

    public static final class Builder {
        private final String channelId;
        private String displayName;
        private String color;
        private DeviceType deviceType = DeviceType.UNKNOWN;
        private long updateIntervalMs = DEFAULT_UPDATE_INTERVAL_MS;
        private long locationThrottleMs = DEFAULT_LOCATION_THROTTLE_MS;
        private int presenceTtlSeconds = DEFAULT_PRESENCE_TTL_SECONDS;
        private boolean shareLocationByDefault;
        private int defaultPublicPrecision = DEFAULT_PUBLIC_PRECISION;

        private Builder(String channelId) {
            this.channelId = channelId;
        }

        public Builder displayName(String displayName) { this.displayName = displayName; return this; }
        public Builder color(String color) { this.color = color; return this; }
        public Builder deviceType(DeviceType deviceType) { this.deviceType = deviceType; return this; }
        public Builder updateIntervalMs(long ms) { this.updateIntervalMs = ms; return this; }
        public Builder locationThrottleMs(long ms) { this.locationThrottleMs = ms; return this; }
        public Builder presenceTtlSeconds(int seconds) { this.presenceTtlSeconds = seconds; return this; }
        public Builder shareLocationByDefault(boolean share) { this.shareLocationByDefault = share; return this; }
        public Builder defaultPublicPrecision(int precision) { this.defaultPublicPrecision = precision; return this; }

        public PresenceConfig build() {
            return new PresenceConfig(channelId, displayName, color, deviceType, updateIntervalMs,
                locationThrottleMs, presenceTtlSeconds, shareLocationByDefault, defaultPublicPrecision);
        }
    }
}
