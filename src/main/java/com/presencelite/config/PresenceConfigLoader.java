package com.presencelite.config;

import com.presencelite.crypto.Ed25519Signer;
import com.presencelite.crypto.IdentityKeyFile;
import com.presencelite.engine.PresenceConfig;
import com.presencelite.model.DeviceType;
import com.presencelite.model.TrustTier;
import com.presencelite.transport.kafka.KafkaTransportConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Resolves node settings from, lowest precedence first: {@code presence.properties}
 * on the classpath, an optional external properties file, the
 * {@code KAFKA_BOOTSTRAP_SERVERS} environment variable and {@code presence.*}
 * system properties.
 */
public final class PresenceConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(PresenceConfigLoader.class);

    public static final String CLASSPATH_RESOURCE = "presence.properties";
    public static final String PREFIX = "presence.";
    public static final String BOOTSTRAP_ENV = "KAFKA_BOOTSTRAP_SERVERS";

    public static final String CHANNEL_ID = "presence.channel-id";
    public static final String DISPLAY_NAME = "presence.display-name";
    public static final String COLOR = "presence.color";
    public static final String DEVICE_TYPE = "presence.device-type";
    public static final String UPDATE_INTERVAL_MS = "presence.update-interval-ms";
    public static final String LOCATION_THROTTLE_MS = "presence.location-throttle-ms";
    public static final String TTL_SECONDS = "presence.ttl-seconds";
    public static final String SHARE_BY_DEFAULT = "presence.share-location-by-default";
    public static final String PUBLIC_PRECISION = "presence.public-precision";

    public static final String TRANSPORT = "presence.transport";
    public static final String KAFKA_BOOTSTRAP = "presence.kafka.bootstrap-servers";
    public static final String KAFKA_TOPIC_PREFIX = "presence.kafka.topic-prefix";
    public static final String KAFKA_POLL_TIMEOUT_MS = "presence.kafka.poll-timeout-ms";
    public static final String KAFKA_RETENTION_MS = "presence.kafka.retention-ms";
    public static final String KAFKA_REPLICATION = "presence.kafka.replication-factor";
    public static final String KAFKA_OFFSET_RESET = "presence.kafka.auto-offset-reset";

    public static final String STATUS_PORT = "presence.status.port";

    /** {@code watch} tracks continuously; {@code once} shares a single captured position. */
    public static final String LOCATION_MODE = "presence.location-mode";

    /** Ed25519 key pair file; created on first start. Blank means a fresh identity per run. */
    public static final String IDENTITY_KEY_FILE = "presence.identity-key-file";

    /** Prefix for initial trust entries: {@code presence.trust.<identity>=friends}. */
    public static final String TRUST_PREFIX = "presence.trust.";

    public static final String SIM_LATITUDE = "presence.sim.start-latitude";
    public static final String SIM_LONGITUDE = "presence.sim.start-longitude";
    public static final String SIM_INTERVAL_MS = "presence.sim.interval-ms";
    public static final String SIM_SEED = "presence.sim.seed";
    public static final String SIM_PERMISSION_GRANTED = "presence.sim.permission-granted";

    private PresenceConfigLoader() {
    }

    /**
     * @param externalFile optional file overlaid on the classpath defaults; may be null
     */
    public static Properties load(Path externalFile) {
        return load(externalFile, System.getenv(), System.getProperties());
    }

    static Properties load(Path externalFile, Map<String, String> env, Properties systemProperties) {
        var props = new Properties();
        try (InputStream in = PresenceConfigLoader.class.getClassLoader().getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in != null) {
                props.load(in);
            } else {
                log.warn("No {} on the classpath, using built-in defaults", CLASSPATH_RESOURCE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read classpath " + CLASSPATH_RESOURCE, e);
        }
        if (externalFile != null) {
            try (InputStream in = Files.newInputStream(externalFile)) {
                props.load(in);
                log.info("Loaded presence configuration from {}", externalFile);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read configuration file " + externalFile, e);
            }
        }
        String bootstrap = env.get(BOOTSTRAP_ENV);
        if (bootstrap != null && !bootstrap.isBlank()) {
            props.setProperty(KAFKA_BOOTSTRAP, bootstrap);
        }
        for (String name : systemProperties.stringPropertyNames()) {
            if (name.startsWith(PREFIX)) {
                props.setProperty(name, systemProperties.getProperty(name));
            }
        }
        return props;
    }

    public static PresenceConfig presenceConfig(Properties props) {
        String channelId = props.getProperty(CHANNEL_ID);
        if (channelId == null || channelId.isBlank()) {
            throw new IllegalStateException(CHANNEL_ID + " is required");
        }
        return PresenceConfig.builder(channelId.trim())
            .displayName(blankToNull(props.getProperty(DISPLAY_NAME)))
            .color(blankToNull(props.getProperty(COLOR)))
            .deviceType(deviceType(props.getProperty(DEVICE_TYPE)))
            .updateIntervalMs(longValue(props, UPDATE_INTERVAL_MS, PresenceConfig.DEFAULT_UPDATE_INTERVAL_MS))
            .locationThrottleMs(longValue(props, LOCATION_THROTTLE_MS, PresenceConfig.DEFAULT_LOCATION_THROTTLE_MS))
            .presenceTtlSeconds(intValue(props, TTL_SECONDS, PresenceConfig.DEFAULT_PRESENCE_TTL_SECONDS))
            .shareLocationByDefault(Boolean.parseBoolean(props.getProperty(SHARE_BY_DEFAULT, "false").trim()))
            .defaultPublicPrecision(intValue(props, PUBLIC_PRECISION, PresenceConfig.DEFAULT_PUBLIC_PRECISION))
            .build();
    }

    public static KafkaTransportConfig kafkaConfig(Properties props) {
        String bootstrap = props.getProperty(KAFKA_BOOTSTRAP, "localhost:9092").trim();
        return new KafkaTransportConfig(
            bootstrap,
            props.getProperty(KAFKA_TOPIC_PREFIX, KafkaTransportConfig.DEFAULT_TOPIC_PREFIX).trim(),
            longValue(props, KAFKA_POLL_TIMEOUT_MS, KafkaTransportConfig.DEFAULT_POLL_TIMEOUT_MS),
            longValue(props, KAFKA_RETENTION_MS, KafkaTransportConfig.DEFAULT_RETENTION_MS),
            (short) intValue(props, KAFKA_REPLICATION, 1),
            props.getProperty(KAFKA_OFFSET_RESET, "latest").trim());
    }

    /**
     * The node's signer: loaded from {@link #IDENTITY_KEY_FILE}, created there
     * on first use, or generated for this run only when no file is configured.
     */
    public static Ed25519Signer identity(Properties props) {
        String keyFile = blankToNull(props.getProperty(IDENTITY_KEY_FILE));
        if (keyFile == null) {
            log.warn("{} not set; using a temporary identity that peers' trust entries cannot match", IDENTITY_KEY_FILE);
            return Ed25519Signer.generate();
        }
        return IdentityKeyFile.loadOrCreate(Path.of(keyFile));
    }

    public static Map<String, TrustTier> trustEntries(Properties props) {
        var entries = new LinkedHashMap<String, TrustTier>();
        for (String name : props.stringPropertyNames()) {
            if (name.startsWith(TRUST_PREFIX) && name.length() > TRUST_PREFIX.length()) {
                String identity = name.substring(TRUST_PREFIX.length());
                try {
                    entries.put(identity, TrustTier.fromWireName(props.getProperty(name).trim()));
                } catch (IllegalArgumentException e) {
                    throw new IllegalStateException(name + ": " + e.getMessage(), e);
                }
            }
        }
        return entries;
    }

    public static int intValue(Properties props, String key, int defaultValue) {
        return (int) longValue(props, key, defaultValue);
    }

    public static long longValue(Properties props, String key, long defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException(key + " must be a number, got '" + raw + "'", e);
        }
    }

    public static double doubleValue(Properties props, String key, double defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException(key + " must be a number, got '" + raw + "'", e);
        }
    }

    private static DeviceType deviceType(String raw) {
        if (raw == null || raw.isBlank()) {
            return DeviceType.UNKNOWN;
        }
        try {
            return DeviceType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(DEVICE_TYPE + " must be one of mobile, desktop, tablet, unknown; got '" + raw + "'", e);
        }
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
