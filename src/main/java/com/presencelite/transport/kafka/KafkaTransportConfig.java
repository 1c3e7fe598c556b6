package com.presencelite.transport.kafka;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;

import java.util.Properties;

/**
 * Kafka settings for presence channels. Each channel is one single-partition
 * topic so broadcasts stay in order; every node reads it with its own
 * consumer group, so every node sees every broadcast.
 *
 * @param autoOffsetReset where a new node starts reading; {@code latest} skips
 *                        broadcasts sent before it joined
 */
public record KafkaTransportConfig(
    String bootstrapServers,
    String topicPrefix,
    long pollTimeoutMs,
    long retentionMs,
    short replicationFactor,
    String autoOffsetReset
) {
    public static final String DEFAULT_TOPIC_PREFIX = "presence.";
    public static final long DEFAULT_POLL_TIMEOUT_MS = 500;
    // Presence is ephemeral: nothing older than a few TTLs is useful
    public static final long DEFAULT_RETENTION_MS = 10 * 60 * 1000;

    public KafkaTransportConfig {
        if (bootstrapServers == null || bootstrapServers.isBlank()) {
            throw new IllegalArgumentException("bootstrapServers must not be blank");
        }
        if (topicPrefix == null) {
            topicPrefix = DEFAULT_TOPIC_PREFIX;
        }
        if (pollTimeoutMs <= 0) {
            throw new IllegalArgumentException("pollTimeoutMs must be positive, got " + pollTimeoutMs);
        }
        if (!"latest".equals(autoOffsetReset) && !"earliest".equals(autoOffsetReset)) {
            throw new IllegalArgumentException("autoOffsetReset must be 'latest' or 'earliest', got " + autoOffsetReset);
        }
    }

    public static KafkaTransportConfig defaults(String bootstrapServers) {
        return new KafkaTransportConfig(bootstrapServers, DEFAULT_TOPIC_PREFIX, DEFAULT_POLL_TIMEOUT_MS,
            DEFAULT_RETENTION_MS, (short) 1, "latest");
    }

    public String topicFor(String channelId) {
        return topicPrefix + channelId;
    }

    public Properties producerProperties() {
        var props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
        // Presence is fire-and-forget; the next tick repairs a lost broadcast
        props.put(ProducerConfig.ACKS_CONFIG, "1");
        props.put(ProducerConfig.LINGER_MS_CONFIG, "5");
        props.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, "lz4");
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, "2000");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, false);
        return props;
    }

    public Properties consumerProperties(String nodeId) {
        var props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "presence-node-" + nodeId);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, autoOffsetReset);
        // Offsets do not matter: a restarted node rebuilds state from live traffic
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, true);
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 500);
        return props;
    }
}
