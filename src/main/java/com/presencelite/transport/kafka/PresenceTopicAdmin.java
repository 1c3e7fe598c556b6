package com.presencelite.transport.kafka;

import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.config.TopicConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.TimeUnit;

public class PresenceTopicAdmin {

    private static final Logger log = LoggerFactory.getLogger(PresenceTopicAdmin.class);

    /** One partition keeps a channel's broadcasts in send order. */
    public static final int NUM_PARTITIONS = 1;

    private PresenceTopicAdmin() {
    }

    /**
     * Creates the channel topic with short retention unless it already exists.
     */
    public static void ensureTopic(KafkaTransportConfig config, String channelId) {
        String topic = config.topicFor(channelId);
        var props = new Properties();
        props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, config.bootstrapServers());
        props.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, "10000");

        try (var admin = AdminClient.create(props)) {
            Set<String> existing = admin.listTopics().names().get(15, TimeUnit.SECONDS);
            if (existing.contains(topic)) {
                log.info("Topic '{}' already exists", topic);
                return;
            }
            var newTopic = new NewTopic(topic, NUM_PARTITIONS, config.replicationFactor());
            newTopic.configs(Map.of(
                TopicConfig.RETENTION_MS_CONFIG, Long.toString(config.retentionMs()),
                TopicConfig.CLEANUP_POLICY_CONFIG, TopicConfig.CLEANUP_POLICY_DELETE
            ));
            admin.createTopics(List.of(newTopic)).all().get(15, TimeUnit.SECONDS);
            log.info("Created topic '{}' with retention {}ms", topic, config.retentionMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while creating topic " + topic, e);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create topic " + topic, e);
        }
    }
}
