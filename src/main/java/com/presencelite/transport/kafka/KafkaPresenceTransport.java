package com.presencelite.transport.kafka;

import com.presencelite.channel.PresenceTransport;
import com.presencelite.channel.TransportException;
import com.presencelite.engine.Subscription;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Presence channel carried on a Kafka topic. Sends are handed to the producer
 * without waiting for acks; a dedicated thread polls the topic and passes each
 * record value to the subscribers.
 */
public class KafkaPresenceTransport implements PresenceTransport {

    private static final Logger log = LoggerFactory.getLogger(KafkaPresenceTransport.class);

    private final Producer<String, byte[]> producer;
    private final org.apache.kafka.clients.consumer.Consumer<String, byte[]> consumer;
    private final String topic;
    private final String channelId;
    private final Duration pollTimeout;
    private final List<Consumer<byte[]>> receivers = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private Thread pollThread;

    public KafkaPresenceTransport(Producer<String, byte[]> producer,
                                  org.apache.kafka.clients.consumer.Consumer<String, byte[]> consumer,
                                  String topic,
                                  String channelId,
                                  Duration pollTimeout) {
        this.producer = producer;
        this.consumer = consumer;
        this.topic = topic;
        this.channelId = channelId;
        this.pollTimeout = pollTimeout;
    }

    public static KafkaPresenceTransport create(KafkaTransportConfig config, String channelId, String nodeId) {
        return new KafkaPresenceTransport(
            new KafkaProducer<>(config.producerProperties()),
            new KafkaConsumer<>(config.consumerProperties(nodeId)),
            config.topicFor(channelId),
            channelId,
            Duration.ofMillis(config.pollTimeoutMs()));
    }

    public String topic() {
        return topic;
    }

    @Override
    public void send(byte[] broadcast) throws TransportException {
        if (closed.get()) {
            throw new TransportException("Kafka transport for " + topic + " is closed");
        }
        // Keyed by channel so a channel never spans partitions
        var record = new ProducerRecord<>(topic, channelId, broadcast);
        try {
            producer.send(record, (metadata, exception) -> {
                if (exception != null) {
                    log.warn("Presence record to {} failed: {}", topic, exception.getMessage());
                }
            });
        } catch (KafkaException | IllegalStateException e) {
            throw new TransportException("Failed to hand broadcast to Kafka producer for " + topic, e);
        }
    }

    @Override
    public Subscription subscribe(Consumer<byte[]> receiver) {
        if (closed.get()) {
            throw new IllegalStateException("Kafka transport for " + topic + " is closed");
        }
        receivers.add(receiver);
        startPolling();
        return () -> receivers.remove(receiver);
    }

    private synchronized void startPolling() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        pollThread = new Thread(this::pollLoop, "presence-poll-" + channelId);
        pollThread.setDaemon(true);
        pollThread.start();
    }

    private void pollLoop() {
        try {
            consumer.subscribe(List.of(topic));
            log.info("Polling presence topic {}", topic);
            while (running.get()) {
                var records = consumer.poll(pollTimeout);
                for (ConsumerRecord<String, byte[]> record : records) {
                    deliver(record);
                }
            }
        } catch (WakeupException e) {
            if (running.get()) {
                log.error("Unexpected wakeup polling {}", topic, e);
            }
        } catch (RuntimeException e) {
            log.error("Presence poll loop for {} died", topic, e);
        } finally {
            consumer.close();
            log.info("Stopped polling presence topic {}", topic);
        }
    }

    private void deliver(ConsumerRecord<String, byte[]> record) {
        if (record.value() == null) {
            return;
        }
        for (var receiver : receivers) {
            try {
                receiver.accept(record.value());
            } catch (RuntimeException e) {
                log.error("Presence receiver failed at offset {}", record.offset(), e);
            }
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        Thread thread;
        synchronized (this) {
            thread = pollThread;
        }
        if (running.getAndSet(false)) {
            consumer.wakeup();
            try {
                thread.join(Duration.ofSeconds(5).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        } else {
            consumer.close();
        }
        receivers.clear();
        producer.close(Duration.ofSeconds(5));
    }
}
