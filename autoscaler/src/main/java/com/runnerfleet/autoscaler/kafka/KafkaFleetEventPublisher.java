package com.runnerfleet.autoscaler.kafka;

import com.runnerfleet.autoscaler.config.AutoscalerConfig;
import com.runnerfleet.core.msg.ControlMessages;
import com.runnerfleet.core.msg.Topics;
import com.runnerfleet.core.util.JsonUtils;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.TopicExistsException;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderOptions;
import reactor.kafka.sender.SenderRecord;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Publishes control events as JSON with reactor-kafka, keyed by fleet name so the events
 * of one fleet stay ordered within a partition.
 */
public class KafkaFleetEventPublisher implements IFleetEventPublisher {
    private static final Logger log = LoggerFactory.getLogger(KafkaFleetEventPublisher.class);

    private final KafkaSender<String, String> sender;
    private final AdminClient adminClient;

    public KafkaFleetEventPublisher(AutoscalerConfig config) {
        Map<String, Object> producerProps = new HashMap<>();
        producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        producerProps.put(ProducerConfig.CLIENT_ID_CONFIG, config.getNodeId());
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.ACKS_CONFIG, "all");
        producerProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");

        this.sender = KafkaSender.create(SenderOptions.create(producerProps));

        Map<String, Object> adminProps = new HashMap<>();
        adminProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        this.adminClient = AdminClient.create(adminProps);

        createTopicIfNotExists(Topics.FLEET_SCALE, 4, (short) 1)
            .then(createTopicIfNotExists(Topics.FLEET_WORKERS, 4, (short) 1))
            .then(createTopicIfNotExists(Topics.FLEET_ALERTS, 1, (short) 1))
            .subscribe(v -> { }, err -> log.warn("Kafka topic setup incomplete: {}", err.getMessage()));
        log.info("Kafka fleet event publisher initialized");
    }

    @Override
    public Mono<Void> publishScaleSignal(ControlMessages.ScaleSignal scaleSignal) {
        return send(Topics.FLEET_SCALE, scaleSignal.getFleet(), JsonUtils.writeValueAsString(scaleSignal))
            .doOnSuccess(v -> log.debug("Published scale signal: fleet={}, action={}",
                scaleSignal.getFleet(), scaleSignal.getDecision().getAction()))
            .doOnError(err -> log.error("Failed to publish scale signal for {}", scaleSignal.getFleet(), err));
    }

    @Override
    public Mono<Void> publishWorkerEvent(ControlMessages.WorkerEvent workerEvent) {
        return send(Topics.FLEET_WORKERS, workerEvent.getFleet(), JsonUtils.writeValueAsString(workerEvent))
            .doOnError(err -> log.error("Failed to publish worker event for {}", workerEvent.getWorkerName(), err));
    }

    @Override
    public Mono<Void> publishFleetDegraded(ControlMessages.FleetDegraded fleetDegraded) {
        return send(Topics.FLEET_ALERTS, fleetDegraded.getFleet(), JsonUtils.writeValueAsString(fleetDegraded))
            .doOnSuccess(v -> log.info("Published degraded alert: fleet={}, rounds={}",
                fleetDegraded.getFleet(), fleetDegraded.getConsecutiveFailedRounds()))
            .doOnError(err -> log.error("Failed to publish degraded alert for {}", fleetDegraded.getFleet(), err));
    }

    private Mono<Void> send(String topic, String key, String json) {
        ProducerRecord<String, String> record = new ProducerRecord<>(topic, key, json);
        return sender.send(Mono.just(SenderRecord.create(record, null)))
            .next()
            .then();
    }

    private Mono<Void> createTopicIfNotExists(String topicName, int partitions, short replicationFactor) {
        return Mono.fromFuture(() -> adminClient.listTopics().names().toCompletionStage().toCompletableFuture())
            .flatMap(names -> {
                if (names.contains(topicName)) {
                    return Mono.empty();
                }

                return Mono.fromFuture(() -> {
                    log.info("Creating Kafka topic: {} (partitions={}, replication={})",
                        topicName, partitions, replicationFactor);

                    return adminClient.createTopics(Collections.singleton(new NewTopic(topicName, partitions, replicationFactor)))
                        .all()
                        .toCompletionStage()
                        .toCompletableFuture();
                });
            })
            .onErrorResume(error -> {
                if (error.getCause() instanceof TopicExistsException) {
                    log.info("Kafka topic already exists: {}", topicName);
                    return Mono.empty();
                }
                log.error("Failed to create Kafka topic {}: {}", topicName, error.getMessage(), error);
                return Mono.error(error);
            })
            .then();
    }

    @Override
    public void close() {
        sender.close();
        adminClient.close();
        log.info("Kafka fleet event publisher closed");
    }
}
