package com.example.tenantsync.event;

import com.example.tenantsync.dto.DeadLetterEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes dead-letter entries for permanently failed sync and event-processing runs.
 *
 * Topic: tenant-sync.dlq (keyed by tenant id). Unlike ordinary event publishing the send is
 * awaited, so a broker failure fails the publishing activity and Temporal retries it.
 * With Kafka disabled the entry is only logged.
 */
@Slf4j
@Component
public class DeadLetterPublisher {

    private final KafkaTemplate<String, DeadLetterEntry> kafkaTemplate;
    private final String topic;
    private final boolean kafkaEnabled;
    private final Duration sendTimeout;

    public DeadLetterPublisher(KafkaTemplate<String, DeadLetterEntry> kafkaTemplate,
                               @Value("${tenant-sync.dead-letter.topic:tenant-sync.dlq}") String topic,
                               @Value("${tenant-sync.dead-letter.kafka-enabled:true}") boolean kafkaEnabled,
                               @Value("${tenant-sync.dead-letter.send-timeout:10s}") Duration sendTimeout) {
        this.kafkaTemplate = kafkaTemplate;
        this.topic = topic;
        this.kafkaEnabled = kafkaEnabled;
        this.sendTimeout = sendTimeout;
    }

    public void publish(DeadLetterEntry entry) {
        String key = entry.getTenantId() != null ? entry.getTenantId() : "unknown";
        log.error("Dead letter: workflowType={}, workflowId={}, tenantId={}, error={}",
                entry.getWorkflowType(), entry.getWorkflowId(), key,
                entry.getError() != null ? entry.getError().getMessage() : null);

        if (!kafkaEnabled) {
            log.warn("Kafka disabled, dead letter not published: workflowId={}", entry.getWorkflowId());
            return;
        }

        try {
            kafkaTemplate.send(topic, key, entry)
                    .whenComplete((result, ex) -> {
                        if (ex == null) {
                            log.info("Dead letter published: topic={}, workflowId={}", topic, entry.getWorkflowId());
                        } else {
                            log.error("Failed to publish dead letter: workflowId={}", entry.getWorkflowId(), ex);
                        }
                    })
                    .get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeadLetterPublishException("Interrupted while publishing dead letter", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new DeadLetterPublishException("Failed to publish dead letter for workflow "
                    + entry.getWorkflowId() + ": " + e.getMessage(), e);
        }
    }

    public static class DeadLetterPublishException extends RuntimeException {
        public DeadLetterPublishException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
