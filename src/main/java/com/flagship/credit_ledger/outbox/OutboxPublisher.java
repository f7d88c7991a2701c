package com.flagship.credit_ledger.outbox;

import com.flagship.credit_ledger.config.LedgerProperties;
import com.flagship.credit_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Polls the outbox and publishes ledger events to Kafka.
 *
 * Sends are synchronous and keyed by user id, so one user's events reach
 * one partition in commit order. An event that keeps failing stops being
 * polled after outbox.publisher.max-retries and stays in the table for
 * manual follow-up, so it never holds back the events behind it.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;
    private final LedgerProperties properties;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findUnpublishedEvents(batchSize, maxRetries);
            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} unpublished events to process", events.size());
            for (OutboxEvent event : events) {
                publishEvent(event);
            }
        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    private void publishEvent(OutboxEvent event) {
        String topic = properties.getEvents().getTopic();
        try {
            SendResult<String, String> result =
                    kafkaTemplate.send(topic, event.getAggregateId(), event.getPayload()).get();

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, "Interrupted while publishing");
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            recordFailure(event, e.getMessage());
        }
    }

    private void recordFailure(OutboxEvent event, String errorMessage) {
        outboxService.markFailed(event.getId(), errorMessage);
        outboxMetrics.recordEventPublishFailed(event.getEventType());

        if (event.getRetryCount() + 1 >= maxRetries) {
            log.warn("Event {} reached max retries ({}), leaving it for manual follow-up. eventType={}, userId={}",
                    event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
            outboxMetrics.recordEventDeadLettered(event.getEventType());
        }
    }

    /**
     * Runs one polling pass immediately.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }
}
