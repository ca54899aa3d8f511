package com.rentnest.tm30.events;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

/**
 * Publishes TM30 lifecycle events to Kafka
 *
 * Topics Published:
 * - tm30-submission-events: filing outcomes reported by the automation executor
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Tm30EventPublisher {

    static final String TM30_SUBMISSION_EVENTS_TOPIC = "tm30-submission-events";

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final MeterRegistry meterRegistry;

    private Counter eventsFailedCounter;

    @PostConstruct
    public void initMetrics() {
        eventsFailedCounter = Counter.builder("tm30.events.publish.failed")
                .description("TM30 events that could not be handed to Kafka")
                .register(meterRegistry);
    }

    /**
     * Fire and forget. A broker problem is logged and counted but never fails
     * the callback that produced the event.
     */
    public void publishSubmissionCompleted(Tm30SubmissionCompletedEvent event) {
        String key = event.getBookingId().toString();
        try {
            kafkaTemplate.send(TM30_SUBMISSION_EVENTS_TOPIC, key, event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            eventsFailedCounter.increment();
                            log.error("Failed to publish TM30 completion event for booking {}", key, ex);
                        } else {
                            log.debug("Published TM30 completion event for booking {} at offset {}",
                                    key, result.getRecordMetadata().offset());
                        }
                    });
        } catch (Exception e) {
            eventsFailedCounter.increment();
            log.error("Failed to send TM30 completion event for booking {}", key, e);
        }
    }
}
