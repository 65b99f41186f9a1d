package com.openwash.booking.events;

import com.openwash.booking.domain.model.Booking;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Kafka publisher for booking status changes.
 *
 * Fire-and-forget: called only after the booking transaction committed, makes one send attempt
 * and never throws. A failed send is logged and dropped; the booking stays as committed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final Clock clock;

    public void publish(BookingEventType eventType, Booking booking) {
        try {
            BookingStatusChangedEvent event = BookingStatusChangedEvent.builder()
                    .eventType(eventType)
                    .bookingId(booking.getId())
                    .customerId(booking.getCustomerId())
                    .status(booking.getStatus().name())
                    .scheduledAt(booking.getScheduledAt())
                    .occurredAt(Instant.now(clock))
                    .build();
            publishEvent(eventType.getTopic(), String.valueOf(booking.getId()), event);
        } catch (RuntimeException e) {
            log.error("Failed to publish {} for booking {}", eventType, booking.getId(), e);
        }
    }

    private void publishEvent(String topic, String key, Object event) {
        log.info("Publishing event to topic {}: {}", topic, event);

        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.info("Event published to topic {}: offset={}",
                        topic, result.getRecordMetadata().offset());
            } else {
                log.error("Failed to publish event to topic {}", topic, ex);
            }
        });
    }
}
