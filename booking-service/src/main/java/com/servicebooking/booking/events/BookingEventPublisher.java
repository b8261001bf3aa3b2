package com.servicebooking.booking.events;

import com.servicebooking.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.concurrent.CompletableFuture;

/**
 * Forwards booking lifecycle events to Kafka once the ledger transaction that produced them
 * has committed. A rolled-back transition therefore never announces itself.
 *
 * Events published:
 * - booking-confirmed: {@link BookingConfirmedEvent}
 * - booking-cancelled: {@link BookingCancelledEvent}
 *
 * Keyed by booking id so consumers see one booking's events in order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onBookingConfirmed(BookingConfirmedEvent event) {
        publishEvent(Constants.TOPIC_BOOKING_CONFIRMED, String.valueOf(event.getBookingId()), event);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onBookingCancelled(BookingCancelledEvent event) {
        publishEvent(Constants.TOPIC_BOOKING_CANCELLED, String.valueOf(event.getBookingId()), event);
    }

    private void publishEvent(String topic, String key, Object event) {
        log.info("Publishing event to topic {}: {}", topic, event);

        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.info("Event published successfully to topic {}: offset={}",
                        topic, result.getRecordMetadata().offset());
            } else {
                // TODO: route failed sends to a dead-letter table so the notification side can be replayed
                log.error("Failed to publish event to topic {}", topic, ex);
            }
        });
    }
}
