package com.campuseats.orderservice.job;

import com.campuseats.orderservice.config.AmqpConfig;
import com.campuseats.orderservice.model.OutboxEvent;
import com.campuseats.orderservice.repository.OutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Relays outbox rows to the order events exchange, oldest first, and purges
 * relayed rows once a day.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxRepository outboxRepository;
    private final RabbitTemplate rabbitTemplate;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${campuseats.outbox.publish-interval:2000}")
    @Transactional
    public int publishOutboxEvents() {
        List<OutboxEvent> events = outboxRepository.findTop50ByProcessedFalseOrderByCreatedAtAsc();
        if (events.isEmpty()) {
            return 0;
        }

        log.debug("Found {} outbox events to publish", events.size());
        int published = 0;

        for (OutboxEvent event : events) {
            try {
                // payload is already JSON, send the bytes as they are
                MessageProperties props = new MessageProperties();
                props.setContentType(MessageProperties.CONTENT_TYPE_JSON);
                props.setMessageId(event.getId().toString());

                Message message = new Message(event.getPayload().getBytes(StandardCharsets.UTF_8), props);
                rabbitTemplate.send(AmqpConfig.ORDER_EXCHANGE, event.getType(), message);

                event.setProcessed(true);
                published++;
                log.info("Published outbox event: id={}, type={}, orderId={}",
                        event.getId(), event.getType(), event.getAggregateId());

            } catch (AmqpException e) {
                event.setAttempts(event.getAttempts() + 1);
                log.error("Failed to publish outbox event: id={}, attempts={}", event.getId(), event.getAttempts(), e);
            }
            outboxRepository.save(event);
        }
        return published;
    }

    @Scheduled(cron = "${campuseats.outbox.cleanup-cron:0 0 3 * * *}")
    @Transactional
    public int cleanupProcessedEvents() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(1));
        log.info("Starting cleanup of processed outbox events older than {}", cutoff);

        int totalDeleted = 0;
        List<OutboxEvent> batch;
        while (!(batch = outboxRepository.findTop1000ByProcessedTrueAndCreatedAtBefore(cutoff)).isEmpty()) {
            outboxRepository.deleteAll(batch);
            totalDeleted += batch.size();
        }

        log.info("Outbox cleanup completed. Total deleted: {}", totalDeleted);
        return totalDeleted;
    }
}
