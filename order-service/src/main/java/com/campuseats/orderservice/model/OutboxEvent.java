package com.campuseats.orderservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * Order event waiting to be relayed to RabbitMQ.
 * Written in the same transaction as the status change it describes.
 */
@Entity
@Table(name = "outbox", indexes = @Index(name = "idx_outbox_processed_created", columnList = "processed, created_at"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboxEvent {

    public static final String ORDER_AGGREGATE = "Order";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "aggregate_type", nullable = false)
    private String aggregateType;

    @Column(name = "aggregate_id", nullable = false)
    private String aggregateId;

    // doubles as the routing key, e.g. order.in_progress
    @Column(nullable = false)
    private String type;

    @Column(columnDefinition = "jsonb", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private String payload;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private boolean processed;

    // incremented on every failed publish attempt
    @Column(nullable = false)
    private int attempts;
}
