package com.campuseats.orderservice.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * Per vendor, per scope sequence behind order numbers.
 * Rows are only ever written by the upsert in OrderCounterRepository.
 */
@Entity
@Table(name = "order_counters")
@Getter
@Setter
public class OrderCounter {

    // "<scope>-<vendorId>", e.g. "20261019-5f0c..."
    @Id
    @Column(name = "counter_id")
    private String counterId;

    @Column(nullable = false)
    private long sequence;

    @Column(name = "last_updated", nullable = false)
    private Instant lastUpdated;
}
