package com.campuseats.orderservice.repository;

import com.campuseats.orderservice.model.OrderCounter;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public interface OrderCounterRepository extends JpaRepository<OrderCounter, String> {

    // Creates the counter at 1 or bumps it, and reads the new value in the same statement
    @Query(value = "INSERT INTO order_counters (counter_id, sequence, last_updated) " +
            "VALUES (:counterId, 1, :now) " +
            "ON CONFLICT (counter_id) DO UPDATE " +
            "SET sequence = order_counters.sequence + 1, last_updated = EXCLUDED.last_updated " +
            "RETURNING sequence", nativeQuery = true)
    long incrementAndGet(@Param("counterId") String counterId, @Param("now") Instant now);
}
