package com.campuseats.orderservice.service;

import com.campuseats.orderservice.config.OrderProperties;
import com.campuseats.orderservice.exception.OrderNumberUnavailableException;
import com.campuseats.orderservice.repository.OrderCounterRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * Mints human-readable order numbers such as {@code CE-20261019-A1B2-00042}.
 *
 * <p>The sequence is per vendor and per scope bucket, incremented by a single upsert.
 * It runs in its own transaction, so a checkout that fails later still burns its number:
 * sequences are monotonic but may have gaps.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderNumberGenerator {

    private static final int HOLDER_SUFFIX_LENGTH = 4;

    private final OrderCounterRepository orderCounterRepository;
    private final OrderProperties orderProperties;
    private final Clock clock;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public String next(UUID vendorId, UUID holderId) {
        return next(vendorId, holderId, orderProperties.getOrderNumberScope());
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public String next(UUID vendorId, UUID holderId, OrderNumberScope scope) {
        Instant now = clock.instant();
        String bucket = scope.bucket(now);
        String counterId = bucket + "-" + vendorId;

        long sequence;
        try {
            sequence = orderCounterRepository.incrementAndGet(counterId, now);
        } catch (DataAccessException e) {
            log.error("Order counter unavailable: counterId={}", counterId, e);
            throw new OrderNumberUnavailableException("Could not allocate an order number", e);
        }

        return format(orderProperties.getOrderNumberPrefix(), bucket, holderId, sequence);
    }

    static String format(String prefix, String bucket, UUID holderId, long sequence) {
        String holder = holderId.toString();
        String suffix = holder.substring(holder.length() - HOLDER_SUFFIX_LENGTH).toUpperCase(Locale.ROOT);
        return String.format("%s-%s-%s-%05d", prefix, bucket, suffix, sequence);
    }
}
