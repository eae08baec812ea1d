package com.campuseats.orderservice.service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Time bucket an order number sequence restarts in.
 */
public enum OrderNumberScope {

    // 20261019, the usual choice
    DAY {
        @Override
        public String bucket(Instant instant) {
            return DAY_FORMAT.format(instant);
        }
    },

    // epoch seconds, for vendors that take too many orders for a five digit daily sequence
    SECOND {
        @Override
        public String bucket(Instant instant) {
            return Long.toString(instant.getEpochSecond());
        }
    };

    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd")
            .withZone(ZoneOffset.UTC);

    public abstract String bucket(Instant instant);
}
