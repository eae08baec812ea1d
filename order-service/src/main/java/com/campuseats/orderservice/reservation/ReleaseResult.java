package com.campuseats.orderservice.reservation;

import lombok.Value;

import java.util.List;

@Value
public class ReleaseResult {
    List<ReservationKey> released;
    // keys that were already released, expired or held by someone else
    List<ReservationKey> notFound;
}
