package com.campuseats.orderservice.reservation;

import lombok.Value;

import java.util.List;

@Value
public class ReservationStats {
    int keys;
    int activeClaims;
    int expiredClaims;
    List<Reservation> claims;
}
