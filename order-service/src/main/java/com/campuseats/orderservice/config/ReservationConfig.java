package com.campuseats.orderservice.config;

import com.campuseats.orderservice.reservation.ReservationLedger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ReservationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ReservationLedger reservationLedger(Clock clock,
            @Value("${campuseats.reservations.stripes:64}") int stripes) {
        return new ReservationLedger(clock, stripes);
    }
}
