package com.campuseats.orderservice.reservation;

import com.campuseats.orderservice.model.ItemKind;
import lombok.NonNull;
import lombok.Value;

import java.util.UUID;

@Value
public class ReservationKey {
    @NonNull UUID vendorId;
    @NonNull ItemKind kind;
    @NonNull UUID itemId;

    @Override
    public String toString() {
        return vendorId + ":" + kind + ":" + itemId;
    }
}
