package com.campuseats.orderservice.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class DenyOrderRequest {

    // falls back to the configured default reason when blank
    @Size(max = 200, message = "Reason is too long")
    private String reason;
}
