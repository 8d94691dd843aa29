package com.example.orderdesk.infrastructure.adapter.in.web.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

public record VerifyPaymentRequest(
        @Min(value = 1, message = "Verified percentage must be at least 1")
        @Max(value = 100, message = "Verified percentage cannot exceed 100")
        int percentage
) {}
