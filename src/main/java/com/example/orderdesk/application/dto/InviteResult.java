package com.example.orderdesk.application.dto;

import java.util.List;

/**
 * Outcome of an invite call. Skipped writers already hold a stronger stance on the order.
 */
public record InviteResult(
        String orderId,
        List<String> invited,
        List<String> skipped
) {}
