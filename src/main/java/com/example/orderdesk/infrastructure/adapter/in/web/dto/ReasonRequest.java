package com.example.orderdesk.infrastructure.adapter.in.web.dto;

/**
 * Free-text body shared by reject, decline, revoke, deliver and review calls.
 */
public record ReasonRequest(String text) {
}
