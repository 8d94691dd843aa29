package com.example.orderdesk.infrastructure.adapter.out.identity.dto;

/**
 * User record returned by the identity service.
 */
public record UserResponse(
        String id,
        String role,
        boolean active
) {
}
