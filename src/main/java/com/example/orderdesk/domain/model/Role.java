package com.example.orderdesk.domain.model;

/**
 * Roles an actor can hold. Resolved from the identity service, never from the request.
 */
public enum Role {

    CLIENT,

    /**
     * Business development executive, quotes on behalf of the desk.
     */
    BDE,

    WRITER,

    ADMIN;

    public static Role fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Role cannot be blank");
        }
        return Role.valueOf(value.trim().toUpperCase());
    }
}
