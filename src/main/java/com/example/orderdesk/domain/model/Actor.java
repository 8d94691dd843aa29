package com.example.orderdesk.domain.model;

import java.util.Objects;

/**
 * A user acting on an order, with the role confirmed by the identity service.
 */
public record Actor(String id, Role role) {

    public Actor {
        Objects.requireNonNull(id, "Actor id cannot be null");
        Objects.requireNonNull(role, "Actor role cannot be null");
    }

    public boolean is(Role expected) {
        return role == expected;
    }
}
