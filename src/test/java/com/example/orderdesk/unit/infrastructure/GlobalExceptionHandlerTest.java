package com.example.orderdesk.unit.infrastructure;

import com.example.orderdesk.domain.exception.ConcurrentOrderUpdateException;
import com.example.orderdesk.domain.exception.OrderClosedException;
import com.example.orderdesk.domain.model.OrderStatus;
import com.example.orderdesk.infrastructure.exception.GlobalExceptionHandler;
import com.example.orderdesk.infrastructure.persistence.entity.OrderEntity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Global Exception Handler Tests")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("should_map_raw_lock_failure_to_stale_order_conflict")
    void should_map_raw_lock_failure_to_stale_order_conflict() {
        // When
        ResponseEntity<Map<String, Object>> response = handler.handleConcurrencyFailure(
                new ObjectOptimisticLockingFailureException(OrderEntity.class, "order-1"));

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody())
                .containsEntry("error", "STALE_ORDER")
                .hasEntrySatisfying("message", message -> assertThat((String) message).contains("choose again"));
    }

    @Test
    @DisplayName("should_map_lost_assignment_race_to_stale_order_conflict")
    void should_map_lost_assignment_race_to_stale_order_conflict() {
        ResponseEntity<Map<String, Object>> response = handler.handleConflict(
                ConcurrentOrderUpdateException.assignmentChanged("order-1", null));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody())
                .containsEntry("error", "STALE_ORDER")
                .containsEntry("message", "Order order-1 was modified concurrently; refresh and choose again");
    }

    @Test
    @DisplayName("should_map_closed_order_to_forbidden")
    void should_map_closed_order_to_forbidden() {
        ResponseEntity<Map<String, Object>> response = handler.handleInvalidTransition(
                new OrderClosedException(OrderStatus.CANCELLED));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(response.getBody()).containsEntry("error", "ORDER_CLOSED");
    }
}
