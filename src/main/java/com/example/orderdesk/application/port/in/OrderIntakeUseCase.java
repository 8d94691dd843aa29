package com.example.orderdesk.application.port.in;

import com.example.orderdesk.application.dto.CreateQueryCommand;
import com.example.orderdesk.application.dto.OrderParticipants;
import com.example.orderdesk.application.dto.OrderView;
import com.example.orderdesk.domain.model.OrderStatus;
import com.example.orderdesk.domain.model.Role;

/**
 * Inbound port for raising queries, reading orders and guarded status changes.
 */
public interface OrderIntakeUseCase {

    OrderView createQuery(CreateQueryCommand command);

    OrderView getOrder(String orderId);

    OrderParticipants participants(String orderId);

    /**
     * Moves an order to a status that no dedicated operation owns, e.g. cancellation.
     *
     * @param expected the status the caller last saw; a mismatch is a conflict
     */
    OrderView changeStatus(String orderId, String actorId, OrderStatus expected, OrderStatus target, String reason);

    boolean canTransition(Role role, OrderStatus from, OrderStatus to);
}
