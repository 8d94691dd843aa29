package com.example.orderdesk.application.dto;

/**
 * Who may talk to whom in the context of one order. Writer and BDE may be absent.
 */
public record OrderParticipants(
        String orderId,
        String clientId,
        String writerId,
        String bdeId
) {
    public boolean includes(String userId) {
        return userId != null
                && (userId.equals(clientId) || userId.equals(writerId) || userId.equals(bdeId));
    }
}
