package com.example.orderdesk.application.port.in;

import com.example.orderdesk.application.dto.PaymentView;

import java.math.BigDecimal;
import java.util.List;

public interface PaymentVerificationUseCase {

    PaymentView submitPayment(String orderId, String clientId, BigDecimal amount, String receiptReference);

    /**
     * Verifies a payment. At 100 percent the order is confirmed and receives its work code.
     */
    PaymentView verifyPayment(String paymentId, String adminId, int percentage);

    PaymentView rejectPayment(String paymentId, String adminId, String reason);

    List<PaymentView> payments(String orderId);
}
