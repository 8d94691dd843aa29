package com.example.orderdesk.infrastructure.adapter.in.web;

import com.example.orderdesk.application.dto.PaymentView;
import com.example.orderdesk.application.port.in.PaymentVerificationUseCase;
import com.example.orderdesk.infrastructure.adapter.in.web.dto.PaymentRequest;
import com.example.orderdesk.infrastructure.adapter.in.web.dto.ReasonRequest;
import com.example.orderdesk.infrastructure.adapter.in.web.dto.VerifyPaymentRequest;
import com.example.orderdesk.infrastructure.service.IdempotencyService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@Tag(name = "Payments", description = "付款與付款確認 API")
public class PaymentController {

    private static final Logger log = LoggerFactory.getLogger(PaymentController.class);

    private final PaymentVerificationUseCase payments;
    private final IdempotencyService idempotencyService;

    public PaymentController(PaymentVerificationUseCase payments, IdempotencyService idempotencyService) {
        this.payments = payments;
        this.idempotencyService = idempotencyService;
    }

    @Operation(
            summary = "提交付款",
            description = "客戶提交付款憑證，等待管理員確認。支援 X-Idempotency-Key 避免重複付款紀錄。"
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "付款已記錄"),
            @ApiResponse(responseCode = "403", description = "非訂單客戶或訂單狀態不可付款")
    })
    @PostMapping("/api/orders/{orderId}/payments")
    public Mono<ResponseEntity<PaymentView>> submit(
            @RequestHeader("X-User-Id") String userId,
            @Parameter(description = "冪等鍵") @RequestHeader(value = "X-Idempotency-Key", required = false)
            String idempotencyKey,
            @PathVariable String orderId,
            @Valid @RequestBody PaymentRequest request) {
        log.info("Received payment of {} for order {} from {}", request.amount(), orderId, userId);
        return Blocking.call(() -> idempotencyService.execute(idempotencyKey, "SUBMIT_PAYMENT", userId,
                        PaymentView.class,
                        () -> payments.submitPayment(orderId, userId, request.amount(), request.receiptReference())))
                .map(view -> ResponseEntity.status(HttpStatus.CREATED).body(view));
    }

    @Operation(summary = "付款紀錄")
    @GetMapping("/api/orders/{orderId}/payments")
    public Mono<List<PaymentView>> list(@PathVariable String orderId) {
        return Blocking.call(() -> payments.payments(orderId));
    }

    @Operation(
            summary = "確認付款",
            description = "管理員確認付款百分比。100% 時訂單移至 PAYMENT_VERIFIED 並核發工作代碼（只核發一次）。"
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "付款已確認"),
            @ApiResponse(responseCode = "409", description = "付款已被拒絕或訂單同時被修改")
    })
    @PostMapping("/api/payments/{paymentId}/verify")
    public Mono<PaymentView> verify(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable String paymentId,
            @Valid @RequestBody VerifyPaymentRequest request) {
        return Blocking.call(() -> payments.verifyPayment(paymentId, userId, request.percentage()));
    }

    @Operation(summary = "拒絕付款", description = "必須提供拒絕原因")
    @PostMapping("/api/payments/{paymentId}/reject")
    public Mono<PaymentView> reject(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable String paymentId,
            @RequestBody ReasonRequest request) {
        return Blocking.call(() -> payments.rejectPayment(paymentId, userId, request.text()));
    }
}
