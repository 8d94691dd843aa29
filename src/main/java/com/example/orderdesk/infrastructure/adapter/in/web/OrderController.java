package com.example.orderdesk.infrastructure.adapter.in.web;

import com.example.orderdesk.application.dto.OrderParticipants;
import com.example.orderdesk.application.dto.OrderView;
import com.example.orderdesk.application.port.in.OrderIntakeUseCase;
import com.example.orderdesk.domain.model.OrderStatus;
import com.example.orderdesk.domain.model.Role;
import com.example.orderdesk.infrastructure.adapter.in.web.dto.CreateQueryRequest;
import com.example.orderdesk.infrastructure.adapter.in.web.dto.StatusChangeRequest;
import com.example.orderdesk.infrastructure.adapter.in.web.dto.TransitionCheckResponse;
import com.example.orderdesk.infrastructure.adapter.in.web.mapper.OrderWebMapper;
import com.example.orderdesk.infrastructure.service.IdempotencyService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Query intake, order reads and guarded status changes.
 * Raising a query supports idempotency via the X-Idempotency-Key header.
 */
@RestController
@RequestMapping("/api/orders")
@Tag(name = "Orders", description = "詢價與訂單狀態 API")
public class OrderController {

    private static final Logger log = LoggerFactory.getLogger(OrderController.class);

    private final OrderIntakeUseCase orderIntake;
    private final OrderWebMapper mapper;
    private final IdempotencyService idempotencyService;

    public OrderController(
            OrderIntakeUseCase orderIntake,
            OrderWebMapper mapper,
            IdempotencyService idempotencyService) {
        this.orderIntake = orderIntake;
        this.mapper = mapper;
        this.idempotencyService = idempotencyService;
    }

    @Operation(
            summary = "建立詢價",
            description = """
                    客戶提出新的詢價，系統產生 `QUERY_` 開頭的詢價代碼，狀態為 PENDING_QUERY。

                    **冪等性支援**：提供 X-Idempotency-Key header，重複請求會回傳第一次的結果。
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "詢價建立成功"),
            @ApiResponse(
                    responseCode = "400",
                    description = "請求參數錯誤",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            examples = @ExampleObject(value = """
                                    {
                                      "error": "VALIDATION_ERROR",
                                      "message": "Deadline must be in the future",
                                      "timestamp": "2026-02-02T12:00:00Z"
                                    }
                                    """)
                    )
            ),
            @ApiResponse(responseCode = "403", description = "呼叫者不是有效的客戶"),
            @ApiResponse(responseCode = "409", description = "相同冪等鍵的請求處理中"),
            @ApiResponse(responseCode = "503", description = "身分服務暫時不可用")
    })
    @PostMapping
    public Mono<ResponseEntity<OrderView>> createQuery(
            @Parameter(description = "呼叫者使用者 ID", required = true)
            @RequestHeader("X-User-Id") String userId,
            @Parameter(description = "冪等鍵 - 用於確保請求安全重試", example = "550e8400-e29b-41d4-a716-446655440000")
            @RequestHeader(value = "X-Idempotency-Key", required = false) String idempotencyKey,
            @Valid @RequestBody CreateQueryRequest request) {
        log.info("Received query from {} on topic '{}', idempotencyKey: {}", userId, request.topic(), idempotencyKey);
        return Blocking.call(() -> idempotencyService.execute(idempotencyKey, "CREATE_QUERY", userId, OrderView.class,
                        () -> orderIntake.createQuery(mapper.toCommand(userId, request))))
                .map(view -> ResponseEntity.status(HttpStatus.CREATED).body(view));
    }

    @Operation(summary = "查詢訂單", description = "根據訂單 ID 查詢訂單目前狀態")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "查詢成功"),
            @ApiResponse(responseCode = "404", description = "訂單不存在")
    })
    @GetMapping("/{orderId}")
    public Mono<OrderView> getOrder(
            @Parameter(description = "訂單 ID", required = true) @PathVariable String orderId) {
        return Blocking.call(() -> orderIntake.getOrder(orderId));
    }

    @Operation(summary = "訂單參與者", description = "回傳客戶、寫手與 BDE，供聊天權限判斷")
    @GetMapping("/{orderId}/participants")
    public Mono<OrderParticipants> participants(@PathVariable String orderId) {
        return Blocking.call(() -> orderIntake.participants(orderId));
    }

    @Operation(
            summary = "變更訂單狀態",
            description = """
                    只接受沒有專屬操作的目標狀態（PENDING_QUERY、IN_PROGRESS、QUERY_REJECTED、CANCELLED）。
                    expectedStatus 與目前狀態不符時回傳 409。
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "狀態已變更"),
            @ApiResponse(responseCode = "403", description = "角色或目前狀態不允許此變更"),
            @ApiResponse(responseCode = "409", description = "訂單已被其他請求修改")
    })
    @PostMapping("/{orderId}/status")
    public Mono<OrderView> changeStatus(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable String orderId,
            @Valid @RequestBody StatusChangeRequest request) {
        return Blocking.call(() -> orderIntake.changeStatus(
                orderId, userId, request.expectedStatus(), request.targetStatus(), request.reason()));
    }

    @Operation(summary = "檢查狀態轉換", description = "純查詢：角色是否可將訂單從 from 移到 to")
    @GetMapping("/transitions")
    public TransitionCheckResponse canTransition(
            @RequestParam Role role,
            @RequestParam OrderStatus from,
            @RequestParam OrderStatus to) {
        return new TransitionCheckResponse(role, from, to, orderIntake.canTransition(role, from, to));
    }
}
