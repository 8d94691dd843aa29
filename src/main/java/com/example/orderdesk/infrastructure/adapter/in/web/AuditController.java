package com.example.orderdesk.infrastructure.adapter.in.web;

import com.example.orderdesk.application.dto.AuditEntryView;
import com.example.orderdesk.application.port.in.AuditTrailUseCase;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/orders/{orderId}/audit")
@Tag(name = "Audit", description = "訂單稽核紀錄 API")
public class AuditController {

    private final AuditTrailUseCase auditTrail;

    public AuditController(AuditTrailUseCase auditTrail) {
        this.auditTrail = auditTrail;
    }

    @Operation(summary = "訂單稽核紀錄", description = "依發生時間排序，可依事件類型與操作者篩選；僅限 ADMIN 與 BDE")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "查詢成功"),
            @ApiResponse(responseCode = "403", description = "呼叫者不是 ADMIN 或 BDE"),
            @ApiResponse(responseCode = "404", description = "訂單不存在")
    })
    @GetMapping
    public Mono<List<AuditEntryView>> history(
            @RequestHeader("X-User-Id") String userId,
            @Parameter(description = "訂單 ID", required = true) @PathVariable String orderId,
            @Parameter(description = "事件類型，例如 PAYMENT_VERIFIED") @RequestParam(required = false) String eventType,
            @Parameter(description = "操作者使用者 ID") @RequestParam(required = false) String actorId) {
        return Blocking.call(() -> auditTrail.history(orderId, userId, eventType, actorId));
    }
}
