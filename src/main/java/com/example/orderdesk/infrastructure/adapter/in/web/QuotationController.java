package com.example.orderdesk.infrastructure.adapter.in.web;

import com.example.orderdesk.application.dto.QuotationView;
import com.example.orderdesk.application.port.in.QuotationUseCase;
import com.example.orderdesk.infrastructure.adapter.in.web.dto.QuoteRequest;
import com.example.orderdesk.infrastructure.adapter.in.web.mapper.OrderWebMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/orders/{orderId}/quotation")
@Tag(name = "Quotation", description = "報價 API")
public class QuotationController {

    private final QuotationUseCase quotations;
    private final OrderWebMapper mapper;

    public QuotationController(QuotationUseCase quotations, OrderWebMapper mapper) {
        this.quotations = quotations;
        this.mapper = mapper;
    }

    @Operation(
            summary = "建立或更新報價",
            description = "管理員或 BDE 報價。未提供 finalPrice 時以 基本價 + 急件費 - 折扣 + 稅 計算。"
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "報價已送出，訂單狀態為 QUOTATION_SENT"),
            @ApiResponse(responseCode = "400", description = "金額不合法"),
            @ApiResponse(responseCode = "403", description = "角色或訂單狀態不允許報價")
    })
    @PutMapping
    public Mono<QuotationView> quote(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable String orderId,
            @Valid @RequestBody QuoteRequest request) {
        return Blocking.call(() -> quotations.createOrUpdateQuotation(mapper.toCommand(orderId, userId, request)));
    }

    @Operation(summary = "接受報價", description = "訂單所屬客戶接受報價，狀態移至 ACCEPTED")
    @PostMapping("/accept")
    public Mono<QuotationView> accept(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable String orderId) {
        return Blocking.call(() -> quotations.acceptQuotation(orderId, userId));
    }

    @Operation(summary = "查詢報價")
    @GetMapping
    public Mono<QuotationView> get(@PathVariable String orderId) {
        return Blocking.call(() -> quotations.getQuotation(orderId));
    }
}
