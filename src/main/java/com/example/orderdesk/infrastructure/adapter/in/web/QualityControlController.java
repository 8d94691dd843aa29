package com.example.orderdesk.infrastructure.adapter.in.web;

import com.example.orderdesk.application.dto.OrderView;
import com.example.orderdesk.application.dto.SubmissionView;
import com.example.orderdesk.application.port.in.QualityControlUseCase;
import com.example.orderdesk.infrastructure.adapter.in.web.dto.ReasonRequest;
import com.example.orderdesk.infrastructure.adapter.in.web.dto.SubmitWorkRequest;
import com.example.orderdesk.infrastructure.adapter.in.web.mapper.OrderWebMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
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
@Tag(name = "Quality Control", description = "稿件提交、品質審核與交付 API")
public class QualityControlController {

    private final QualityControlUseCase qualityControl;
    private final OrderWebMapper mapper;

    public QualityControlController(QualityControlUseCase qualityControl, OrderWebMapper mapper) {
        this.qualityControl = qualityControl;
        this.mapper = mapper;
    }

    @Operation(summary = "提交稿件", description = "僅限目前指派的寫手；上一份稿件仍待審時不可提交")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "稿件已提交，訂單移至 PENDING_QC"),
            @ApiResponse(responseCode = "403", description = "非指派寫手或訂單已結案")
    })
    @PostMapping("/api/orders/{orderId}/submissions")
    public Mono<ResponseEntity<SubmissionView>> submit(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable String orderId,
            @Valid @RequestBody SubmitWorkRequest request) {
        return Blocking.call(() -> qualityControl.submitWork(mapper.toCommand(orderId, userId, request)))
                .map(view -> ResponseEntity.status(HttpStatus.CREATED).body(view));
    }

    @Operation(summary = "稿件清單")
    @GetMapping("/api/orders/{orderId}/submissions")
    public Mono<List<SubmissionView>> submissions(@PathVariable String orderId) {
        return Blocking.call(() -> qualityControl.submissions(orderId));
    }

    @Operation(summary = "最新稿件")
    @GetMapping("/api/orders/{orderId}/submissions/latest")
    public Mono<ResponseEntity<SubmissionView>> latest(@PathVariable String orderId) {
        return Blocking.call(() -> qualityControl.latestSubmission(orderId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build()));
    }

    @Operation(summary = "審核通過")
    @PostMapping("/api/submissions/{submissionId}/approve")
    public Mono<SubmissionView> approve(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable String submissionId,
            @RequestBody(required = false) ReasonRequest request) {
        return Blocking.call(() -> qualityControl.approveSubmission(submissionId, userId, textOf(request)));
    }

    @Operation(summary = "要求修改", description = "必須提供修改意見")
    @PostMapping("/api/submissions/{submissionId}/revision")
    public Mono<SubmissionView> requestRevision(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable String submissionId,
            @RequestBody ReasonRequest request) {
        return Blocking.call(() -> qualityControl.requestRevision(submissionId, userId, request.text()));
    }

    @Operation(summary = "交付訂單", description = "APPROVED → DELIVERED")
    @PostMapping("/api/orders/{orderId}/deliver")
    public Mono<OrderView> deliver(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable String orderId,
            @RequestBody(required = false) ReasonRequest request) {
        return Blocking.call(() -> qualityControl.deliverOrder(orderId, userId, textOf(request)));
    }

    @Operation(summary = "完成訂單", description = "APPROVED 或 DELIVERED → COMPLETED，之後不可再修改")
    @PostMapping("/api/orders/{orderId}/complete")
    public Mono<OrderView> complete(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable String orderId) {
        return Blocking.call(() -> qualityControl.completeOrder(orderId, userId));
    }

    private static String textOf(ReasonRequest request) {
        return request == null ? null : request.text();
    }
}
