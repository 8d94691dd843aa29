package com.example.orderdesk.infrastructure.adapter.in.web;

import com.example.orderdesk.application.dto.InviteResult;
import com.example.orderdesk.application.dto.OrderView;
import com.example.orderdesk.application.dto.TaskEvaluationView;
import com.example.orderdesk.application.dto.WriterInterestView;
import com.example.orderdesk.application.port.in.WriterRecruitmentUseCase;
import com.example.orderdesk.infrastructure.adapter.in.web.dto.AssignWriterRequest;
import com.example.orderdesk.infrastructure.adapter.in.web.dto.InviteRequest;
import com.example.orderdesk.infrastructure.adapter.in.web.dto.ReasonRequest;
import com.example.orderdesk.infrastructure.adapter.in.web.dto.TaskEvaluationRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Writer recruitment: invitations, interest, assignment and the writer's task evaluation.
 */
@RestController
@RequestMapping("/api/orders/{orderId}")
@Tag(name = "Recruitment", description = "寫手招募與指派 API")
public class RecruitmentController {

    private final WriterRecruitmentUseCase recruitment;

    public RecruitmentController(WriterRecruitmentUseCase recruitment) {
        this.recruitment = recruitment;
    }

    @Operation(summary = "邀請寫手", description = "重複邀請不會建立重複紀錄；已表態的寫手列於 skipped")
    @PostMapping("/invitations")
    public Mono<InviteResult> invite(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable String orderId,
            @Valid @RequestBody InviteRequest request) {
        return Blocking.call(() -> recruitment.invite(orderId, userId, request.writerIds()));
    }

    @Operation(summary = "寫手表達意願")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "已記錄意願"),
            @ApiResponse(responseCode = "409", description = "已表達過意願")
    })
    @PostMapping("/interest")
    public Mono<WriterInterestView> showInterest(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable String orderId,
            @RequestBody(required = false) ReasonRequest request) {
        return Blocking.call(() -> recruitment.showInterest(orderId, userId, textOf(request)));
    }

    @Operation(summary = "寫手婉拒邀請")
    @PostMapping("/decline")
    public Mono<WriterInterestView> decline(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable String orderId,
            @RequestBody(required = false) ReasonRequest request) {
        return Blocking.call(() -> recruitment.decline(orderId, userId, textOf(request)));
    }

    @Operation(
            summary = "指派寫手",
            description = "每筆訂單同時只有一位被指派的寫手。expectedVersion 過期時回傳 409，請重新整理後再選擇。"
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "指派成功"),
            @ApiResponse(responseCode = "403", description = "訂單狀態不允許指派"),
            @ApiResponse(responseCode = "409", description = "訂單已被其他管理員修改")
    })
    @PutMapping("/assignment")
    public Mono<OrderView> assign(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable String orderId,
            @Valid @RequestBody AssignWriterRequest request) {
        return Blocking.call(() -> recruitment.assign(orderId, userId, request.writerId(), request.expectedVersion()));
    }

    @Operation(summary = "撤銷指派", description = "訂單回到 PAYMENT_VERIFIED")
    @PostMapping("/assignment/revoke")
    public Mono<OrderView> revoke(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable String orderId,
            @RequestBody(required = false) ReasonRequest request) {
        return Blocking.call(() -> recruitment.revoke(orderId, userId, textOf(request)));
    }

    @Operation(summary = "重新指派", description = "撤銷目前寫手並指派新寫手，單一交易、單一稽核紀錄")
    @PostMapping("/assignment/reassign")
    public Mono<OrderView> reassign(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable String orderId,
            @Valid @RequestBody AssignWriterRequest request) {
        return Blocking.call(() -> recruitment.reassign(orderId, userId, request.writerId(), request.reason()));
    }

    @Operation(summary = "目前指派的寫手")
    @GetMapping("/assignment")
    public Mono<ResponseEntity<Map<String, String>>> currentAssignee(@PathVariable String orderId) {
        return Blocking.call(() -> recruitment.currentAssignee(orderId)
                .map(writerId -> ResponseEntity.ok(Map.of("orderId", orderId, "writerId", writerId)))
                .orElseGet(() -> ResponseEntity.noContent().build()));
    }

    @Operation(summary = "寫手意願清單")
    @GetMapping("/interests")
    public Mono<List<WriterInterestView>> interests(@PathVariable String orderId) {
        return Blocking.call(() -> recruitment.interests(orderId));
    }

    @Operation(summary = "寫手評估任務", description = "doable 時訂單移至 IN_PROGRESS；not doable 需附說明並通知管理員")
    @PostMapping("/evaluation")
    public Mono<TaskEvaluationView> evaluate(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable String orderId,
            @Valid @RequestBody TaskEvaluationRequest request) {
        return Blocking.call(() -> recruitment.evaluateTask(orderId, userId, request.doable(), request.comment()));
    }

    private static String textOf(ReasonRequest request) {
        return request == null ? null : request.text();
    }
}
