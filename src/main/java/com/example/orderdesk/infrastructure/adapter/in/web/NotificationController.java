package com.example.orderdesk.infrastructure.adapter.in.web;

import com.example.orderdesk.application.dto.NotificationView;
import com.example.orderdesk.application.port.in.NotificationInboxUseCase;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/notifications")
@Tag(name = "Notifications", description = "通知收件匣 API")
public class NotificationController {

    private final NotificationInboxUseCase inbox;

    public NotificationController(NotificationInboxUseCase inbox) {
        this.inbox = inbox;
    }

    @Operation(summary = "我的通知", description = "unreadOnly=true 時只回傳未讀通知")
    @GetMapping
    public Mono<List<NotificationView>> list(
            @RequestHeader("X-User-Id") String userId,
            @RequestParam(defaultValue = "false") boolean unreadOnly) {
        return Blocking.call(() -> inbox.notifications(userId, unreadOnly));
    }

    @Operation(summary = "標記已讀")
    @PostMapping("/{notificationId}/read")
    public Mono<ResponseEntity<Void>> markRead(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable String notificationId) {
        return Blocking.run(() -> inbox.markRead(notificationId, userId))
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }
}
