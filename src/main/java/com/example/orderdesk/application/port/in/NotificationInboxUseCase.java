package com.example.orderdesk.application.port.in;

import com.example.orderdesk.application.dto.NotificationView;

import java.util.List;

public interface NotificationInboxUseCase {

    List<NotificationView> notifications(String userId, boolean unreadOnly);

    void markRead(String notificationId, String userId);
}
