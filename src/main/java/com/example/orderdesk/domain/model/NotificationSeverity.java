package com.example.orderdesk.domain.model;

public enum NotificationSeverity {
    INFO,
    SUCCESS,
    WARNING,
    CRITICAL
}
