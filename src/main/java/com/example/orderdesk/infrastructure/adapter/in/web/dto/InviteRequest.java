package com.example.orderdesk.infrastructure.adapter.in.web.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record InviteRequest(
        @NotEmpty(message = "At least one writer id is required")
        List<String> writerIds
) {}
