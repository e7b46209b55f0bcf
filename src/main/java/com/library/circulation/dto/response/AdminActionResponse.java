package com.library.circulation.dto.response;

import java.time.Instant;

public record AdminActionResponse(
    Long id,
    String adminId,
    String actionType,
    String targetType,
    String targetId,
    String details,
    Instant createdAt
) {}
