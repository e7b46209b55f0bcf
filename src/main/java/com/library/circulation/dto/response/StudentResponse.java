package com.library.circulation.dto.response;

import java.time.Instant;

public record StudentResponse(
    Long id,
    String name,
    String admissionNumber,
    String email,
    String className,
    boolean blacklisted,
    Instant blacklistUntil,
    String blacklistReason,
    String unblacklistReason,
    Instant unblacklistDate,
    String unblacklistAdminId,
    Instant createdAt,
    Instant updatedAt
) {}
