package com.library.circulation.dto.request;

import jakarta.validation.constraints.Size;

/**
 * Reason length and admin presence are checked by {@code BlacklistService} so that the
 * rejections carry their own error codes.
 */
public record UnblacklistRequest(

    @Size(max = 2000, message = "Reason must not exceed 2000 characters")
    String reason,

    @Size(max = 64, message = "Admin ID must not exceed 64 characters")
    String adminId
) {}
