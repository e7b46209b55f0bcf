package com.library.circulation.service;

import java.util.Map;

/**
 * Sink for administrative audit entries.
 *
 * <p>Writes are best-effort. Implementations may throw; callers log and discard the failure
 * so that the action being audited still completes.
 */
public interface AuditLogWriter {

    void record(String adminId, String actionType, String targetType, String targetId,
                Map<String, Object> details);
}
