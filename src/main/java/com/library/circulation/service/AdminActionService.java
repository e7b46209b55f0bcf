package com.library.circulation.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.library.circulation.dto.response.AdminActionResponse;
import com.library.circulation.entity.AdminAction;
import com.library.circulation.mapper.AdminActionMapper;
import com.library.circulation.repository.AdminActionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Map;

/**
 * Persists {@link AdminAction} rows and serves them back for review.
 *
 * <p>{@link #record} runs in its own transaction so that a failed insert cannot mark the
 * caller's transaction rollback-only.
 */
@Service
@RequiredArgsConstructor
public class AdminActionService implements AuditLogWriter {

    private final AdminActionRepository adminActionRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(String adminId, String actionType, String targetType, String targetId,
                       Map<String, Object> details) {
        AdminAction action = new AdminAction();
        action.setAdminId(adminId);
        action.setActionType(actionType);
        action.setTargetType(targetType);
        action.setTargetId(targetId);
        action.setDetails(toJson(details));
        action.setCreatedAt(clock.instant());
        adminActionRepository.save(action);
    }

    /**
     * Lists audit rows, optionally for one target. {@code targetType} and {@code targetId} must
     * be given together or not at all.
     */
    @Transactional(readOnly = true)
    public Page<AdminActionResponse> findAll(String targetType, String targetId, Pageable pageable) {
        if ((targetType == null) != (targetId == null)) {
            throw new IllegalArgumentException("targetType and targetId must be supplied together");
        }
        Page<AdminAction> page = targetType != null
            ? adminActionRepository.findAllByTargetTypeAndTargetId(targetType, targetId, pageable)
            : adminActionRepository.findAll(pageable);
        return page.map(AdminActionMapper::toResponse);
    }

    private String toJson(Map<String, Object> details) {
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise audit details", e);
        }
    }
}
