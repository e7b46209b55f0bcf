package com.library.circulation.mapper;

import com.library.circulation.dto.response.AdminActionResponse;
import com.library.circulation.entity.AdminAction;

public final class AdminActionMapper {

    private AdminActionMapper() {}

    public static AdminActionResponse toResponse(AdminAction action) {
        return new AdminActionResponse(
            action.getId(),
            action.getAdminId(),
            action.getActionType(),
            action.getTargetType(),
            action.getTargetId(),
            action.getDetails(),
            action.getCreatedAt()
        );
    }
}
