package com.library.circulation.repository;

import com.library.circulation.entity.AdminAction;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AdminActionRepository extends JpaRepository<AdminAction, Long> {

    Page<AdminAction> findAllByTargetTypeAndTargetId(String targetType, String targetId, Pageable pageable);
}
