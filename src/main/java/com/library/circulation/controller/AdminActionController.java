package com.library.circulation.controller;

import com.library.circulation.dto.response.AdminActionResponse;
import com.library.circulation.dto.response.PagedResponse;
import com.library.circulation.service.AdminActionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin-actions")
@RequiredArgsConstructor
@Tag(name = "Admin actions", description = "Audit log of administrative actions")
public class AdminActionController {

    private final AdminActionService adminActionService;

    @GetMapping
    @Operation(summary = "List admin actions", description = "Filters apply only when both target type and ID are given.")
    public ResponseEntity<PagedResponse<AdminActionResponse>> findAll(
            @Parameter(description = "Target type, e.g. student") @RequestParam(required = false) String targetType,
            @Parameter(description = "Target ID") @RequestParam(required = false) String targetId,
            @PageableDefault(sort = "createdAt", direction = Sort.Direction.DESC) Pageable pageable) {
        return ResponseEntity.ok(PagedResponse.from(adminActionService.findAll(targetType, targetId, pageable)));
    }
}
