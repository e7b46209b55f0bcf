package com.library.circulation.controller;

import com.library.circulation.dto.response.SweepResultResponse;
import com.library.circulation.service.OverdueSweepService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/overdue-sweeps")
@RequiredArgsConstructor
@Tag(name = "Overdue sweep", description = "Overdue promotion and blacklist maintenance")
public class OverdueSweepController {

    private final OverdueSweepService overdueSweepService;

    @PostMapping
    @Operation(summary = "Run the overdue sweep", description = "Promotes late loans past the grace period, "
        + "blacklists students by severity and clears students with no overdue loans. Safe to repeat.")
    public ResponseEntity<SweepResultResponse> sweep() {
        return ResponseEntity.ok(overdueSweepService.sweep());
    }
}
