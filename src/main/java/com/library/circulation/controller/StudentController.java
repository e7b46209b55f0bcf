package com.library.circulation.controller;

import com.library.circulation.dto.request.CreateStudentRequest;
import com.library.circulation.dto.request.UnblacklistRequest;
import com.library.circulation.dto.request.UpdateStudentRequest;
import com.library.circulation.dto.response.PagedResponse;
import com.library.circulation.dto.response.StudentResponse;
import com.library.circulation.service.BlacklistService;
import com.library.circulation.service.StudentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/students")
@RequiredArgsConstructor
@Tag(name = "Students", description = "Student records and blacklist administration")
public class StudentController {

    private final StudentService studentService;
    private final BlacklistService blacklistService;

    @GetMapping
    @Operation(summary = "List students")
    public ResponseEntity<PagedResponse<StudentResponse>> findAll(
            @Parameter(description = "Filter by blacklist flag") @RequestParam(required = false) Boolean blacklisted,
            Pageable pageable) {
        return ResponseEntity.ok(PagedResponse.from(studentService.findAll(blacklisted, pageable)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get student by ID")
    @ApiResponse(responseCode = "200", description = "Student found")
    @ApiResponse(responseCode = "404", description = "Student not found")
    public ResponseEntity<StudentResponse> findById(@PathVariable Long id) {
        return ResponseEntity.ok(studentService.findById(id));
    }

    @PostMapping
    @Operation(summary = "Register a student", description = "Admission number must be unique.")
    @ApiResponse(responseCode = "201", description = "Student created")
    @ApiResponse(responseCode = "409", description = "Admission number already exists")
    public ResponseEntity<StudentResponse> create(@Valid @RequestBody CreateStudentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(studentService.create(request));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update a student", description = "Partial update; null fields are ignored.")
    public ResponseEntity<StudentResponse> update(@PathVariable Long id,
                                                  @Valid @RequestBody UpdateStudentRequest request) {
        return ResponseEntity.ok(studentService.update(id, request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a student", description = "Returns 409 if the student has borrowing history.")
    @ApiResponse(responseCode = "204", description = "Student deleted")
    @ApiResponse(responseCode = "409", description = "Student has borrowing history")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        studentService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/unblacklist")
    @Operation(summary = "Manually lift a blacklist", description = "Requires an admin ID and a reason of at "
        + "least 10 characters. The action is written to the admin audit log.")
    @ApiResponse(responseCode = "200", description = "Blacklist lifted")
    @ApiResponse(responseCode = "400", description = "Reason too short, admin missing or student not blacklisted")
    @ApiResponse(responseCode = "404", description = "Student not found")
    public ResponseEntity<StudentResponse> unblacklist(@PathVariable Long id,
                                                       @Valid @RequestBody UnblacklistRequest request) {
        return ResponseEntity.ok(blacklistService.manualUnblacklist(id, request));
    }
}
