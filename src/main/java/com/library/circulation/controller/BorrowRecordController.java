package com.library.circulation.controller;

import com.library.circulation.dto.request.CreateBorrowRequest;
import com.library.circulation.dto.response.BorrowRecordResponse;
import com.library.circulation.dto.response.PagedResponse;
import com.library.circulation.entity.BorrowStatus;
import com.library.circulation.service.BorrowService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/borrow-records")
@RequiredArgsConstructor
@Tag(name = "Borrowing", description = "Lending and returning book copies")
public class BorrowRecordController {

    private final BorrowService borrowService;

    @PostMapping
    @Operation(summary = "Borrow a book", description = "Allocates an available copy of the book to the student. "
        + "Rejected when the student has late loans or an active blacklist. "
        + "An unknown due period unit falls back to 24 hours.")
    @ApiResponse(responseCode = "201", description = "Copy lent")
    @ApiResponse(responseCode = "400", description = "Validation error, late loans or active blacklist")
    @ApiResponse(responseCode = "404", description = "Student, book or copy not found")
    @ApiResponse(responseCode = "409", description = "No copy available")
    public ResponseEntity<BorrowRecordResponse> borrow(@Valid @RequestBody CreateBorrowRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(borrowService.borrow(request));
    }

    @PatchMapping("/{id}/return")
    @Operation(summary = "Return a book", description = "Closes the loan and makes the copy available again.")
    @ApiResponse(responseCode = "200", description = "Loan closed")
    @ApiResponse(responseCode = "404", description = "Borrow record not found")
    public ResponseEntity<BorrowRecordResponse> returnBook(@PathVariable Long id) {
        return ResponseEntity.ok(borrowService.returnBook(id));
    }

    @GetMapping
    @Operation(summary = "List borrow records", description = "Newest first unless another sort is given.")
    public ResponseEntity<PagedResponse<BorrowRecordResponse>> findAll(
            @Parameter(description = "Filter by student ID") @RequestParam(required = false) Long studentId,
            @Parameter(description = "Filter by book ID") @RequestParam(required = false) Long bookId,
            @Parameter(description = "Filter by status (BORROWED, OVERDUE, RETURNED)") @RequestParam(required = false) BorrowStatus status,
            @PageableDefault(sort = "borrowDate", direction = Sort.Direction.DESC) Pageable pageable) {
        return ResponseEntity.ok(
            PagedResponse.from(borrowService.findAll(studentId, bookId, status, pageable)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get borrow record by ID")
    @ApiResponse(responseCode = "200", description = "Borrow record found")
    @ApiResponse(responseCode = "404", description = "Borrow record not found")
    public ResponseEntity<BorrowRecordResponse> findById(@PathVariable Long id) {
        return ResponseEntity.ok(borrowService.findById(id));
    }
}
