package com.library.circulation.controller.handler;

import com.library.circulation.dto.response.ErrorResponse;
import com.library.circulation.exception.CirculationException;
import com.library.circulation.exception.DuplicateAdmissionNumberException;
import com.library.circulation.exception.DuplicateCatalogCodeException;
import com.library.circulation.exception.HasOverdueBooksException;
import com.library.circulation.exception.InvalidUnblacklistReasonException;
import com.library.circulation.exception.LoanHistoryExistsException;
import com.library.circulation.exception.MissingAdminException;
import com.library.circulation.exception.NoAvailableCopyException;
import com.library.circulation.exception.ResourceNotFoundException;
import com.library.circulation.exception.StudentBlacklistedException;
import com.library.circulation.exception.StudentNotBlacklistedException;
import jakarta.servlet.http.HttpServletRequest;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException ex,
                                                        HttpServletRequest request) {
        return rejection(HttpStatus.NOT_FOUND, ex, request);
    }

    @ExceptionHandler({
        HasOverdueBooksException.class,
        StudentBlacklistedException.class,
        InvalidUnblacklistReasonException.class,
        MissingAdminException.class,
        StudentNotBlacklistedException.class
    })
    public ResponseEntity<ErrorResponse> handleRejected(CirculationException ex,
                                                        HttpServletRequest request) {
        return rejection(HttpStatus.BAD_REQUEST, ex, request);
    }

    @ExceptionHandler({
        NoAvailableCopyException.class,
        LoanHistoryExistsException.class,
        DuplicateCatalogCodeException.class,
        DuplicateAdmissionNumberException.class
    })
    public ResponseEntity<ErrorResponse> handleConflict(CirculationException ex,
                                                        HttpServletRequest request) {
        return rejection(HttpStatus.CONFLICT, ex, request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex,
                                                          HttpServletRequest request) {
        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult().getFieldErrors()
            .stream()
            .map(fe -> new ErrorResponse.FieldError(fe.getField(), fe.getDefaultMessage()))
            .toList();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(
            new ErrorResponse(400, "Bad Request", "VALIDATION_FAILED", "Validation failed",
                              Instant.now(), request.getRequestURI(), fieldErrors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex,
                                                          HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(
            new ErrorResponse(400, "Bad Request", "MALFORMED_REQUEST", "Malformed request body",
                              Instant.now(), request.getRequestURI()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                            HttpServletRequest request) {
        String msg = String.format("Invalid value '%s' for parameter '%s'",
                                   ex.getValue(), ex.getName());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(
            new ErrorResponse(400, "Bad Request", "INVALID_PARAMETER", msg,
                              Instant.now(), request.getRequestURI()));
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrity(DataIntegrityViolationException ex,
                                                             HttpServletRequest request) {
        String constraintName = extractConstraintName(ex);
        if ("idx_borrow_records_open_copy".equals(constraintName)) {
            return conflict("NO_AVAILABLE_COPY", "Copy is already on loan", request);
        }
        if ("uq_book_copies_catalog_code".equals(constraintName)) {
            return conflict("DUPLICATE_CATALOG_CODE", "Catalog code already exists", request);
        }
        if ("uq_students_admission_number".equals(constraintName)) {
            return conflict("DUPLICATE_ADMISSION_NUMBER", "Admission number already exists", request);
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(
            new ErrorResponse(400, "Bad Request", "DATA_INTEGRITY_VIOLATION", "Data integrity violation",
                              Instant.now(), request.getRequestURI()));
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLock(ObjectOptimisticLockingFailureException ex,
                                                              HttpServletRequest request) {
        return conflict("CONCURRENT_MODIFICATION",
                        "Resource was modified by another request. Please retry.", request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex,
                                                               HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(
            new ErrorResponse(400, "Bad Request", "INVALID_ARGUMENT", ex.getMessage(),
                              Instant.now(), request.getRequestURI()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneral(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {}", request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
            new ErrorResponse(500, "Internal Server Error", "INTERNAL_ERROR", "An unexpected error occurred",
                              Instant.now(), request.getRequestURI()));
    }

    private ResponseEntity<ErrorResponse> rejection(HttpStatus status, CirculationException ex,
                                                    HttpServletRequest request) {
        return ResponseEntity.status(status).body(
            new ErrorResponse(status.value(), status.getReasonPhrase(), ex.getCode(), ex.getMessage(),
                              Instant.now(), request.getRequestURI()));
    }

    private ResponseEntity<ErrorResponse> conflict(String code, String message, HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(
            new ErrorResponse(409, "Conflict", code, message, Instant.now(), request.getRequestURI()));
    }

    private String extractConstraintName(DataIntegrityViolationException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof ConstraintViolationException cve) {
            return cve.getConstraintName();
        }
        return null;
    }
}
