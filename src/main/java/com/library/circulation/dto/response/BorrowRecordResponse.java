package com.library.circulation.dto.response;

import com.library.circulation.entity.BorrowStatus;

import java.time.Instant;

public record BorrowRecordResponse(
    Long id,
    Long bookCopyId,
    Long studentId,
    String studentName,
    String studentAdmissionNumber,
    String studentClass,
    String bookTitle,
    String bookAuthor,
    String bookCatalogCode,
    BorrowStatus status,
    Instant borrowDate,
    Instant dueDate,
    Instant returnDate
) {}
