package com.library.circulation.mapper;

import com.library.circulation.dto.response.BorrowRecordResponse;
import com.library.circulation.entity.BorrowRecord;

/**
 * Names and titles come from the snapshot columns, not the live associations, so the
 * response reflects the loan as it was made. Only the ids are read through the lazy
 * associations, which does not initialise them.
 */
public final class BorrowRecordMapper {

    private BorrowRecordMapper() {}

    public static BorrowRecordResponse toResponse(BorrowRecord record) {
        return new BorrowRecordResponse(
            record.getId(),
            record.getBookCopy().getId(),
            record.getStudent().getId(),
            record.getStudentName(),
            record.getStudentAdmissionNumber(),
            record.getStudentClass(),
            record.getBookTitle(),
            record.getBookAuthor(),
            record.getBookCatalogCode(),
            record.getStatus(),
            record.getBorrowDate(),
            record.getDueDate(),
            record.getReturnDate()
        );
    }
}
