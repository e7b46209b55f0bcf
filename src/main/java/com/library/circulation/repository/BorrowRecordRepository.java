package com.library.circulation.repository;

import com.library.circulation.entity.BorrowRecord;
import com.library.circulation.entity.BorrowStatus;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface BorrowRecordRepository extends JpaRepository<BorrowRecord, Long>,
        JpaSpecificationExecutor<BorrowRecord> {

    boolean existsByStudentIdAndStatusAndDueDateBefore(Long studentId, BorrowStatus status, Instant instant);

    boolean existsByStudentId(Long studentId);

    boolean existsByBookCopyBookId(Long bookId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT r FROM BorrowRecord r WHERE r.id = :id")
    Optional<BorrowRecord> findByIdForUpdate(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT r FROM BorrowRecord r WHERE r.status = :status AND r.dueDate < :cutoff")
    List<BorrowRecord> findAllByStatusAndDueDateBeforeForUpdate(@Param("status") BorrowStatus status,
                                                                @Param("cutoff") Instant cutoff);

    @Query("""
        SELECT new com.library.circulation.repository.OverdueSummary(
                   r.student.id, COUNT(r), MIN(r.dueDate))
        FROM BorrowRecord r
        WHERE r.status = :status AND r.student.blacklisted = false
        GROUP BY r.student.id
        """)
    List<OverdueSummary> summarizeByStudentForNonBlacklisted(@Param("status") BorrowStatus status);
}
