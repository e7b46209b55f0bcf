package com.library.circulation.repository;

import com.library.circulation.entity.BorrowStatus;
import com.library.circulation.entity.Student;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface StudentRepository extends JpaRepository<Student, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT s FROM Student s WHERE s.id = :id")
    Optional<Student> findByIdForUpdate(@Param("id") Long id);

    /**
     * Blacklisted students with no borrow record in {@code status}. Called with
     * {@code OVERDUE} by reconciliation; the rows come back locked.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("""
        SELECT s FROM Student s
        WHERE s.blacklisted = true
          AND NOT EXISTS (
            SELECT r.id FROM BorrowRecord r WHERE r.student = s AND r.status = :status)
        """)
    List<Student> findBlacklistedWithoutRecordsInStatus(@Param("status") BorrowStatus status);

    Page<Student> findAllByBlacklisted(boolean blacklisted, Pageable pageable);

    boolean existsByAdmissionNumber(String admissionNumber);

    boolean existsByAdmissionNumberAndIdNot(String admissionNumber, Long id);
}
