package com.library.circulation.service;

import com.library.circulation.dto.request.UnblacklistRequest;
import com.library.circulation.dto.response.StudentResponse;
import com.library.circulation.entity.AdminAction;
import com.library.circulation.entity.BorrowStatus;
import com.library.circulation.entity.Student;
import com.library.circulation.exception.InvalidUnblacklistReasonException;
import com.library.circulation.exception.MissingAdminException;
import com.library.circulation.exception.ResourceNotFoundException;
import com.library.circulation.exception.StudentNotBlacklistedException;
import com.library.circulation.mapper.StudentMapper;
import com.library.circulation.repository.StudentRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lifts blacklists, either automatically once a student has no overdue loans left, or
 * manually by an admin with a written justification.
 */
@Service
@RequiredArgsConstructor
public class BlacklistService {

    private static final Logger log = LoggerFactory.getLogger(BlacklistService.class);

    static final int MIN_REASON_LENGTH = 10;

    private final StudentRepository studentRepository;
    private final AuditLogWriter auditLogWriter;
    private final Clock clock;

    /**
     * Clears the blacklist of every student who no longer holds an OVERDUE record.
     *
     * @return number of students unblacklisted
     */
    @Transactional
    public int reconcile() {
        List<Student> cleared = studentRepository.findBlacklistedWithoutRecordsInStatus(BorrowStatus.OVERDUE);
        if (cleared.isEmpty()) {
            return 0;
        }

        Instant now = clock.instant();
        for (Student student : cleared) {
            String previous = student.getBlacklistReason() != null
                ? student.getBlacklistReason()
                : "No previous reason";
            student.clearBlacklist("Auto-unblacklisted: all overdue books returned - Previous: " + previous,
                                   null, now);
            log.info("Auto-unblacklisted student {} ({}): no overdue books remaining",
                     student.getId(), student.getAdmissionNumber());
        }
        studentRepository.saveAll(cleared);
        return cleared.size();
    }

    @Transactional
    public StudentResponse manualUnblacklist(Long studentId, UnblacklistRequest request) {
        String reason = request.reason() == null ? "" : request.reason().trim();
        if (reason.length() < MIN_REASON_LENGTH) {
            throw new InvalidUnblacklistReasonException(MIN_REASON_LENGTH);
        }
        String adminId = request.adminId() == null ? "" : request.adminId().trim();
        if (adminId.isEmpty()) {
            throw new MissingAdminException();
        }

        Student student = studentRepository.findByIdForUpdate(studentId)
            .orElseThrow(() -> new ResourceNotFoundException("Student", studentId));
        if (!student.isBlacklisted()) {
            throw new StudentNotBlacklistedException(studentId);
        }

        String previousReason = student.getBlacklistReason();
        Instant previousUntil = student.getBlacklistUntil();
        Instant now = clock.instant();
        student.clearBlacklist(reason, adminId, now);
        Student saved = studentRepository.saveAndFlush(student);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("studentName", saved.getName());
        details.put("studentAdmission", saved.getAdmissionNumber());
        details.put("previousBlacklistReason", previousReason);
        details.put("previousBlacklistUntil", previousUntil == null ? null : previousUntil.toString());
        details.put("unblacklistReason", reason);
        details.put("unblacklistDate", now.toString());
        writeAudit(adminId, saved.getId(), details);

        log.info("Student {} ({}) unblacklisted by admin {}: {}",
                 saved.getId(), saved.getAdmissionNumber(), adminId, reason);
        return StudentMapper.toResponse(saved);
    }

    private void writeAudit(String adminId, Long studentId, Map<String, Object> details) {
        try {
            auditLogWriter.record(adminId, AdminAction.ACTION_UNBLACKLIST, AdminAction.TARGET_STUDENT,
                                  String.valueOf(studentId), details);
        } catch (RuntimeException e) {
            log.warn("Failed to write audit entry for unblacklist of student {} by admin {}",
                     studentId, adminId, e);
        }
    }
}
