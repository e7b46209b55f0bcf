package com.library.circulation.service;

import com.library.circulation.config.CirculationProperties;
import com.library.circulation.dto.response.SweepResultResponse;
import com.library.circulation.entity.BorrowRecord;
import com.library.circulation.entity.BorrowStatus;
import com.library.circulation.entity.Student;
import com.library.circulation.repository.BorrowRecordRepository;
import com.library.circulation.repository.OverdueSummary;
import com.library.circulation.repository.StudentRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Promotes late loans to OVERDUE, blacklists the students holding them and finally lets
 * {@link BlacklistService#reconcile()} clear students with nothing overdue left.
 *
 * <p>Every step is guarded by a state predicate (only BORROWED records are promoted, only
 * non-blacklisted students are classified, only blacklisted students are reconciled), so a
 * second run with no intervening writes changes nothing. A run that fails part way is rolled
 * back as a whole and can simply be invoked again.
 *
 * <p>Always runs in a transaction of its own, including when triggered from inside a borrow.
 */
@Service
@RequiredArgsConstructor
public class OverdueSweepService {

    private static final Logger log = LoggerFactory.getLogger(OverdueSweepService.class);

    private final BorrowRecordRepository borrowRecordRepository;
    private final StudentRepository studentRepository;
    private final BlacklistService blacklistService;
    private final CirculationProperties properties;
    private final Clock clock;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public SweepResultResponse sweep() {
        Instant now = clock.instant();

        int promoted = promoteOverdueRecords(now);
        int blacklisted = blacklistOverdueStudents(now);
        int unblacklisted = blacklistService.reconcile();

        SweepResultResponse result = new SweepResultResponse(promoted, blacklisted, unblacklisted);
        if (result.hasEffects()) {
            log.info("Overdue sweep: {} records promoted, {} students blacklisted, {} students unblacklisted",
                     promoted, blacklisted, unblacklisted);
        }
        return result;
    }

    private int promoteOverdueRecords(Instant now) {
        Instant cutoff = now.minus(properties.gracePeriod());
        List<BorrowRecord> late = borrowRecordRepository
            .findAllByStatusAndDueDateBeforeForUpdate(BorrowStatus.BORROWED, cutoff);
        for (BorrowRecord record : late) {
            record.setStatus(BorrowStatus.OVERDUE);
        }
        borrowRecordRepository.saveAll(late);
        return late.size();
    }

    private int blacklistOverdueStudents(Instant now) {
        List<OverdueSummary> summaries =
            borrowRecordRepository.summarizeByStudentForNonBlacklisted(BorrowStatus.OVERDUE);

        int blacklisted = 0;
        for (OverdueSummary summary : summaries) {
            long maxDaysOverdue = Math.max(0, Duration.between(summary.earliestDueDate(), now).toDays());
            SeverityTier tier = SeverityTier.classify(summary.overdueCount(), maxDaysOverdue);

            if (tier == SeverityTier.LOW && !properties.blacklist().enforceLowTier()) {
                log.debug("Student {} has {} overdue book(s), max {} days, below blacklist threshold",
                          summary.studentId(), summary.overdueCount(), maxDaysOverdue);
                continue;
            }

            Student student = studentRepository.findByIdForUpdate(summary.studentId()).orElse(null);
            // Blacklisted by a concurrent sweep after the summary was read.
            if (student == null || student.isBlacklisted()) {
                continue;
            }

            student.blacklist(now.plus(tier.blacklistDuration()),
                              blacklistReason(tier, summary.overdueCount(), maxDaysOverdue));
            studentRepository.save(student);
            blacklisted++;

            log.info("Blacklisted student {} ({}) for {} days - {} severity",
                     student.getId(), student.getAdmissionNumber(),
                     tier.blacklistDuration().toDays(), tier.label());
        }
        return blacklisted;
    }

    static String blacklistReason(SeverityTier tier, long overdueCount, long maxDaysOverdue) {
        return String.format("Automatic blacklist due to overdue books - %s severity "
                + "(%d books, max %d days overdue) - %d day suspension",
            tier.label(), overdueCount, maxDaysOverdue, tier.blacklistDuration().toDays());
    }
}
