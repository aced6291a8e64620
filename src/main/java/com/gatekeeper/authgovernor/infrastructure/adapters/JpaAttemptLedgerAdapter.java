package com.gatekeeper.authgovernor.infrastructure.adapters;

import com.gatekeeper.authgovernor.domain.AttemptRecord;
import com.gatekeeper.authgovernor.domain.AttemptResult;
import com.gatekeeper.authgovernor.domain.AttemptType;
import com.gatekeeper.authgovernor.domain.ports.AttemptLedger;
import com.gatekeeper.authgovernor.infrastructure.jpa.SpringAttemptRecordRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;

@Component
public class JpaAttemptLedgerAdapter implements AttemptLedger {
    private final SpringAttemptRecordRepository attempts;

    public JpaAttemptLedgerAdapter(SpringAttemptRecordRepository attempts) {
        this.attempts = attempts;
    }

    @Override
    public AttemptRecord append(AttemptRecord attempt) {
        attempts.save(SecurityRecordMapper.toEntity(attempt));
        return attempt;
    }

    @Override
    public long countFailedSince(String phoneNumber, AttemptType attemptType, OffsetDateTime since) {
        return attempts.countSince(phoneNumber, attemptType, AttemptResult.FAILED, since);
    }

    @Override
    public List<AttemptRecord> findRecentFailed(String phoneNumber, AttemptType attemptType, int limit) {
        return attempts.findByPhoneNumberAndAttemptTypeAndResultOrderByAttemptedAtDesc(
                        phoneNumber, attemptType, AttemptResult.FAILED, PageRequest.of(0, limit))
                .stream()
                .map(SecurityRecordMapper::toDomain)
                .toList();
    }

    @Override
    @Transactional
    public int purgeOlderThan(OffsetDateTime cutoff) {
        return attempts.deleteOlderThan(cutoff);
    }
}
