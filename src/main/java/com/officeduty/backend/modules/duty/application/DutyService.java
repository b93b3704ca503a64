package com.officeduty.backend.modules.duty.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

import com.officeduty.backend.global.error.ProblemException;
import com.officeduty.backend.modules.duty.domain.DutyAssignment;
import com.officeduty.backend.modules.duty.domain.DutyType;
import com.officeduty.backend.modules.duty.infrastructure.persistence.DutyAssignmentRepository;
import com.officeduty.backend.modules.duty.presentation.dto.DutyCompletionRequest;
import com.officeduty.backend.modules.duty.presentation.dto.DutyCompletionResponse;
import com.officeduty.backend.modules.duty.presentation.dto.DutyDtoMapper;
import com.officeduty.backend.modules.duty.presentation.dto.DutyResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class DutyService {

    public static final int DEFAULT_LIMIT = 100;

    private static final Logger log = LoggerFactory.getLogger(DutyService.class);

    private final DutyAssignmentRepository dutyAssignmentRepository;
    private final Clock clock;

    public DutyService(DutyAssignmentRepository dutyAssignmentRepository, Clock clock) {
        this.dutyAssignmentRepository = dutyAssignmentRepository;
        this.clock = clock;
    }

    /**
     * Newest assignments first, restricted to members that are still active.
     */
    @Transactional(readOnly = true)
    public List<DutyResponse> getDuties(int limit) {
        if (limit <= 0) {
            throw ProblemException.invalid("limit", "limit must be a positive integer");
        }
        List<DutyResponse> duties = dutyAssignmentRepository.findLatestForActiveMembers(PageRequest.of(0, limit))
                .stream()
                .map(DutyDtoMapper::toResponse)
                .toList();
        log.debug("Retrieved {} duties (limit={})", duties.size(), limit);
        return duties;
    }

    public DutyCompletionResponse completeDuty(@NonNull DutyCompletionRequest request) {
        DutyAssignment assignment = findAssignmentForUpdate(request);
        if (assignment.complete(OffsetDateTime.now(clock))) {
            log.info("Marked {} duty {} as completed", assignment.getDutyType().getValue(), assignment.getId());
        } else {
            log.warn("{} duty {} is already completed", assignment.getDutyType().getValue(), assignment.getId());
        }
        return DutyCompletionResponse.of("Duty marked as completed successfully", getDuties(DEFAULT_LIMIT));
    }

    public DutyCompletionResponse uncompleteDuty(@NonNull DutyCompletionRequest request) {
        DutyAssignment assignment = findAssignmentForUpdate(request);
        if (assignment.reopen()) {
            log.info("Marked {} duty {} as uncompleted", assignment.getDutyType().getValue(), assignment.getId());
        } else {
            log.warn("{} duty {} is already uncompleted", assignment.getDutyType().getValue(), assignment.getId());
        }
        return DutyCompletionResponse.of("Duty marked as uncompleted successfully", getDuties(DEFAULT_LIMIT));
    }

    @Transactional(readOnly = true)
    public DutyResponse getMostRecentDuty(@NonNull DutyType dutyType) {
        return dutyAssignmentRepository.findLatestByDutyType(dutyType, PageRequest.of(0, 1)).stream()
                .findFirst()
                .map(DutyDtoMapper::toResponse)
                .orElseThrow(() -> ProblemException.notFound("duty.not_found",
                        "No " + dutyType.getValue() + " duty found"));
    }

    private DutyAssignment findAssignmentForUpdate(DutyCompletionRequest request) {
        long dutyId = parseDutyId(request.dutyId());
        DutyType dutyType = DutyType.fromValue(request.dutyType())
                .orElseThrow(() -> ProblemException.invalid("duty_type", "must be one of: coffee, fridge"));
        return dutyAssignmentRepository.findByIdAndDutyTypeForUpdate(dutyId, dutyType)
                .orElseThrow(() -> ProblemException.notFound("duty.not_found",
                        "No " + dutyType.getValue() + " duty found with id " + dutyId));
    }

    private static long parseDutyId(String raw) {
        long dutyId;
        try {
            dutyId = Long.parseLong(raw == null ? "" : raw.trim());
        } catch (NumberFormatException ex) {
            throw ProblemException.invalid("duty_id", "must be a positive integer");
        }
        if (dutyId <= 0) {
            throw ProblemException.invalid("duty_id", "must be a positive integer");
        }
        return dutyId;
    }
}
