package com.officeduty.backend.modules.duty.presentation;

import jakarta.validation.Valid;

import com.officeduty.backend.global.error.ProblemException;
import com.officeduty.backend.modules.duty.application.DutyService;
import com.officeduty.backend.modules.duty.domain.DutyType;
import com.officeduty.backend.modules.duty.presentation.dto.DutyCompletionRequest;
import com.officeduty.backend.modules.duty.presentation.dto.DutyCompletionResponse;
import com.officeduty.backend.modules.duty.presentation.dto.DutyListResponse;
import com.officeduty.backend.modules.duty.presentation.dto.RecentDutyResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/duties")
public class DutyController {

    private final DutyService dutyService;

    public DutyController(DutyService dutyService) {
        this.dutyService = dutyService;
    }

    @Operation(
            summary = "List duty assignments",
            description = "Newest first, members that are still active only. `limit` defaults to 100."
    )
    @GetMapping
    public ResponseEntity<DutyListResponse> getDuties(
            @RequestParam(name = "limit", required = false) String limit
    ) {
        return ResponseEntity.ok(DutyListResponse.of(dutyService.getDuties(parseLimit(limit))));
    }

    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Duty completed (or already was), refreshed list returned"),
            @ApiResponse(responseCode = "404", description = "No assignment with that id and duty type")
    })
    @PostMapping("/complete")
    public ResponseEntity<DutyCompletionResponse> completeDuty(@Valid @RequestBody DutyCompletionRequest request) {
        return ResponseEntity.ok(dutyService.completeDuty(request));
    }

    @PostMapping("/uncomplete")
    public ResponseEntity<DutyCompletionResponse> uncompleteDuty(@Valid @RequestBody DutyCompletionRequest request) {
        return ResponseEntity.ok(dutyService.uncompleteDuty(request));
    }

    @Operation(summary = "Most recent assignment for one duty type")
    @GetMapping("/recent")
    public ResponseEntity<RecentDutyResponse> getRecentDuty(
            @RequestParam(name = "duty_type") String dutyType
    ) {
        DutyType type = DutyType.fromValue(dutyType)
                .orElseThrow(() -> ProblemException.invalid("duty_type", "Invalid duty_type " + dutyType));
        return ResponseEntity.ok(new RecentDutyResponse(dutyService.getMostRecentDuty(type)));
    }

    private int parseLimit(String limit) {
        if (limit == null || limit.isBlank()) {
            return DutyService.DEFAULT_LIMIT;
        }
        try {
            return Integer.parseInt(limit.trim());
        } catch (NumberFormatException ex) {
            throw ProblemException.invalid("limit", "limit must be a positive integer");
        }
    }
}
