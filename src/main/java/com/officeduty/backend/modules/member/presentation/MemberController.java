package com.officeduty.backend.modules.member.presentation;

import jakarta.validation.Valid;

import com.officeduty.backend.global.error.ProblemException;
import com.officeduty.backend.modules.member.application.MemberService;
import com.officeduty.backend.modules.member.presentation.dto.CreateMemberRequest;
import com.officeduty.backend.modules.member.presentation.dto.MemberIdRequest;
import com.officeduty.backend.modules.member.presentation.dto.MemberListResponse;
import com.officeduty.backend.modules.member.presentation.dto.MemberMutationResponse;
import com.officeduty.backend.modules.member.presentation.dto.MemberStatusFilter;
import com.officeduty.backend.modules.member.presentation.dto.UpdateMemberRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/members")
public class MemberController {

    private final MemberService memberService;

    public MemberController(MemberService memberService) {
        this.memberService = memberService;
    }

    @Operation(
            summary = "List office members",
            description = "Active members by default; `status=all` includes deactivated members."
    )
    @GetMapping
    public ResponseEntity<MemberListResponse> getMembers(
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "coffee_drinkers_only", defaultValue = "false") boolean coffeeDrinkersOnly
    ) {
        MemberStatusFilter filter;
        try {
            filter = MemberStatusFilter.from(status);
        } catch (IllegalArgumentException ex) {
            throw ProblemException.invalid("status", ex.getMessage());
        }
        return ResponseEntity.ok(new MemberListResponse(memberService.getMembers(filter, coffeeDrinkersOnly)));
    }

    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Member added, active roster returned"),
            @ApiResponse(responseCode = "409", description = "Username already taken by an active or inactive member")
    })
    @PostMapping
    public ResponseEntity<MemberMutationResponse> addMember(@Valid @RequestBody CreateMemberRequest request) {
        return ResponseEntity.ok(memberService.addMember(request));
    }

    @PutMapping
    public ResponseEntity<MemberMutationResponse> updateMember(@Valid @RequestBody UpdateMemberRequest request) {
        return ResponseEntity.ok(memberService.updateMember(request));
    }

    @Operation(
            summary = "Deactivate an office member",
            description = "Soft delete: the member stays in the database so past duties keep their owner."
    )
    @DeleteMapping
    public ResponseEntity<MemberMutationResponse> deactivateMember(@Valid @RequestBody MemberIdRequest request) {
        return ResponseEntity.ok(memberService.deactivateMember(request.id()));
    }
}
