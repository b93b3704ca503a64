package com.officeduty.backend.modules.member.application;

import java.util.List;

import com.officeduty.backend.global.error.ProblemException;
import com.officeduty.backend.modules.member.domain.Member;
import com.officeduty.backend.modules.member.domain.MemberStatus;
import com.officeduty.backend.modules.member.infrastructure.persistence.MemberRepository;
import com.officeduty.backend.modules.member.presentation.dto.CreateMemberRequest;
import com.officeduty.backend.modules.member.presentation.dto.MemberMutationResponse;
import com.officeduty.backend.modules.member.presentation.dto.MemberResponse;
import com.officeduty.backend.modules.member.presentation.dto.MemberStatusFilter;
import com.officeduty.backend.modules.member.presentation.dto.UpdateMemberRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class MemberService {

    private static final Logger log = LoggerFactory.getLogger(MemberService.class);

    private final MemberRepository memberRepository;

    public MemberService(MemberRepository memberRepository) {
        this.memberRepository = memberRepository;
    }

    @Transactional(readOnly = true)
    public List<MemberResponse> getMembers(@NonNull MemberStatusFilter filter, boolean coffeeDrinkersOnly) {
        MemberStatus status = filter.toMemberStatus();
        Boolean active = status != null ? status.isActive() : null;
        return memberRepository.findRoster(active, coffeeDrinkersOnly).stream()
                .map(MemberResponse::from)
                .toList();
    }

    public MemberMutationResponse addMember(@NonNull CreateMemberRequest request) {
        String username = request.username().trim();
        // Inactive members keep their username, so a returning colleague cannot be re-added under it.
        if (memberRepository.existsByUsername(username)) {
            throw usernameTaken(username);
        }

        Member member = Member.create(
                username,
                request.fullName().trim(),
                request.coffeeDrinker() == null || request.coffeeDrinker()
        );
        try {
            memberRepository.saveAndFlush(member);
        } catch (DataIntegrityViolationException ex) {
            throw usernameTaken(username);
        }

        log.info("Added office member {} (id={})", member.getUsername(), member.getId());
        return MemberMutationResponse.of("New member added to the office", activeRoster());
    }

    public MemberMutationResponse updateMember(@NonNull UpdateMemberRequest request) {
        Member member = findMemberForUpdate(request.id());

        if (request.username() != null) {
            String username = request.username().trim();
            if (!username.equals(member.getUsername())
                    && memberRepository.existsByUsernameAndIdNot(username, member.getId())) {
                throw usernameTaken(username);
            }
            member.setUsername(username);
        }
        if (request.fullName() != null) {
            member.setFullName(request.fullName().trim());
        }
        if (request.coffeeDrinker() != null) {
            member.setCoffeeDrinker(request.coffeeDrinker());
        }

        try {
            memberRepository.saveAndFlush(member);
        } catch (DataIntegrityViolationException ex) {
            throw usernameTaken(member.getUsername());
        }

        log.info("Updated office member {} (id={})", member.getUsername(), member.getId());
        return MemberMutationResponse.of("Updated office member", activeRoster());
    }

    public MemberMutationResponse deactivateMember(@NonNull Long memberId) {
        Member member = findMemberForUpdate(memberId);
        if (member.deactivate()) {
            log.info("Deactivated office member {} (id={})", member.getUsername(), memberId);
        } else {
            log.warn("Office member {} (id={}) is already inactive", member.getUsername(), memberId);
        }
        return MemberMutationResponse.of("Deactivated office member", activeRoster());
    }

    private List<MemberResponse> activeRoster() {
        return getMembers(MemberStatusFilter.ACTIVE, false);
    }

    private Member findMemberForUpdate(Long memberId) {
        return memberRepository.findByIdForUpdate(memberId)
                .orElseThrow(() -> ProblemException.notFound("member.not_found",
                        "No member found with id " + memberId));
    }

    private static ProblemException usernameTaken(String username) {
        return ProblemException.conflict("member.username_taken",
                "Username '" + username + "' already exists");
    }
}
