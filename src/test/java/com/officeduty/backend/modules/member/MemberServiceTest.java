package com.officeduty.backend.modules.member;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;

import com.officeduty.backend.global.error.ProblemException;
import com.officeduty.backend.modules.member.application.MemberService;
import com.officeduty.backend.modules.member.domain.Member;
import com.officeduty.backend.modules.member.domain.MemberStatus;
import com.officeduty.backend.modules.member.infrastructure.persistence.MemberRepository;
import com.officeduty.backend.modules.member.presentation.dto.CreateMemberRequest;
import com.officeduty.backend.modules.member.presentation.dto.MemberMutationResponse;
import com.officeduty.backend.modules.member.presentation.dto.UpdateMemberRequest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class MemberServiceTest {

    @Mock
    private MemberRepository memberRepository;

    private MemberService memberService;

    @BeforeEach
    void setUp() {
        memberService = new MemberService(memberRepository);
    }

    @Test
    void addMemberRejectsTakenUsernameWithoutSaving() {
        when(memberRepository.existsByUsername("alice")).thenReturn(true);

        assertThatThrownBy(() -> memberService.addMember(new CreateMemberRequest(" alice ", "Alice", true)))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> {
                    ProblemException problem = (ProblemException) ex;
                    assertThat(problem.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(problem.getCode()).isEqualTo("member.username_taken");
                });
        verify(memberRepository, never()).saveAndFlush(any(Member.class));
    }

    @Test
    void addMemberMapsConcurrentUniqueViolationToConflict() {
        when(memberRepository.existsByUsername("bob")).thenReturn(false);
        when(memberRepository.saveAndFlush(any(Member.class)))
                .thenThrow(new DataIntegrityViolationException("uq_members_username"));

        assertThatThrownBy(() -> memberService.addMember(new CreateMemberRequest("bob", "Bob Baker", null)))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getDetailMessage())
                        .isEqualTo("Username 'bob' already exists"));
    }

    @Test
    void addMemberTrimsAndDefaultsCoffeeDrinker() {
        when(memberRepository.existsByUsername("dave")).thenReturn(false);
        when(memberRepository.saveAndFlush(any(Member.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(memberRepository.findRoster(true, false)).thenReturn(List.of());

        MemberMutationResponse response = memberService.addMember(new CreateMemberRequest("dave ", " Dave Diaz ", null));

        assertThat(response.success()).isTrue();
        ArgumentCaptor<Member> captor = ArgumentCaptor.forClass(Member.class);
        verify(memberRepository).saveAndFlush(captor.capture());
        Member saved = captor.getValue();
        assertThat(saved.getUsername()).isEqualTo("dave");
        assertThat(saved.getFullName()).isEqualTo("Dave Diaz");
        assertThat(saved.isCoffeeDrinker()).isTrue();
        assertThat(saved.isActive()).isTrue();
    }

    @Test
    void updateMemberTrimsProvidedFullName() {
        Member alice = member(1L, "alice");
        alice.setFullName("Alice Archer");
        when(memberRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(alice));
        when(memberRepository.saveAndFlush(alice)).thenReturn(alice);
        when(memberRepository.findRoster(true, false)).thenReturn(List.of(alice));

        memberService.updateMember(new UpdateMemberRequest(1L, null, "  Alice B. Archer ", null));

        assertThat(alice.getFullName()).isEqualTo("Alice B. Archer");
        assertThat(alice.getUsername()).isEqualTo("alice");
    }

    @Test
    void updateMemberKeepingOwnUsernameSkipsUniquenessCheck() {
        Member alice = member(1L, "alice");
        when(memberRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(alice));
        when(memberRepository.saveAndFlush(alice)).thenReturn(alice);
        when(memberRepository.findRoster(true, false)).thenReturn(List.of(alice));

        MemberMutationResponse response = memberService.updateMember(new UpdateMemberRequest(1L, "alice", "Alice A.", false));

        assertThat(response.members()).singleElement()
                .satisfies(m -> {
                    assertThat(m.fullName()).isEqualTo("Alice A.");
                    assertThat(m.coffeeDrinker()).isFalse();
                });
        verify(memberRepository, never()).existsByUsernameAndIdNot(any(), any());
    }

    @Test
    void deactivateIsIdempotent() {
        Member carol = member(3L, "carol");
        carol.deactivate();
        when(memberRepository.findByIdForUpdate(3L)).thenReturn(Optional.of(carol));
        when(memberRepository.findRoster(true, false)).thenReturn(List.of());

        MemberMutationResponse response = memberService.deactivateMember(3L);

        assertThat(response.success()).isTrue();
        assertThat(carol.getStatus()).isEqualTo(MemberStatus.INACTIVE);
    }

    @Test
    void deactivateUnknownMemberIsNotFound() {
        when(memberRepository.findByIdForUpdate(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> memberService.deactivateMember(99L))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getCode()).isEqualTo("member.not_found"));
        verify(memberRepository, never()).findRoster(any(), anyBoolean());
    }

    private static Member member(Long id, String username) {
        Member member = Member.create(username, null, true);
        ReflectionTestUtils.setField(member, "id", id);
        return member;
    }
}
