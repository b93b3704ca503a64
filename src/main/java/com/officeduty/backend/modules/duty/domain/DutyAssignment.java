package com.officeduty.backend.modules.duty.domain;

import java.time.OffsetDateTime;

import com.officeduty.backend.modules.member.domain.Member;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * A duty handed to one member in one rotation cycle. Rows are written by the rotation job;
 * this service only reads them and flips their completion state.
 */
@Entity
@Table(name = "duty_assignments")
public class DutyAssignment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "member_id", nullable = false)
    private Member member;

    @Column(name = "duty_type", nullable = false, length = 20)
    private DutyType dutyType;

    @Column(name = "assigned_at", nullable = false, updatable = false)
    private OffsetDateTime assignedAt;

    @Column(name = "cycle_id", nullable = false)
    private int cycleId;

    @Column(name = "completed", nullable = false)
    private boolean completed;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    protected DutyAssignment() {
    }

    public static DutyAssignment assign(Member member, DutyType dutyType, int cycleId, OffsetDateTime assignedAt) {
        DutyAssignment assignment = new DutyAssignment();
        assignment.member = member;
        assignment.dutyType = dutyType;
        assignment.cycleId = cycleId;
        assignment.assignedAt = assignedAt;
        assignment.completed = false;
        return assignment;
    }

    /**
     * @return {@code false} when the duty was already completed; the first completion time is kept
     */
    public boolean complete(OffsetDateTime now) {
        if (completed) {
            return false;
        }
        completed = true;
        completedAt = now;
        return true;
    }

    /**
     * @return {@code false} when the duty was not completed
     */
    public boolean reopen() {
        if (!completed) {
            return false;
        }
        completed = false;
        completedAt = null;
        return true;
    }

    public Long getId() {
        return id;
    }

    public Member getMember() {
        return member;
    }

    public DutyType getDutyType() {
        return dutyType;
    }

    public OffsetDateTime getAssignedAt() {
        return assignedAt;
    }

    public int getCycleId() {
        return cycleId;
    }

    public boolean isCompleted() {
        return completed;
    }

    public OffsetDateTime getCompletedAt() {
        return completedAt;
    }
}
