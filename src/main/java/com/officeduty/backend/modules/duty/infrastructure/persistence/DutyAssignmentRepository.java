package com.officeduty.backend.modules.duty.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import jakarta.persistence.LockModeType;

import com.officeduty.backend.modules.duty.domain.DutyAssignment;
import com.officeduty.backend.modules.duty.domain.DutyType;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DutyAssignmentRepository extends JpaRepository<DutyAssignment, Long> {

    @Query("""
            select da
              from DutyAssignment da
              join fetch da.member m
             where m.active = true
             order by da.assignedAt desc, da.id desc
            """)
    List<DutyAssignment> findLatestForActiveMembers(Pageable pageable);

    @Query("""
            select da
              from DutyAssignment da
              join fetch da.member
             where da.dutyType = :dutyType
             order by da.assignedAt desc, da.id desc
            """)
    List<DutyAssignment> findLatestByDutyType(@Param("dutyType") DutyType dutyType, Pageable pageable);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select da
              from DutyAssignment da
             where da.id = :id
               and da.dutyType = :dutyType
            """)
    Optional<DutyAssignment> findByIdAndDutyTypeForUpdate(
            @Param("id") Long id,
            @Param("dutyType") DutyType dutyType
    );
}
