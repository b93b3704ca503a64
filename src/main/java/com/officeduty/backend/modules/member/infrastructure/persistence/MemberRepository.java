package com.officeduty.backend.modules.member.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import jakarta.persistence.LockModeType;

import com.officeduty.backend.modules.member.domain.Member;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MemberRepository extends JpaRepository<Member, Long> {

    boolean existsByUsername(String username);

    boolean existsByUsernameAndIdNot(String username, Long id);

    @Query("""
            select m
              from Member m
             where (:active is null or m.active = :active)
               and (:coffeeDrinkersOnly = false or m.coffeeDrinker = true)
             order by m.id
            """)
    List<Member> findRoster(
            @Param("active") Boolean active,
            @Param("coffeeDrinkersOnly") boolean coffeeDrinkersOnly
    );

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select m from Member m where m.id = :id")
    Optional<Member> findByIdForUpdate(@Param("id") Long id);
}
