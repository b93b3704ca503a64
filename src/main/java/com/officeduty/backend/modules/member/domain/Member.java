package com.officeduty.backend.modules.member.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Office member who can be assigned duties. Members are never deleted, only deactivated, so that
 * past assignments keep their owner.
 */
@Entity
@Table(name = "members")
public class Member {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "username", nullable = false, unique = true, length = 50)
    private String username;

    @Column(name = "full_name", length = 100)
    private String fullName;

    @Column(name = "coffee_drinker", nullable = false)
    private boolean coffeeDrinker = true;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    protected Member() {
    }

    public static Member create(String username, String fullName, boolean coffeeDrinker) {
        Member member = new Member();
        member.username = username;
        member.fullName = fullName;
        member.coffeeDrinker = coffeeDrinker;
        member.active = true;
        return member;
    }

    /**
     * @return {@code false} when the member was already inactive
     */
    public boolean deactivate() {
        if (!active) {
            return false;
        }
        active = false;
        return true;
    }

    public MemberStatus getStatus() {
        return MemberStatus.fromActiveFlag(active);
    }

    public String getDisplayName() {
        return fullName != null && !fullName.isBlank() ? fullName : username;
    }

    public Long getId() {
        return id;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getFullName() {
        return fullName;
    }

    public void setFullName(String fullName) {
        this.fullName = fullName;
    }

    public boolean isCoffeeDrinker() {
        return coffeeDrinker;
    }

    public void setCoffeeDrinker(boolean coffeeDrinker) {
        this.coffeeDrinker = coffeeDrinker;
    }

    public boolean isActive() {
        return active;
    }
}
