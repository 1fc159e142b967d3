package com.example.clubservice.repository;

import com.example.clubservice.entity.Member;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for Member entity.
 */
@Repository
public interface MemberRepository extends JpaRepository<Member, Long> {

    /**
     * Find member by email (for login).
     */
    Optional<Member> findByEmail(String email);
}
