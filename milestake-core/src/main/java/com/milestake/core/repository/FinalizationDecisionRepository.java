package com.milestake.core.repository;

import com.milestake.core.domain.FinalizationDecision;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface FinalizationDecisionRepository extends JpaRepository<FinalizationDecision, UUID> {

    Optional<FinalizationDecision> findByLedgerIdAndChallengeId(String ledgerId, Long challengeId);

    long countByLedgerIdAndChallengeId(String ledgerId, Long challengeId);
}
