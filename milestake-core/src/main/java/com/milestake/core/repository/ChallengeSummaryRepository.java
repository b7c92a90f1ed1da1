package com.milestake.core.repository;

import com.milestake.core.domain.ChallengeSummary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for the challenge display mirror.
 */
@Repository
public interface ChallengeSummaryRepository extends JpaRepository<ChallengeSummary, UUID> {

    Optional<ChallengeSummary> findByLedgerIdAndChallengeId(String ledgerId, Long challengeId);

    List<ChallengeSummary> findByLedgerIdOrderByChallengeIdDesc(String ledgerId);
}
