package com.milestake.core.repository;

import com.milestake.core.domain.ParticipantSummary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ParticipantSummaryRepository extends JpaRepository<ParticipantSummary, UUID> {

    List<ParticipantSummary> findByLedgerIdAndChallengeIdOrderByJoinOrderAsc(String ledgerId, Long challengeId);

    Optional<ParticipantSummary> findByLedgerIdAndChallengeIdAndAddress(String ledgerId, Long challengeId,
                                                                      String address);

    List<ParticipantSummary> findByLedgerIdAndAddressOrderByChallengeIdDesc(String ledgerId, String address);
}
