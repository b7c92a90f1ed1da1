package com.milestake.core.repository;

import com.milestake.core.domain.MileageConfirmation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface MileageConfirmationRepository extends JpaRepository<MileageConfirmation, UUID> {

    boolean existsByLedgerIdAndChallengeIdAndAddress(String ledgerId, Long challengeId, String address);

    List<MileageConfirmation> findByLedgerIdAndChallengeId(String ledgerId, Long challengeId);

    long countByLedgerIdAndChallengeId(String ledgerId, Long challengeId);
}
