package com.milestake.core.repository;

import com.milestake.core.domain.MileageSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for mileage snapshots. The latest snapshot per participant wins.
 */
@Repository
public interface MileageSnapshotRepository extends JpaRepository<MileageSnapshot, Long> {

    /**
     * Latest snapshot; ties on {@code recordedAt} go to the later insert.
     */
    Optional<MileageSnapshot> findFirstByLedgerIdAndChallengeIdAndAddressOrderByRecordedAtDescIdDesc(
            String ledgerId, Long challengeId, String address);

    List<MileageSnapshot> findByLedgerIdAndChallengeIdOrderByRecordedAtAscIdAsc(String ledgerId, Long challengeId);

    long countByLedgerIdAndChallengeId(String ledgerId, Long challengeId);
}
