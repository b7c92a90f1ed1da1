package com.milestake.core.repository;

import com.milestake.core.domain.ActivityAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository for activity-service credentials.
 */
@Repository
public interface ActivityAccountRepository extends JpaRepository<ActivityAccount, UUID> {

    Optional<ActivityAccount> findByWalletAddressAndProvider(String walletAddress, String provider);
}
