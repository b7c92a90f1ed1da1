package com.milestake.api.participant;

import com.milestake.blockchain.contract.ChallengeSnapshot;
import com.milestake.blockchain.contract.SettlementLedger;
import com.milestake.blockchain.signature.Addresses;
import com.milestake.blockchain.signature.ChallengeMessages;
import com.milestake.blockchain.signature.EthereumSignatures;
import com.milestake.core.domain.MileageConfirmation;
import com.milestake.core.repository.MileageConfirmationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Records participants' acknowledgement of their final mileage.
 *
 * A confirmation is a personal-message signature over {@code CONFIRM_CHALLENGE_<id>}
 * from the participant's own key, accepted once per participant after the
 * challenge has ended.
 */
@Service
@Transactional
public class ConfirmationService {

    private static final Logger log = LoggerFactory.getLogger(ConfirmationService.class);

    private final SettlementLedger ledger;
    private final MileageConfirmationRepository confirmationRepository;
    private final Clock clock;

    public ConfirmationService(SettlementLedger ledger, MileageConfirmationRepository confirmationRepository,
                               Clock clock) {
        this.ledger = ledger;
        this.confirmationRepository = confirmationRepository;
        this.clock = clock;
    }

    public ConfirmationResult confirm(long challengeId, String walletAddress, String signature) {
        if (!Addresses.isValid(walletAddress)) {
            throw new InvalidConfirmationException("Invalid wallet address: " + walletAddress);
        }
        if (signature == null || signature.isBlank()) {
            throw new InvalidConfirmationException("Signature is required");
        }
        String address = Addresses.normalize(walletAddress);

        ChallengeSnapshot challenge = ledger.getChallenge(challengeId);
        Instant now = clock.instant();
        if (now.isBefore(challenge.endTime())) {
            throw new ChallengeNotEndedException(challengeId);
        }
        if (ledger.getParticipant(challengeId, address).isEmpty()) {
            throw new NotParticipantException(challengeId, address);
        }
        String ledgerId = ledger.ledgerId();
        if (confirmationRepository.existsByLedgerIdAndChallengeIdAndAddress(ledgerId, challengeId, address)) {
            throw new AlreadyConfirmedException(challengeId, address);
        }
        if (!EthereumSignatures.isSignedBy(ChallengeMessages.confirmMessage(challengeId), signature, address)) {
            throw new InvalidSignatureException(address);
        }

        try {
            // flushed here so a concurrent duplicate fails on the unique key inside this call
            confirmationRepository.saveAndFlush(
                    MileageConfirmation.create(ledgerId, challengeId, address, signature, now));
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent confirmation by {} for challenge {} rejected", address, challengeId, e);
            throw new AlreadyConfirmedException(challengeId, address);
        }
        long confirmed = confirmationRepository.countByLedgerIdAndChallengeId(ledgerId, challengeId);
        int total = challenge.participantCount();
        log.info("Participant {} confirmed mileage for challenge {} ({}/{})", address, challengeId, confirmed, total);

        return new ConfirmationResult(challengeId, address, now, confirmed, total, confirmed >= total);
    }

    // DTOs

    public record ConfirmationResult(
            long challengeId,
            String walletAddress,
            Instant confirmedAt,
            long confirmedCount,
            int totalParticipants,
            boolean allParticipantsConfirmed
    ) {}

    // Exceptions

    public static class InvalidConfirmationException extends RuntimeException {
        public InvalidConfirmationException(String message) {
            super(message);
        }
    }

    public static class ChallengeNotEndedException extends RuntimeException {
        public ChallengeNotEndedException(long challengeId) {
            super("Challenge " + challengeId + " has not ended yet");
        }
    }

    public static class NotParticipantException extends RuntimeException {
        public NotParticipantException(long challengeId, String address) {
            super(address + " is not a participant of challenge " + challengeId);
        }
    }

    public static class AlreadyConfirmedException extends RuntimeException {
        public AlreadyConfirmedException(long challengeId, String address) {
            super(address + " already confirmed challenge " + challengeId);
        }
    }

    public static class InvalidSignatureException extends RuntimeException {
        public InvalidSignatureException(String address) {
            super("Signature was not produced by " + address);
        }
    }
}
