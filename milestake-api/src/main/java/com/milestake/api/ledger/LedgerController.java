package com.milestake.api.ledger;

import com.milestake.blockchain.contract.Attestation;
import com.milestake.blockchain.contract.ChallengeSnapshot;
import com.milestake.blockchain.contract.ChallengeState;
import com.milestake.blockchain.contract.LedgerException;
import com.milestake.blockchain.contract.ParticipantSnapshot;
import com.milestake.blockchain.contract.SettlementLedger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

/**
 * REST API over the settlement ledger.
 *
 * Callers name themselves in the request body; the ledger enforces who may
 * do what.
 */
@RestController
@RequestMapping("/api/v1/ledger")
public class LedgerController {

    private final SettlementLedger ledger;

    public LedgerController(SettlementLedger ledger) {
        this.ledger = ledger;
    }

    @PostMapping("/challenges")
    public ResponseEntity<ChallengeSnapshot> createChallenge(@RequestBody CreateChallengeRequest request) {
        long challengeId = ledger.createChallenge(request.creator(), request.startTime(), request.endTime(),
                request.stakeAmount(), request.eligible() == null ? List.of() : request.eligible());
        return ResponseEntity.status(HttpStatus.CREATED).body(ledger.getChallenge(challengeId));
    }

    @PostMapping("/challenges/{challengeId}/join")
    public ResponseEntity<ParticipantSnapshot> join(
            @PathVariable long challengeId,
            @RequestBody JoinRequest request) {
        ledger.join(challengeId, request.participant(), request.correlationId(), request.stake());
        return ResponseEntity.ok(ledger.getParticipant(challengeId, request.participant()).orElseThrow());
    }

    @PostMapping("/challenges/{challengeId}/claim")
    public ResponseEntity<PayoutResponse> claimWithAttestation(
            @PathVariable long challengeId,
            @RequestBody ClaimRequest request) {
        var attestation = new Attestation(challengeId, request.winner(), request.resultHash(),
                request.signingTimestamp(), request.signature());
        BigInteger amount = ledger.claimWithAttestation(challengeId, request.claimant(), attestation);
        return ResponseEntity.ok(new PayoutResponse(challengeId, request.claimant(), amount));
    }

    @PostMapping("/challenges/{challengeId}/finalize")
    public ResponseEntity<ChallengeSnapshot> finalizeChallenge(
            @PathVariable long challengeId,
            @RequestBody FinalizeRequest request) {
        ledger.finalizeChallenge(request.caller(), challengeId, request.winner(), request.resultHash());
        return ResponseEntity.ok(ledger.getChallenge(challengeId));
    }

    @PostMapping("/challenges/{challengeId}/claim-prize")
    public ResponseEntity<PayoutResponse> claimPrize(
            @PathVariable long challengeId,
            @RequestBody CallerRequest request) {
        BigInteger amount = ledger.claimPrize(challengeId, request.caller());
        return ResponseEntity.ok(new PayoutResponse(challengeId, request.caller(), amount));
    }

    @PostMapping("/challenges/{challengeId}/cancel")
    public ResponseEntity<ChallengeSnapshot> cancelByConsent(
            @PathVariable long challengeId,
            @RequestBody CancelRequest request) {
        ledger.cancelByConsent(challengeId, request.signatures() == null ? List.of() : request.signatures());
        return ResponseEntity.ok(ledger.getChallenge(challengeId));
    }

    @PostMapping("/challenges/{challengeId}/withdraw")
    public ResponseEntity<PayoutResponse> withdrawFromCancelled(
            @PathVariable long challengeId,
            @RequestBody CallerRequest request) {
        BigInteger amount = ledger.withdrawFromCancelled(challengeId, request.caller());
        return ResponseEntity.ok(new PayoutResponse(challengeId, request.caller(), amount));
    }

    @PostMapping("/challenges/{challengeId}/emergency-withdraw")
    public ResponseEntity<PayoutResponse> emergencyWithdraw(
            @PathVariable long challengeId,
            @RequestBody CallerRequest request) {
        BigInteger amount = ledger.emergencyWithdraw(challengeId, request.caller());
        return ResponseEntity.ok(new PayoutResponse(challengeId, request.caller(), amount));
    }

    @GetMapping("/challenges/{challengeId}")
    public ResponseEntity<ChallengeSnapshot> getChallenge(@PathVariable long challengeId) {
        return ResponseEntity.ok(ledger.getChallenge(challengeId));
    }

    @GetMapping("/challenges/{challengeId}/state")
    public ResponseEntity<StateResponse> getState(@PathVariable long challengeId) {
        return ResponseEntity.ok(new StateResponse(challengeId, ledger.effectiveState(challengeId)));
    }

    @GetMapping("/challenges/{challengeId}/participants/{address}")
    public ResponseEntity<ParticipantSnapshot> getParticipant(
            @PathVariable long challengeId,
            @PathVariable String address) {
        return ledger.getParticipant(challengeId, address)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/attester")
    public ResponseEntity<AttesterResponse> updateAttester(@RequestBody UpdateAttesterRequest request) {
        long version = ledger.updateAttesterKey(request.caller(), request.newAttester());
        return ResponseEntity.ok(new AttesterResponse(ledger.attesterAddress(), version));
    }

    public record CreateChallengeRequest(String creator, Instant startTime, Instant endTime,
                                         BigInteger stakeAmount, List<String> eligible) {}
    public record JoinRequest(String participant, String correlationId, BigInteger stake) {}
    public record ClaimRequest(String claimant, String winner, String resultHash, long signingTimestamp,
                               String signature) {}
    public record FinalizeRequest(String caller, String winner, String resultHash) {}
    public record CallerRequest(String caller) {}
    public record CancelRequest(List<String> signatures) {}
    public record UpdateAttesterRequest(String caller, String newAttester) {}
    public record PayoutResponse(long challengeId, String recipient, BigInteger amount) {}
    public record StateResponse(long challengeId, ChallengeState state) {}
    public record AttesterResponse(String attester, long version) {}

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ErrorResponse> handleLedger(LedgerException e) {
        return ResponseEntity.status(LedgerErrors.statusOf(e))
            .body(new ErrorResponse(e.getError().name(), e.getMessage()));
    }

    public record ErrorResponse(String code, String message) {}
}
