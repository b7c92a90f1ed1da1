package com.milestake.api.oracle;

import com.milestake.api.ledger.LedgerErrors;
import com.milestake.blockchain.contract.LedgerException;
import com.milestake.blockchain.contract.SettlementLedger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for the attester.
 */
@RestController
@RequestMapping("/api/v1/oracle")
public class OracleController {

    private final FinalizationService finalizationService;
    private final AttesterSigner signer;
    private final SettlementLedger ledger;

    public OracleController(FinalizationService finalizationService, AttesterSigner signer,
                            SettlementLedger ledger) {
        this.finalizationService = finalizationService;
        this.signer = signer;
        this.ledger = ledger;
    }

    @GetMapping("/address")
    public ResponseEntity<AttesterInfo> address() {
        return ResponseEntity.ok(new AttesterInfo(signer.address(), ledger.attesterAddress(),
                ledger.attesterKeyVersion()));
    }

    /**
     * Signed finalization for an eligible challenge, or 409 with the refusal
     * details while it is not yet eligible.
     */
    @GetMapping("/challenges/{challengeId}/finalization")
    public ResponseEntity<?> finalization(@PathVariable long challengeId) {
        var outcome = finalizationService.requestFinalization(challengeId);
        if (outcome instanceof FinalizationService.FinalizationRefusal) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(outcome);
        }
        return ResponseEntity.ok(outcome);
    }

    public record AttesterInfo(String signerAddress, String trustedAttester, long keyVersion) {}

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ErrorResponse> handleLedger(LedgerException e) {
        return ResponseEntity.status(LedgerErrors.statusOf(e))
            .body(new ErrorResponse(e.getError().name(), e.getMessage()));
    }

    @ExceptionHandler(FinalizationService.ChallengeCancelledException.class)
    public ResponseEntity<ErrorResponse> handleCancelled(FinalizationService.ChallengeCancelledException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(new ErrorResponse("CHALLENGE_CANCELLED", e.getMessage()));
    }

    @ExceptionHandler(FinalizationService.MileageUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleMileageUnavailable(FinalizationService.MileageUnavailableException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ErrorResponse("MILEAGE_UNAVAILABLE", e.getMessage()));
    }

    @ExceptionHandler(FinalizationService.DecisionMismatchException.class)
    public ResponseEntity<ErrorResponse> handleDecisionMismatch(FinalizationService.DecisionMismatchException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(new ErrorResponse("DECISION_MISMATCH", e.getMessage()));
    }

    public record ErrorResponse(String code, String message) {}
}
