package com.milestake.api.activity;

import com.milestake.api.ledger.LedgerErrors;
import com.milestake.api.sync.MileageSyncService;
import com.milestake.blockchain.contract.LedgerException;
import com.milestake.blockchain.signature.Addresses;
import com.milestake.node.connector.MockActivityConnector;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;

/**
 * Development endpoints, only present with the mock activity connector.
 */
@RestController
@RequestMapping("/api/v1/dev")
@ConditionalOnProperty(name = "milestake.activity.mock", havingValue = "true")
public class DevController {

    private final MockActivityConnector connector;
    private final MileageSyncService syncService;

    public DevController(MockActivityConnector connector, MileageSyncService syncService) {
        this.connector = connector;
        this.syncService = syncService;
    }

    /**
     * Sets a wallet's mock mileage; with a challenge id, also syncs that challenge.
     */
    @PostMapping("/mileage")
    public ResponseEntity<SetMileageResponse> setMileage(@Valid @RequestBody SetMileageRequest request) {
        if (!Addresses.isValid(request.walletAddress())) {
            return ResponseEntity.badRequest().build();
        }
        String wallet = Addresses.normalize(request.walletAddress());
        connector.setMileage(wallet, request.miles());
        MileageSyncService.ChallengeSyncResult sync = request.challengeId() == null
                ? null
                : syncService.syncChallenge(request.challengeId());
        return ResponseEntity.ok(new SetMileageResponse(wallet, request.miles(),
                MockActivityConnector.athleteIdFor(wallet), sync));
    }

    public record SetMileageRequest(
            @NotBlank String walletAddress,
            @NotNull @DecimalMin("0") BigDecimal miles,
            Long challengeId
    ) {}

    public record SetMileageResponse(String walletAddress, BigDecimal miles, String athleteId,
                                     MileageSyncService.ChallengeSyncResult sync) {}

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ErrorResponse> handleLedger(LedgerException e) {
        return ResponseEntity.status(LedgerErrors.statusOf(e))
            .body(new ErrorResponse(e.getError().name(), e.getMessage()));
    }

    @ExceptionHandler(MileageSyncService.ChallengeNotStartedException.class)
    public ResponseEntity<ErrorResponse> handleNotStarted(MileageSyncService.ChallengeNotStartedException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(new ErrorResponse("CHALLENGE_NOT_STARTED", e.getMessage()));
    }

    public record ErrorResponse(String code, String message) {}
}
