package com.milestake.api.participant;

import com.milestake.api.challenge.ChallengeQueryService;
import com.milestake.api.ledger.LedgerErrors;
import com.milestake.blockchain.contract.LedgerException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for participant confirmations.
 */
@RestController
@RequestMapping("/api/v1/participants")
public class ParticipantController {

    private final ConfirmationService confirmationService;
    private final ChallengeQueryService queryService;

    public ParticipantController(ConfirmationService confirmationService, ChallengeQueryService queryService) {
        this.confirmationService = confirmationService;
        this.queryService = queryService;
    }

    @PostMapping("/confirm")
    public ResponseEntity<ConfirmationService.ConfirmationResult> confirm(
            @Valid @RequestBody ConfirmRequest request) {
        var result = confirmationService.confirm(request.challengeId(), request.walletAddress(), request.signature());
        return ResponseEntity.ok(result);
    }

    @GetMapping("/{challengeId}")
    public ResponseEntity<ChallengeQueryService.ParticipantsView> getParticipants(@PathVariable long challengeId) {
        return ResponseEntity.ok(queryService.getParticipants(challengeId));
    }

    public record ConfirmRequest(
            @NotNull Long challengeId,
            @NotBlank String walletAddress,
            @NotBlank String signature
    ) {}

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ErrorResponse> handleLedger(LedgerException e) {
        return ResponseEntity.status(LedgerErrors.statusOf(e))
            .body(new ErrorResponse(e.getError().name(), e.getMessage()));
    }

    @ExceptionHandler(ConfirmationService.InvalidConfirmationException.class)
    public ResponseEntity<ErrorResponse> handleInvalid(ConfirmationService.InvalidConfirmationException e) {
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("CONFIRM_INVALID_REQUEST", e.getMessage()));
    }

    @ExceptionHandler(ConfirmationService.ChallengeNotEndedException.class)
    public ResponseEntity<ErrorResponse> handleNotEnded(ConfirmationService.ChallengeNotEndedException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(new ErrorResponse("CONFIRM_NOT_ENDED", e.getMessage()));
    }

    @ExceptionHandler(ConfirmationService.NotParticipantException.class)
    public ResponseEntity<ErrorResponse> handleNotParticipant(ConfirmationService.NotParticipantException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(new ErrorResponse("CONFIRM_NOT_PARTICIPANT", e.getMessage()));
    }

    @ExceptionHandler(ConfirmationService.AlreadyConfirmedException.class)
    public ResponseEntity<ErrorResponse> handleAlreadyConfirmed(ConfirmationService.AlreadyConfirmedException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(new ErrorResponse("CONFIRM_DUPLICATE", e.getMessage()));
    }

    @ExceptionHandler(ConfirmationService.InvalidSignatureException.class)
    public ResponseEntity<ErrorResponse> handleBadSignature(ConfirmationService.InvalidSignatureException e) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
            .body(new ErrorResponse("CONFIRM_BAD_SIGNATURE", e.getMessage()));
    }

    public record ErrorResponse(String code, String message) {}
}
