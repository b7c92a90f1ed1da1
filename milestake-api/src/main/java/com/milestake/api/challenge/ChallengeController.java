package com.milestake.api.challenge;

import com.milestake.api.ledger.LedgerErrors;
import com.milestake.api.sync.MileageSyncService;
import com.milestake.blockchain.contract.LedgerException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for challenge listings, standings and manual mileage refresh.
 */
@RestController
@RequestMapping("/api/v1/challenges")
public class ChallengeController {

    private final ChallengeQueryService queryService;
    private final MileageSyncService syncService;

    public ChallengeController(ChallengeQueryService queryService, MileageSyncService syncService) {
        this.queryService = queryService;
        this.syncService = syncService;
    }

    @GetMapping
    public ResponseEntity<List<ChallengeQueryService.ChallengeSummaryDto>> listChallenges() {
        return ResponseEntity.ok(queryService.listChallenges());
    }

    @GetMapping("/{challengeId}")
    public ResponseEntity<ChallengeQueryService.ChallengeSummaryDto> getChallenge(@PathVariable long challengeId) {
        return ResponseEntity.ok(queryService.getChallenge(challengeId));
    }

    @GetMapping("/{challengeId}/leaderboard")
    public ResponseEntity<LeaderboardResponse> getLeaderboard(@PathVariable long challengeId) {
        return ResponseEntity.ok(new LeaderboardResponse(challengeId, queryService.getLeaderboard(challengeId)));
    }

    @PostMapping("/{challengeId}/sync")
    public ResponseEntity<MileageSyncService.ChallengeSyncResult> sync(@PathVariable long challengeId) {
        return ResponseEntity.ok(syncService.syncChallenge(challengeId));
    }

    public record LeaderboardResponse(long challengeId, List<ChallengeQueryService.LeaderboardEntry> leaderboard) {}

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ErrorResponse> handleLedger(LedgerException e) {
        return ResponseEntity.status(LedgerErrors.statusOf(e))
            .body(new ErrorResponse(e.getError().name(), e.getMessage()));
    }

    @ExceptionHandler(ChallengeQueryService.ChallengeNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ChallengeQueryService.ChallengeNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(new ErrorResponse("CHALLENGE_NOT_FOUND", e.getMessage()));
    }

    @ExceptionHandler(MileageSyncService.ChallengeNotStartedException.class)
    public ResponseEntity<ErrorResponse> handleNotStarted(MileageSyncService.ChallengeNotStartedException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(new ErrorResponse("CHALLENGE_NOT_STARTED", e.getMessage()));
    }

    public record ErrorResponse(String code, String message) {}
}
