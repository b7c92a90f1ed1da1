package com.milestake.api.activity;

import com.milestake.blockchain.signature.Addresses;
import com.milestake.node.connector.ActivityServiceException;
import com.milestake.node.connector.StravaConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Strava OAuth connect flow. The wallet address travels as the OAuth state.
 */
@RestController
@RequestMapping("/api/v1/activity/strava")
@ConditionalOnProperty(name = "milestake.activity.mock", havingValue = "false", matchIfMissing = true)
public class StravaAuthController {

    private static final Logger log = LoggerFactory.getLogger(StravaAuthController.class);
    private static final long CONNECT_TIMEOUT_SECONDS = 30;

    private final StravaConnector connector;

    public StravaAuthController(StravaConnector connector) {
        this.connector = connector;
    }

    @GetMapping("/authorize")
    public ResponseEntity<AuthorizeResponse> authorize(@RequestParam String walletAddress) {
        if (!Addresses.isValid(walletAddress)) {
            throw new IllegalArgumentException("Invalid wallet address: " + walletAddress);
        }
        String wallet = Addresses.normalize(walletAddress);
        return ResponseEntity.ok(new AuthorizeResponse(wallet, connector.authorizationUrl(wallet)));
    }

    @GetMapping("/callback")
    public ResponseEntity<ConnectResponse> callback(@RequestParam String code, @RequestParam String state)
            throws InterruptedException {
        if (!Addresses.isValid(state)) {
            throw new IllegalArgumentException("OAuth state is not a wallet address: " + state);
        }
        String wallet = Addresses.normalize(state);
        try {
            String athleteId = connector.connect(wallet, code).get(CONNECT_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            return ResponseEntity.ok(new ConnectResponse(wallet, athleteId));
        } catch (ExecutionException e) {
            if (e.getCause() instanceof ActivityServiceException serviceException) {
                throw serviceException;
            }
            throw new ActivityServiceException("CONNECTOR_ERROR", "Strava connect failed", false, e.getCause());
        } catch (TimeoutException e) {
            throw new ActivityServiceException("TIMEOUT", "Strava did not answer in time", true, e);
        }
    }

    public record AuthorizeResponse(String walletAddress, String authorizationUrl) {}
    public record ConnectResponse(String walletAddress, String athleteId) {}

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("STRAVA_BAD_REQUEST", e.getMessage()));
    }

    @ExceptionHandler(ActivityServiceException.class)
    public ResponseEntity<ErrorResponse> handleActivityService(ActivityServiceException e) {
        log.warn("Strava connect failed: {} {}", e.getErrorCode(), e.getMessage());
        HttpStatus status = e.isTransient() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.BAD_GATEWAY;
        return ResponseEntity.status(status)
            .body(new ErrorResponse(e.getErrorCode(), e.getMessage()));
    }

    public record ErrorResponse(String code, String message) {}
}
