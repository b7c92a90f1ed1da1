package com.milestake.node.connector;

import java.time.Duration;
import java.time.Instant;

/**
 * OAuth tokens for one linked activity-service account.
 */
public record OAuthTokens(String athleteId, String accessToken, String refreshToken, Instant expiresAt) {

    public boolean expiresWithin(Duration margin, Instant now) {
        return expiresAt.isBefore(now.plus(margin));
    }
}
