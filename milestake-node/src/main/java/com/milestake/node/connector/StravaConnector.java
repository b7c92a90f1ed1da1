package com.milestake.node.connector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Strava OAuth connector.
 *
 * <p>Sums the distance of running activities ({@code Run}, {@code VirtualRun}) in the
 * requested window. Activities are read 200 per page until a short page is returned.
 * Access tokens are refreshed through the bridge when they expire within five minutes.
 */
public class StravaConnector extends AbstractConnector {

    private static final Logger log = LoggerFactory.getLogger(StravaConnector.class);

    public static final String CONNECTOR_ID = "strava";

    public static final Set<String> REQUIRED_SCOPES = Set.of("activity:read_all");
    public static final Set<String> RUNNING_TYPES = Set.of("Run", "VirtualRun");
    public static final BigDecimal MILES_PER_METER = new BigDecimal("0.000621371");

    static final int PAGE_SIZE = 200;
    private static final Duration REFRESH_MARGIN = Duration.ofMinutes(5);

    private final StravaBridge bridge;
    private final ActivityCredentialStore credentials;
    private final Clock clock;

    public StravaConnector(StravaBridge bridge, ActivityCredentialStore credentials, Clock clock) {
        super(CONNECTOR_ID, 3, 2000, Duration.ofSeconds(30));
        this.bridge = bridge;
        this.credentials = credentials;
        this.clock = clock;
    }

    /**
     * Creates a connector with custom retry settings. Allows injection for testing.
     */
    public StravaConnector(StravaBridge bridge, ActivityCredentialStore credentials, Clock clock,
                           int maxRetries, long baseBackoffMs, Duration timeout) {
        super(CONNECTOR_ID, maxRetries, baseBackoffMs, timeout);
        this.bridge = bridge;
        this.credentials = credentials;
        this.clock = clock;
    }

    // ==================== OAuth ====================

    /**
     * Builds the URL a wallet owner visits to grant read access. The wallet address
     * travels as the OAuth {@code state}.
     */
    public String authorizationUrl(String identity) {
        return bridge.authorizationUrl(identity, REQUIRED_SCOPES);
    }

    /**
     * Exchanges an authorization code and stores the resulting tokens for the wallet.
     *
     * @return the Strava athlete id, used as the correlation id when joining
     */
    public CompletableFuture<String> connect(String identity, String authorizationCode) {
        return bridge.exchangeCodeForTokens(authorizationCode)
                .thenApply(response -> {
                    if (!response.success()) {
                        throw new ActivityServiceException(response.errorCode(),
                                "Strava token exchange failed: " + response.errorMessage(), false);
                    }
                    credentials.save(identity, response.toTokens());
                    log.info("Strava athlete {} linked to {}", response.athleteId(), identity);
                    return response.athleteId();
                });
    }

    // ==================== Mileage ====================

    @Override
    protected CompletableFuture<MileageReading> doFetchMileage(String identity, String correlationId,
                                                               Instant windowStart, Instant windowEnd) {
        OAuthTokens stored = credentials.find(identity)
                .orElseThrow(() -> new ActivityServiceException("NOT_CONNECTED",
                        "No Strava account linked to " + identity, false));
        if (correlationId != null && stored.athleteId() != null && !correlationId.equals(stored.athleteId())) {
            log.warn("Correlation id {} for {} differs from linked athlete {}",
                    correlationId, identity, stored.athleteId());
        }

        return ensureValidTokens(identity, stored)
                .thenCompose(tokens -> fetchAllActivities(
                        tokens.accessToken(), windowStart.getEpochSecond(), windowEnd.getEpochSecond(),
                        1, new ArrayList<>()))
                .thenApply(StravaConnector::toReading);
    }

    /**
     * Reads pages until one comes back shorter than the page size.
     */
    private CompletableFuture<List<StravaActivity>> fetchAllActivities(
            String accessToken, long after, long before, int page, List<StravaActivity> collected) {

        return bridge.getActivities(accessToken, after, before, page, PAGE_SIZE)
                .thenCompose(response -> {
                    if (response.error() != null) {
                        throw toFailure(response);
                    }
                    collected.addAll(response.activities());
                    if (response.activities().size() < PAGE_SIZE) {
                        return CompletableFuture.completedFuture(collected);
                    }
                    return fetchAllActivities(accessToken, after, before, page + 1, collected);
                });
    }

    private CompletableFuture<OAuthTokens> ensureValidTokens(String identity, OAuthTokens tokens) {
        if (!tokens.expiresWithin(REFRESH_MARGIN, clock.instant())) {
            return CompletableFuture.completedFuture(tokens);
        }

        return bridge.refreshTokens(tokens.refreshToken())
                .thenApply(response -> {
                    if (!response.success()) {
                        throw new ActivityServiceException("TOKEN_REFRESH_FAILED",
                                "Unable to refresh Strava token for " + identity + ": " + response.errorMessage(),
                                isTransientCode(response.errorCode()));
                    }
                    OAuthTokens refreshed = new OAuthTokens(tokens.athleteId(), response.accessToken(),
                            response.refreshToken(), Instant.ofEpochSecond(response.expiresAt()));
                    credentials.save(identity, refreshed);
                    log.info("Strava token refreshed for {}", identity);
                    return refreshed;
                });
    }

    static MileageReading toReading(List<StravaActivity> activities) {
        List<StravaActivity> runs = activities.stream()
                .filter(activity -> RUNNING_TYPES.contains(activity.type()))
                .toList();
        BigDecimal meters = runs.stream()
                .map(activity -> BigDecimal.valueOf(activity.distance()))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return new MileageReading(meters.multiply(MILES_PER_METER).setScale(2, RoundingMode.HALF_UP), runs.size());
    }

    private static ActivityServiceException toFailure(ActivitiesResponse response) {
        return new ActivityServiceException(response.error(),
                "Strava activities request failed: " + response.errorMessage(),
                isTransientCode(response.error()));
    }

    static boolean isTransientCode(String errorCode) {
        if (errorCode == null) {
            return false;
        }
        return switch (errorCode) {
            case "RATE_LIMITED", "TIMEOUT", "CONNECTION_ERROR", "HTTP_500", "HTTP_502", "HTTP_503", "HTTP_504" -> true;
            default -> false;
        };
    }

    // ==================== Bridge Interface ====================

    /**
     * Bridge interface for Strava API operations.
     */
    public interface StravaBridge {
        String authorizationUrl(String state, Set<String> scopes);
        CompletableFuture<TokenResponse> exchangeCodeForTokens(String authCode);
        CompletableFuture<TokenResponse> refreshTokens(String refreshToken);
        CompletableFuture<ActivitiesResponse> getActivities(String accessToken, long after, long before,
                                                            int page, int perPage);
    }

    /**
     * Token exchange or refresh response.
     */
    public record TokenResponse(
            boolean success,
            String athleteId,
            String accessToken,
            String refreshToken,
            long expiresAt,
            String errorCode,
            String errorMessage
    ) {
        public static TokenResponse failure(String errorCode, String errorMessage) {
            return new TokenResponse(false, null, null, null, 0, errorCode, errorMessage);
        }

        OAuthTokens toTokens() {
            return new OAuthTokens(athleteId, accessToken, refreshToken, Instant.ofEpochSecond(expiresAt));
        }
    }

    /**
     * One page of activities.
     */
    public record ActivitiesResponse(
            List<StravaActivity> activities,
            String error,
            String errorMessage
    ) {
        public static ActivitiesResponse page(List<StravaActivity> activities) {
            return new ActivitiesResponse(activities, null, null);
        }

        public static ActivitiesResponse failure(String error, String errorMessage) {
            return new ActivitiesResponse(List.of(), error, errorMessage);
        }
    }

    /**
     * The fields of a Strava activity used for mileage.
     */
    public record StravaActivity(long id, String type, double distance, Instant startDate) {}
}
