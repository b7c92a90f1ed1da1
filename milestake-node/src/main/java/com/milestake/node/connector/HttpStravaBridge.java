package com.milestake.node.connector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.milestake.node.connector.StravaConnector.ActivitiesResponse;
import com.milestake.node.connector.StravaConnector.StravaActivity;
import com.milestake.node.connector.StravaConnector.TokenResponse;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Strava bridge over {@link HttpClient}.
 *
 * According to Strava API docs: https://developers.strava.com/docs/authentication/
 * OAuth 2.0 Authorization Code Flow is used for user authorization.
 */
public class HttpStravaBridge implements StravaConnector.StravaBridge {

    public static final String DEFAULT_OAUTH_BASE = "https://www.strava.com/oauth";
    public static final String DEFAULT_API_BASE = "https://www.strava.com/api/v3";

    private final String clientId;
    private final String clientSecret;
    private final String redirectUri;
    private final String oauthBase;
    private final String apiBase;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpStravaBridge(String clientId, String clientSecret, String redirectUri) {
        this(clientId, clientSecret, redirectUri, DEFAULT_OAUTH_BASE, DEFAULT_API_BASE, Duration.ofSeconds(15));
    }

    public HttpStravaBridge(String clientId, String clientSecret, String redirectUri,
                            String oauthBase, String apiBase, Duration requestTimeout) {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalStateException("Strava client id is required");
        }
        if (clientSecret == null || clientSecret.isBlank()) {
            throw new IllegalStateException("Strava client secret is required");
        }
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.redirectUri = redirectUri;
        this.oauthBase = oauthBase;
        this.apiBase = apiBase;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String authorizationUrl(String state, Set<String> scopes) {
        return oauthBase + "/authorize"
                + "?client_id=" + encode(clientId)
                + "&response_type=code"
                + "&redirect_uri=" + encode(redirectUri)
                + "&scope=" + encode(String.join(",", scopes))
                + "&state=" + encode(state)
                + "&approval_prompt=auto";
    }

    @Override
    public CompletableFuture<TokenResponse> exchangeCodeForTokens(String authCode) {
        return postToken("client_id=" + encode(clientId)
                + "&client_secret=" + encode(clientSecret)
                + "&code=" + encode(authCode)
                + "&grant_type=authorization_code");
    }

    @Override
    public CompletableFuture<TokenResponse> refreshTokens(String refreshToken) {
        return postToken("client_id=" + encode(clientId)
                + "&client_secret=" + encode(clientSecret)
                + "&refresh_token=" + encode(refreshToken)
                + "&grant_type=refresh_token");
    }

    @Override
    public CompletableFuture<ActivitiesResponse> getActivities(String accessToken, long after, long before,
                                                               int page, int perPage) {
        String url = apiBase + "/athlete/activities?after=" + after + "&before=" + before
                + "&page=" + page + "&per_page=" + perPage;
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(requestTimeout)
                .header("Authorization", "Bearer " + accessToken)
                .GET()
                .build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> {
                    if (response.statusCode() == 429) {
                        return ActivitiesResponse.failure("RATE_LIMITED", "Strava API rate limit exceeded");
                    }
                    if (response.statusCode() != 200) {
                        return ActivitiesResponse.failure("HTTP_" + response.statusCode(), response.body());
                    }
                    return parseActivities(response.body());
                })
                .exceptionally(error -> ActivitiesResponse.failure(transportCode(error), rootMessage(error)));
    }

    private CompletableFuture<TokenResponse> postToken(String form) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(oauthBase + "/token"))
                .timeout(requestTimeout)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(form))
                .build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> response.statusCode() == 200
                        ? parseToken(response.body())
                        : TokenResponse.failure("HTTP_" + response.statusCode(), response.body()))
                .exceptionally(error -> TokenResponse.failure(transportCode(error), rootMessage(error)));
    }

    TokenResponse parseToken(String json) {
        try {
            JsonNode root = objectMapper.readTree(json);
            JsonNode athlete = root.path("athlete");
            String athleteId = athlete.hasNonNull("id") ? athlete.get("id").asText() : null;
            return new TokenResponse(true,
                    athleteId,
                    root.path("access_token").asText(null),
                    root.path("refresh_token").asText(null),
                    root.path("expires_at").asLong(),
                    null,
                    null);
        } catch (JsonProcessingException e) {
            return TokenResponse.failure("PARSE_ERROR", e.getOriginalMessage());
        }
    }

    ActivitiesResponse parseActivities(String json) {
        try {
            JsonNode root = objectMapper.readTree(json);
            if (!root.isArray()) {
                return ActivitiesResponse.failure("PARSE_ERROR", "Expected a JSON array of activities");
            }
            List<StravaActivity> activities = new ArrayList<>();
            for (JsonNode node : root) {
                String startDate = node.path("start_date").asText(null);
                activities.add(new StravaActivity(
                        node.path("id").asLong(),
                        node.path("type").asText(""),
                        node.path("distance").asDouble(0),
                        startDate != null ? Instant.parse(startDate) : null));
            }
            return ActivitiesResponse.page(activities);
        } catch (JsonProcessingException e) {
            return ActivitiesResponse.failure("PARSE_ERROR", e.getOriginalMessage());
        }
    }

    private static String transportCode(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        return cause instanceof HttpTimeoutException ? "TIMEOUT" : "CONNECTION_ERROR";
    }

    private static String rootMessage(Throwable error) {
        Throwable cause = error;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
