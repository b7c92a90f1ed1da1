package com.milestake.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for the activity service connector.
 */
@Configuration
@ConfigurationProperties(prefix = "milestake.activity")
public class ActivityProperties {

    private boolean mock = false;
    private Strava strava = new Strava();

    public boolean isMock() { return mock; }
    public void setMock(boolean mock) { this.mock = mock; }
    public Strava getStrava() { return strava; }
    public void setStrava(Strava strava) { this.strava = strava; }

    public static class Strava {
        private String clientId;
        private String clientSecret;
        private String redirectUri;
        private Duration requestTimeout = Duration.ofSeconds(15);

        public String getClientId() { return clientId; }
        public void setClientId(String clientId) { this.clientId = clientId; }
        public String getClientSecret() { return clientSecret; }
        public void setClientSecret(String clientSecret) { this.clientSecret = clientSecret; }
        public String getRedirectUri() { return redirectUri; }
        public void setRedirectUri(String redirectUri) { this.redirectUri = redirectUri; }
        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    }
}
