package com.milestake.api.config;

import com.milestake.node.connector.ActivityCredentialStore;
import com.milestake.node.connector.HttpStravaBridge;
import com.milestake.node.connector.MockActivityConnector;
import com.milestake.node.connector.StravaConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Selects the activity connector. The mock connector replaces Strava when
 * {@code milestake.activity.mock=true}.
 */
@Configuration
public class ActivityBeans {

    private static final Logger log = LoggerFactory.getLogger(ActivityBeans.class);

    @Bean
    @ConditionalOnProperty(name = "milestake.activity.mock", havingValue = "true")
    public MockActivityConnector mockActivityConnector() {
        log.warn("Using mock activity connector; mileage is set by hand");
        return new MockActivityConnector();
    }

    @Bean
    @ConditionalOnProperty(name = "milestake.activity.mock", havingValue = "false", matchIfMissing = true)
    public StravaConnector stravaConnector(ActivityProperties properties, ActivityCredentialStore credentials,
                                           Clock clock) {
        ActivityProperties.Strava strava = properties.getStrava();
        HttpStravaBridge bridge = new HttpStravaBridge(strava.getClientId(), strava.getClientSecret(),
                strava.getRedirectUri(), HttpStravaBridge.DEFAULT_OAUTH_BASE, HttpStravaBridge.DEFAULT_API_BASE,
                strava.getRequestTimeout());
        return new StravaConnector(bridge, credentials, clock);
    }
}
