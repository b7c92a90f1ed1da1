package com.milestake.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for the attestation service.
 * The private key is read from the environment, never from committed files.
 */
@Configuration
@ConfigurationProperties(prefix = "milestake.oracle")
public class OracleProperties {

    private String privateKey;
    private Duration gracePeriod = Duration.ofDays(7);
    private Duration fetchTimeout = Duration.ofSeconds(60);
    private boolean syncEnabled = true;

    public String getPrivateKey() { return privateKey; }
    public void setPrivateKey(String privateKey) { this.privateKey = privateKey; }
    public Duration getGracePeriod() { return gracePeriod; }
    public void setGracePeriod(Duration gracePeriod) { this.gracePeriod = gracePeriod; }
    public Duration getFetchTimeout() { return fetchTimeout; }
    public void setFetchTimeout(Duration fetchTimeout) { this.fetchTimeout = fetchTimeout; }
    public boolean isSyncEnabled() { return syncEnabled; }
    public void setSyncEnabled(boolean syncEnabled) { this.syncEnabled = syncEnabled; }
}
