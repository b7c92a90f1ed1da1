package com.milestake.blockchain.service;

import com.milestake.blockchain.contract.SettlementPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for the settlement ledger.
 */
@Configuration
@ConfigurationProperties(prefix = "milestake.ledger")
public class LedgerConfig {

    private String attesterAddress;
    private Duration emergencyPeriod = Duration.ofDays(14);
    private Duration attestationMaxAge = Duration.ofDays(30);

    public String getAttesterAddress() { return attesterAddress; }
    public void setAttesterAddress(String attesterAddress) { this.attesterAddress = attesterAddress; }
    public Duration getEmergencyPeriod() { return emergencyPeriod; }
    public void setEmergencyPeriod(Duration emergencyPeriod) { this.emergencyPeriod = emergencyPeriod; }
    public Duration getAttestationMaxAge() { return attestationMaxAge; }
    public void setAttestationMaxAge(Duration attestationMaxAge) { this.attestationMaxAge = attestationMaxAge; }

    public SettlementPolicy toPolicy() {
        return new SettlementPolicy(emergencyPeriod, attestationMaxAge);
    }
}
