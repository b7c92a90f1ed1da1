package com.milestake.api.config;

import com.milestake.api.oracle.AttesterSigner;
import com.milestake.blockchain.contract.InMemoryPayoutSink;
import com.milestake.blockchain.contract.PayoutSink;
import com.milestake.blockchain.contract.SettlementLedger;
import com.milestake.blockchain.service.LedgerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the in-process settlement ledger.
 */
@Configuration
public class LedgerBeans {

    private static final Logger log = LoggerFactory.getLogger(LedgerBeans.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PayoutSink payoutSink() {
        return new InMemoryPayoutSink();
    }

    /**
     * The ledger trusts the configured attester address, or the service's own
     * signing key when none is configured.
     */
    @Bean
    public SettlementLedger settlementLedger(LedgerConfig config, AttesterSigner signer,
                                             PayoutSink payoutSink, Clock clock) {
        String attester = config.getAttesterAddress();
        if (attester == null || attester.isBlank()) {
            attester = signer.address();
        }
        log.info("Settlement ledger trusts attester {}", attester);
        return new SettlementLedger(clock, config.toPolicy(), attester, payoutSink);
    }
}
