package com.milestake.node.connector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Development connector whose mileage is set by hand. Wallets without a value
 * report zero miles.
 */
public class MockActivityConnector extends AbstractConnector {

    private static final Logger log = LoggerFactory.getLogger(MockActivityConnector.class);

    public static final String CONNECTOR_ID = "mock";

    private final Map<String, BigDecimal> mileage = new ConcurrentHashMap<>();

    public MockActivityConnector() {
        super(CONNECTOR_ID);
    }

    public void setMileage(String identity, BigDecimal miles) {
        if (miles == null || miles.signum() < 0) {
            throw new IllegalArgumentException("Miles must be zero or positive");
        }
        mileage.put(key(identity), miles);
        log.info("[MOCK] mileage for {} set to {}", identity, miles);
    }

    /**
     * Stable fake athlete id for a wallet, for use as a correlation id.
     */
    public static String athleteIdFor(String identity) {
        return Integer.toUnsignedString(key(identity).hashCode());
    }

    @Override
    protected CompletableFuture<MileageReading> doFetchMileage(String identity, String correlationId,
                                                               Instant windowStart, Instant windowEnd) {
        BigDecimal miles = mileage.getOrDefault(key(identity), BigDecimal.ZERO);
        return CompletableFuture.completedFuture(new MileageReading(miles, 0));
    }

    private static String key(String identity) {
        return identity.toLowerCase(Locale.ROOT);
    }
}
