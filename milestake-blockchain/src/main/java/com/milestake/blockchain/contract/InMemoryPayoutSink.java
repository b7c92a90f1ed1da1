package com.milestake.blockchain.contract;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps received amounts per recipient. Used in development and tests.
 */
public class InMemoryPayoutSink implements PayoutSink {

    private final Map<String, BigInteger> received = new ConcurrentHashMap<>();

    @Override
    public void transfer(String recipient, BigInteger amount) {
        received.merge(recipient, amount, BigInteger::add);
    }

    public BigInteger receivedBy(String recipient) {
        return received.getOrDefault(recipient, BigInteger.ZERO);
    }

    public BigInteger totalPaidOut() {
        return received.values().stream().reduce(BigInteger.ZERO, BigInteger::add);
    }
}
