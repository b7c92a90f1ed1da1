package com.milestake.blockchain.contract;

import java.math.BigInteger;

/**
 * Destination for value leaving the ledger.
 */
@FunctionalInterface
public interface PayoutSink {

    void transfer(String recipient, BigInteger amount);
}
