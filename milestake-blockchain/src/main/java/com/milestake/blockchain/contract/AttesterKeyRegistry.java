package com.milestake.blockchain.contract;

import com.milestake.blockchain.signature.Addresses;

/**
 * Single-slot, versioned store for the attester address. Only the current
 * holder may replace it.
 */
public final class AttesterKeyRegistry {

    private String attester;
    private long version;

    public AttesterKeyRegistry(String initialAttester) {
        if (!Addresses.isValid(initialAttester)) {
            throw new IllegalArgumentException("Invalid attester address: " + initialAttester);
        }
        this.attester = Addresses.normalize(initialAttester);
        this.version = 1;
    }

    public synchronized String current() {
        return attester;
    }

    public synchronized long version() {
        return version;
    }

    public synchronized boolean isAttester(String address) {
        return Addresses.same(attester, address);
    }

    /**
     * Replaces the attester address.
     *
     * @return the new version
     */
    synchronized long update(String caller, String newAttester) {
        if (!isAttester(caller)) {
            throw new LedgerException(LedgerError.NOT_ATTESTER, "Only the current attester may rotate the key");
        }
        if (!Addresses.isValid(newAttester)) {
            throw new LedgerException(LedgerError.INVALID_PARAMETERS, "New attester address is missing or invalid");
        }
        attester = Addresses.normalize(newAttester);
        version++;
        return version;
    }
}
