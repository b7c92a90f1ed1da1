package com.milestake.blockchain.contract;

/**
 * Rejection of a ledger operation. Thrown before any state is modified.
 */
public class LedgerException extends RuntimeException {

    private final LedgerError error;

    public LedgerException(LedgerError error, String message) {
        super(error.name() + ": " + message);
        this.error = error;
    }

    public LedgerError getError() {
        return error;
    }
}
