package com.milestake.api.ledger;

import com.milestake.blockchain.contract.LedgerError;
import com.milestake.blockchain.contract.LedgerException;
import org.springframework.http.HttpStatus;

/**
 * HTTP status for each category of ledger rejection.
 */
public final class LedgerErrors {

    private LedgerErrors() {}

    public static HttpStatus statusOf(LedgerException e) {
        LedgerError error = e.getError();
        if (error == LedgerError.CHALLENGE_NOT_FOUND) {
            return HttpStatus.NOT_FOUND;
        }
        return switch (error.category()) {
            case PARAMETER_VALIDATION -> HttpStatus.BAD_REQUEST;
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case ELIGIBILITY, ECONOMIC, STALENESS -> HttpStatus.CONFLICT;
        };
    }
}
