package com.milestake.blockchain.contract;

/**
 * Named preconditions a ledger operation can fail on.
 */
public enum LedgerError {

    INVALID_PARAMETERS(Category.PARAMETER_VALIDATION),
    INVALID_CORRELATION_ID(Category.PARAMETER_VALIDATION),
    EMPTY_RESULT_HASH(Category.PARAMETER_VALIDATION),
    CHALLENGE_NOT_FOUND(Category.PARAMETER_VALIDATION),
    WRONG_SIGNATURE_COUNT(Category.PARAMETER_VALIDATION),

    NOT_ELIGIBLE(Category.ELIGIBILITY),
    NOT_ACCEPTING_PARTICIPANTS(Category.ELIGIBILITY),
    REGISTRATION_CLOSED(Category.ELIGIBILITY),
    ALREADY_JOINED(Category.ELIGIBILITY),
    NOT_IN_GRACE_PERIOD(Category.ELIGIBILITY),
    CHALLENGE_CLOSED(Category.ELIGIBILITY),
    CLAIM_WINDOW_CLOSED(Category.ELIGIBILITY),
    NOT_PARTICIPANT(Category.ELIGIBILITY),
    CANNOT_CANCEL(Category.ELIGIBILITY),
    NOT_CANCELLED(Category.ELIGIBILITY),
    NOT_FINALIZED(Category.ELIGIBILITY),
    EMERGENCY_PERIOD_NOT_REACHED(Category.ELIGIBILITY),

    NOT_WINNER(Category.AUTHORIZATION),
    NOT_ATTESTER(Category.AUTHORIZATION),
    INVALID_SIGNATURE(Category.AUTHORIZATION),
    SIGNER_NOT_ATTESTER(Category.AUTHORIZATION),
    DUPLICATE_SIGNER(Category.AUTHORIZATION),

    WRONG_STAKE_AMOUNT(Category.ECONOMIC),
    NO_STAKE_TO_WITHDRAW(Category.ECONOMIC),

    ATTESTATION_FROM_FUTURE(Category.STALENESS),
    ATTESTATION_EXPIRED(Category.STALENESS);

    private final Category category;

    LedgerError(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }

    public enum Category {
        PARAMETER_VALIDATION,
        ELIGIBILITY,
        AUTHORIZATION,
        ECONOMIC,
        STALENESS
    }
}
