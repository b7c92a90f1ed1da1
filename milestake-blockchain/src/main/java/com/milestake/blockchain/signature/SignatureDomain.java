package com.milestake.blockchain.signature;

/**
 * Message prefixes that keep finalize, cancel and confirm signatures apart.
 * A signature produced for one domain never verifies in another.
 */
public enum SignatureDomain {

    FINALIZE("FINALIZE_CHALLENGE_"),
    CANCEL("CANCEL_CHALLENGE_"),
    CONFIRM("CONFIRM_CHALLENGE_");

    private final String prefix;

    SignatureDomain(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }
}
