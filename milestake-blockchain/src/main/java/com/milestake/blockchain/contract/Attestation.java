package com.milestake.blockchain.contract;

/**
 * Signed statement naming a challenge winner and committing to the result set.
 *
 * @param signingTimestamp epoch seconds at which the attester signed
 * @param signature        65-byte hex signature over the finalize digest
 */
public record Attestation(
        long challengeId,
        String winner,
        String resultHash,
        long signingTimestamp,
        String signature
) {}
