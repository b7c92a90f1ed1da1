package com.milestake.blockchain.contract;

import com.milestake.blockchain.signature.ChallengeMessages;
import com.milestake.blockchain.signature.EthereumSignatures;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks that a consent set carries exactly one cancel signature from every joined
 * participant. Depends only on ledger state, never on the attestation service.
 */
final class ConsentVerifier {

    /**
     * @param joined addresses of the currently joined participants
     * @return the recovered signers
     * @throws LedgerException on a count mismatch, an unrecoverable signature, a signer
     *                         that is not a joined participant, or a repeated signer
     */
    Set<String> verifyUnanimous(long challengeId, List<String> signatures, Set<String> joined) {
        List<String> consent = signatures != null ? signatures : List.of();
        if (consent.size() != joined.size()) {
            throw new LedgerException(LedgerError.WRONG_SIGNATURE_COUNT,
                    "Expected " + joined.size() + " signatures, got " + consent.size());
        }

        byte[] digest = ChallengeMessages.cancelDigest(challengeId);
        Set<String> signers = new HashSet<>();
        for (int i = 0; i < consent.size(); i++) {
            int index = i;
            String signer = EthereumSignatures.recoverSigner(digest, consent.get(i))
                    .orElseThrow(() -> new LedgerException(LedgerError.INVALID_SIGNATURE,
                            "Cancel signature " + index + " does not verify"));
            if (!joined.contains(signer)) {
                throw new LedgerException(LedgerError.INVALID_SIGNATURE,
                        "Cancel signature " + index + " is not from a joined participant");
            }
            if (!signers.add(signer)) {
                throw new LedgerException(LedgerError.DUPLICATE_SIGNER,
                        "Participant " + signer + " signed more than once");
            }
        }
        return signers;
    }
}
