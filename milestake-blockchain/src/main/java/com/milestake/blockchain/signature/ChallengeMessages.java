package com.milestake.blockchain.signature;

import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * Builds the tightly packed, domain-separated digests that attester and
 * participants sign.
 *
 * <pre>
 * finalize = keccak256(packed("FINALIZE_CHALLENGE_", uint256 id, address winner, bytes32 result, uint256 ts))
 * cancel   = keccak256(packed("CANCEL_CHALLENGE_", uint256 id))
 * confirm  = utf8("CONFIRM_CHALLENGE_" + id)
 * </pre>
 *
 * Finalize and cancel digests are signed as 32-byte personal messages; the
 * confirm text is signed as-is.
 */
public final class ChallengeMessages {

    private ChallengeMessages() {}

    public static byte[] finalizeDigest(long challengeId, String winner, String resultHash, long signingTimestamp) {
        ByteArrayOutputStream packed = new ByteArrayOutputStream();
        packed.writeBytes(SignatureDomain.FINALIZE.prefix().getBytes(StandardCharsets.UTF_8));
        packed.writeBytes(uint256(challengeId));
        packed.writeBytes(Numeric.hexStringToByteArray(Addresses.normalize(winner)));
        packed.writeBytes(Hashes.toBytes32(resultHash));
        packed.writeBytes(uint256(signingTimestamp));
        return Hash.sha3(packed.toByteArray());
    }

    public static byte[] cancelDigest(long challengeId) {
        ByteArrayOutputStream packed = new ByteArrayOutputStream();
        packed.writeBytes(SignatureDomain.CANCEL.prefix().getBytes(StandardCharsets.UTF_8));
        packed.writeBytes(uint256(challengeId));
        return Hash.sha3(packed.toByteArray());
    }

    public static byte[] confirmMessage(long challengeId) {
        return (SignatureDomain.CONFIRM.prefix() + challengeId).getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] uint256(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("uint256 cannot be negative: " + value);
        }
        return Numeric.toBytesPadded(BigInteger.valueOf(value), 32);
    }
}
