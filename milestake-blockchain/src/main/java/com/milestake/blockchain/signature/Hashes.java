package com.milestake.blockchain.signature;

import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Keccak-256 helpers for 32-byte commitments rendered as 0x-prefixed hex.
 */
public final class Hashes {

    public static final String EMPTY = "0x" + "0".repeat(64);

    private static final Pattern BYTES32 = Pattern.compile("^0x[0-9a-fA-F]{64}$");

    private Hashes() {}

    public static String keccak256(String utf8) {
        return Numeric.toHexString(Hash.sha3(utf8.getBytes(StandardCharsets.UTF_8)));
    }

    public static boolean isWellFormed(String hash) {
        return hash != null && BYTES32.matcher(hash).matches();
    }

    /**
     * True for a missing, malformed or all-zero commitment.
     */
    public static boolean isEmpty(String hash) {
        if (!isWellFormed(hash)) {
            return true;
        }
        byte[] bytes = Numeric.hexStringToByteArray(hash);
        byte[] zero = new byte[32];
        return Arrays.equals(bytes, zero);
    }

    public static String normalize(String hash) {
        if (!isWellFormed(hash)) {
            throw new IllegalArgumentException("Expected 32-byte hex value: " + hash);
        }
        return hash.toLowerCase(Locale.ROOT);
    }

    public static byte[] toBytes32(String hash) {
        return Numeric.hexStringToByteArray(normalize(hash));
    }
}
