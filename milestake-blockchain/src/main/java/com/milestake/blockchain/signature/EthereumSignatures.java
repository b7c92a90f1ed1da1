package com.milestake.blockchain.signature;

import org.web3j.crypto.Credentials;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * secp256k1 personal-message signatures encoded as 65-byte {@code r || s || v} hex.
 */
public final class EthereumSignatures {

    private static final Pattern SIGNATURE = Pattern.compile("^0x[0-9a-fA-F]{130}$");

    private EthereumSignatures() {}

    public static String sign(byte[] message, Credentials credentials) {
        Sign.SignatureData data = Sign.signPrefixedMessage(message, credentials.getEcKeyPair());
        byte[] encoded = new byte[65];
        System.arraycopy(data.getR(), 0, encoded, 0, 32);
        System.arraycopy(data.getS(), 0, encoded, 32, 32);
        encoded[64] = data.getV()[0];
        return Numeric.toHexString(encoded);
    }

    /**
     * Recovers the signer of a personal message.
     *
     * @return the lower-case signer address, or empty if the signature is malformed
     *         or does not recover to any key
     */
    public static Optional<String> recoverSigner(byte[] message, String signatureHex) {
        if (signatureHex == null || !SIGNATURE.matcher(signatureHex).matches()) {
            return Optional.empty();
        }
        byte[] raw = Numeric.hexStringToByteArray(signatureHex);
        byte v = raw[64];
        if (v < 27) {
            v += 27;
        }
        Sign.SignatureData data = new Sign.SignatureData(
                v,
                Arrays.copyOfRange(raw, 0, 32),
                Arrays.copyOfRange(raw, 32, 64));
        try {
            BigInteger publicKey = Sign.signedPrefixedMessageToKey(message, data);
            return Optional.of(Numeric.prependHexPrefix(Keys.getAddress(publicKey)));
        } catch (SignatureException | RuntimeException e) {
            return Optional.empty();
        }
    }

    public static boolean isSignedBy(byte[] message, String signatureHex, String expectedSigner) {
        return recoverSigner(message, signatureHex)
                .map(signer -> Addresses.same(signer, expectedSigner))
                .orElse(false);
    }
}
