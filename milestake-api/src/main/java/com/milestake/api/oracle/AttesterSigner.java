package com.milestake.api.oracle;

import com.milestake.api.config.OracleProperties;
import com.milestake.blockchain.contract.Attestation;
import com.milestake.blockchain.signature.Addresses;
import com.milestake.blockchain.signature.ChallengeMessages;
import com.milestake.blockchain.signature.EthereumSignatures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Credentials;

/**
 * Holds the attester key and signs finalize digests.
 */
@Component
public class AttesterSigner {

    private static final Logger log = LoggerFactory.getLogger(AttesterSigner.class);

    private final Credentials credentials;

    @Autowired
    public AttesterSigner(OracleProperties properties) {
        this(loadCredentials(properties.getPrivateKey()));
        log.info("Attester signing as {}", address());
    }

    public AttesterSigner(Credentials credentials) {
        this.credentials = credentials;
    }

    public String address() {
        return Addresses.normalize(credentials.getAddress());
    }

    public Attestation sign(long challengeId, String winner, String resultHash, long signingTimestamp) {
        String signature = EthereumSignatures.sign(
                ChallengeMessages.finalizeDigest(challengeId, winner, resultHash, signingTimestamp), credentials);
        return new Attestation(challengeId, Addresses.normalize(winner), resultHash, signingTimestamp, signature);
    }

    private static Credentials loadCredentials(String privateKey) {
        if (privateKey == null || privateKey.isBlank()) {
            throw new IllegalStateException("milestake.oracle.private-key is not set");
        }
        return Credentials.create(privateKey.trim());
    }
}
