package com.milestake.api.support;

import com.milestake.blockchain.signature.ChallengeMessages;
import com.milestake.blockchain.signature.EthereumSignatures;
import org.web3j.crypto.Credentials;

import java.util.Locale;

/**
 * Default Hardhat development accounts.
 */
public final class Wallets {

    public static final Credentials ATTESTER =
            Credentials.create("0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80");
    public static final Credentials ALICE =
            Credentials.create("0x59c6995e998f97a5a0044966f0945389dc9e86dae88c7a8412f4603b6b78690d");
    public static final Credentials BOB =
            Credentials.create("0x5de4111afa1a4b94908f83103eb1f1706367c2e68ca870fc3fb9a804cdab365a");
    public static final Credentials CAROL =
            Credentials.create("0x7c852118294e51e653712a81e05800f419141751be58f605c371e15141b007a6");
    public static final Credentials MALLORY =
            Credentials.create("0x47e179ec197488593b187f80a00eb0da91f1b9d0b13f8733639f19c30a34926a");

    private Wallets() {}

    public static String address(Credentials credentials) {
        return credentials.getAddress().toLowerCase(Locale.ROOT);
    }

    public static String confirmation(long challengeId, Credentials signer) {
        return EthereumSignatures.sign(ChallengeMessages.confirmMessage(challengeId), signer);
    }
}
