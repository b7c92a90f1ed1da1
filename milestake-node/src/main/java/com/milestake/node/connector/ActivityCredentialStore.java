package com.milestake.node.connector;

import java.util.Optional;

/**
 * Storage for activity-service credentials, keyed by wallet address.
 */
public interface ActivityCredentialStore {

    Optional<OAuthTokens> find(String identity);

    void save(String identity, OAuthTokens tokens);
}
