package com.milestake.node.connector;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory credential store for development and tests.
 */
public class InMemoryActivityCredentialStore implements ActivityCredentialStore {

    private final Map<String, OAuthTokens> tokens = new ConcurrentHashMap<>();

    @Override
    public Optional<OAuthTokens> find(String identity) {
        return Optional.ofNullable(tokens.get(key(identity)));
    }

    @Override
    public void save(String identity, OAuthTokens oauthTokens) {
        tokens.put(key(identity), oauthTokens);
    }

    private static String key(String identity) {
        return identity.toLowerCase(Locale.ROOT);
    }
}
