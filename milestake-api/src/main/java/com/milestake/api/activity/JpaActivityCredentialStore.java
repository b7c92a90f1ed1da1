package com.milestake.api.activity;

import com.milestake.core.domain.ActivityAccount;
import com.milestake.core.repository.ActivityAccountRepository;
import com.milestake.node.connector.ActivityCredentialStore;
import com.milestake.node.connector.OAuthTokens;
import com.milestake.node.connector.StravaConnector;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Locale;
import java.util.Optional;

/**
 * Strava credentials stored in the {@code activity_accounts} table.
 */
@Component
public class JpaActivityCredentialStore implements ActivityCredentialStore {

    private final ActivityAccountRepository accountRepository;
    private final Clock clock;

    public JpaActivityCredentialStore(ActivityAccountRepository accountRepository, Clock clock) {
        this.accountRepository = accountRepository;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<OAuthTokens> find(String identity) {
        return accountRepository.findByWalletAddressAndProvider(key(identity), StravaConnector.CONNECTOR_ID)
                .map(account -> new OAuthTokens(account.getAthleteId(), account.getAccessToken(),
                        account.getRefreshToken(), account.getExpiresAt()));
    }

    @Override
    @Transactional
    public void save(String identity, OAuthTokens tokens) {
        String wallet = key(identity);
        ActivityAccount account = accountRepository
                .findByWalletAddressAndProvider(wallet, StravaConnector.CONNECTOR_ID)
                .map(existing -> {
                    existing.rotateTokens(tokens.accessToken(), tokens.refreshToken(), tokens.expiresAt(),
                            clock.instant());
                    if (tokens.athleteId() != null) {
                        existing.relink(tokens.athleteId());
                    }
                    return existing;
                })
                .orElseGet(() -> ActivityAccount.link(wallet, StravaConnector.CONNECTOR_ID, tokens.athleteId(),
                        tokens.accessToken(), tokens.refreshToken(), tokens.expiresAt(), clock.instant()));
        accountRepository.save(account);
    }

    private static String key(String identity) {
        return identity.toLowerCase(Locale.ROOT);
    }
}
