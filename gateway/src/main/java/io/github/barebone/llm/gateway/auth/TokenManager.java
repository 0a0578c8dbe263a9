package io.github.barebone.llm.gateway.auth;

import io.github.barebone.llm.gateway.BackendId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Vends valid access tokens for one backend, refreshing them when they expire.
 * <p>
 * Expiry is checked without locking. Only an expired credential takes the
 * refresh lock, and the check is repeated under it, so concurrent callers
 * cause at most one refresh. A refreshed credential is written back to the
 * store it was loaded from and to the gateway's credential file, then
 * announced to refresh listeners.
 */
public class TokenManager {

    private static final Logger logger = LoggerFactory.getLogger(TokenManager.class);

    private final BackendId backend;
    private final OAuthTokenClient tokenClient;
    private final List<CredentialSource> persistTargets;
    private final Clock clock;
    private final ReentrantLock refreshLock = new ReentrantLock();
    private final List<TokenRefreshListener> listeners = new CopyOnWriteArrayList<>();

    private volatile OAuthCredentials credentials;

    public TokenManager(BackendId backend, OAuthTokenClient tokenClient, OAuthCredentials credentials,
                        List<CredentialSource> persistTargets, Clock clock) {
        this.backend = backend;
        this.tokenClient = tokenClient;
        this.credentials = credentials;
        this.persistTargets = Collections.unmodifiableList(new ArrayList<>(persistTargets));
        this.clock = clock;
    }

    /**
     * Creates a manager for whatever the store holds for the backend. Refreshed credentials
     * go back to the source they came from (when writable) and to the gateway file.
     */
    public static TokenManager load(BackendId backend, CredentialStore store, OAuthTokenClient tokenClient,
                                    Clock clock) {
        Optional<LoadedCredential> loaded = store.load(backend);
        List<CredentialSource> targets = new ArrayList<>();
        OAuthCredentials initial = null;
        if (loaded.isPresent()) {
            initial = loaded.get().getCredentials();
            CredentialSource source = loaded.get().getSource();
            if (source.isWritable() && source != store.getGatewayFile()) {
                targets.add(source);
            }
        }
        targets.add(store.getGatewayFile());
        return new TokenManager(backend, tokenClient, initial, targets, clock);
    }

    public BackendId getBackend() {
        return backend;
    }

    public boolean hasCredentials() {
        return credentials != null;
    }

    /**
     * The current credential, possibly expired; null when none was ever loaded.
     */
    public OAuthCredentials getCredentials() {
        return credentials;
    }

    /**
     * Returns a valid access token, refreshing first if the current one is expired.
     */
    public String getToken() throws NoCredentialsException, TokenRefreshException {
        return getValidCredentials().getAccessToken();
    }

    /**
     * Returns unexpired credentials, refreshing first if needed.
     */
    public OAuthCredentials getValidCredentials() throws NoCredentialsException, TokenRefreshException {
        OAuthCredentials current = credentials;
        if (current == null) {
            throw new NoCredentialsException(backend.getId());
        }
        if (!current.isExpired(clock)) {
            return current;
        }

        refreshLock.lock();
        try {
            // Another caller may have refreshed while we waited
            current = credentials;
            if (!current.isExpired(clock)) {
                return current;
            }
            return refreshLocked(current);
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * Refreshes after the backend rejected {@code rejectedToken}, unless another caller
     * already replaced that token.
     */
    public OAuthCredentials refreshIfCurrent(String rejectedToken) throws NoCredentialsException, TokenRefreshException {
        refreshLock.lock();
        try {
            OAuthCredentials current = credentials;
            if (current == null) {
                throw new NoCredentialsException(backend.getId());
            }
            if (!current.getAccessToken().equals(rejectedToken)) {
                return current;
            }
            logger.info("{} rejected the access token, refreshing", backend);
            return refreshLocked(current);
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * Installs credentials from a fresh login, persisting them like a refresh.
     */
    public void setCredentials(OAuthCredentials newCredentials) {
        refreshLock.lock();
        try {
            this.credentials = newCredentials;
            persist(newCredentials);
        } finally {
            refreshLock.unlock();
        }
        notifyListeners(newCredentials);
    }

    public void addRefreshListener(TokenRefreshListener listener) {
        listeners.add(listener);
    }

    public void removeRefreshListener(TokenRefreshListener listener) {
        listeners.remove(listener);
    }

    private OAuthCredentials refreshLocked(OAuthCredentials current) throws TokenRefreshException {
        logger.debug("Refreshing {} access token (expired at {})", backend, current.getExpiresAt());
        OAuthCredentials refreshed = tokenClient.refresh(current);
        this.credentials = refreshed;
        persist(refreshed);
        logger.info("Refreshed {} access token, valid until {}", backend, refreshed.getExpiresAt());
        notifyListeners(refreshed);
        return refreshed;
    }

    private void persist(OAuthCredentials newCredentials) {
        for (CredentialSource target : persistTargets) {
            try {
                target.write(backend, newCredentials);
            } catch (IOException e) {
                logger.warn("Could not save {} credentials to {}: {}", backend, target.getName(), e.getMessage());
            }
        }
    }

    private void notifyListeners(OAuthCredentials newCredentials) {
        for (TokenRefreshListener listener : listeners) {
            try {
                listener.onRefresh(backend, newCredentials);
            } catch (RuntimeException e) {
                logger.warn("Token refresh listener failed: {}", e.getMessage(), e);
            }
        }
    }
}
