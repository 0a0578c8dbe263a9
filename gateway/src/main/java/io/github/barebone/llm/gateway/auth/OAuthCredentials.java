package io.github.barebone.llm.gateway.auth;

import io.github.barebone.llm.common.GatewayConstants;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * An OAuth access/refresh token pair.
 * <p>
 * {@link #getExpiresAt()} already has the refresh margin subtracted, so a
 * credential reports itself expired a few minutes before the backend would
 * reject it. Instances are immutable; a refresh produces a new instance.
 */
public final class OAuthCredentials {

    public static final Duration REFRESH_MARGIN = Duration.ofSeconds(GatewayConstants.TOKEN_REFRESH_MARGIN_SECONDS);

    private final String accessToken;
    private final String refreshToken;
    private final Instant expiresAt;
    private final String accountId;

    public OAuthCredentials(String accessToken, String refreshToken, Instant expiresAt, String accountId) {
        this.accessToken = Objects.requireNonNull(accessToken, "accessToken cannot be null");
        this.refreshToken = refreshToken != null ? refreshToken : "";
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt cannot be null");
        this.accountId = accountId;
    }

    /**
     * Creates credentials from a token endpoint response, applying the refresh margin.
     */
    public static OAuthCredentials fromExpiresIn(String accessToken, String refreshToken,
                                                 long expiresInSeconds, String accountId, Clock clock) {
        return fromRawExpiry(accessToken, refreshToken,
                clock.instant().plusSeconds(expiresInSeconds), accountId);
    }

    /**
     * Creates credentials from the expiry the backend itself reports, applying the refresh margin.
     */
    public static OAuthCredentials fromRawExpiry(String accessToken, String refreshToken,
                                                 Instant rawExpiry, String accountId) {
        return new OAuthCredentials(accessToken, refreshToken, rawExpiry.minus(REFRESH_MARGIN), accountId);
    }

    public String getAccessToken() {
        return accessToken;
    }

    /**
     * Refresh token, empty when the backend issued none
     */
    public String getRefreshToken() {
        return refreshToken;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    /**
     * Expiry as reported by the backend, i.e. without the refresh margin.
     */
    public Instant getRawExpiry() {
        return expiresAt.plus(REFRESH_MARGIN);
    }

    public String getAccountId() {
        return accountId;
    }

    public boolean hasRefreshToken() {
        return !refreshToken.isEmpty();
    }

    public boolean isExpired(Clock clock) {
        return !clock.instant().isBefore(expiresAt);
    }

    public OAuthCredentials withAccountId(String accountId) {
        return new OAuthCredentials(accessToken, refreshToken, expiresAt, accountId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OAuthCredentials that = (OAuthCredentials) o;
        return accessToken.equals(that.accessToken) &&
                refreshToken.equals(that.refreshToken) &&
                expiresAt.equals(that.expiresAt) &&
                Objects.equals(accountId, that.accountId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(accessToken, refreshToken, expiresAt, accountId);
    }

    @Override
    public String toString() {
        // Never include token values
        return "OAuthCredentials{" +
                "expiresAt=" + expiresAt +
                ", accountId='" + accountId + '\'' +
                ", hasRefreshToken=" + hasRefreshToken() +
                '}';
    }
}
