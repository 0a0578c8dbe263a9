package io.github.barebone.llm.gateway.auth;

import io.github.barebone.llm.gateway.BackendId;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * OAuth client settings of one backend.
 */
public final class OAuthClientConfig {

    /**
     * How the authorization code gets back to the gateway
     */
    public enum RedirectMode {
        /** The browser redirects to a listener on 127.0.0.1 */
        LOOPBACK,
        /** The provider shows the code and the user pastes it back as {@code code#state} */
        MANUAL_CODE
    }

    /**
     * Body encoding expected by the token endpoint
     */
    public enum TokenEncoding {
        JSON,
        FORM
    }

    private final BackendId backendId;
    private final String clientId;
    private final String authorizeUrl;
    private final String tokenUrl;
    private final String redirectUri;
    private final String scope;
    private final Map<String, String> extraAuthorizeParams;
    private final RedirectMode redirectMode;
    private final TokenEncoding tokenEncoding;
    private final boolean stateInTokenRequest;
    private final boolean accountIdFromToken;

    private OAuthClientConfig(Builder builder) {
        this.backendId = Objects.requireNonNull(builder.backendId, "backendId cannot be null");
        this.clientId = Objects.requireNonNull(builder.clientId, "clientId cannot be null");
        this.authorizeUrl = Objects.requireNonNull(builder.authorizeUrl, "authorizeUrl cannot be null");
        this.tokenUrl = Objects.requireNonNull(builder.tokenUrl, "tokenUrl cannot be null");
        this.redirectUri = Objects.requireNonNull(builder.redirectUri, "redirectUri cannot be null");
        this.scope = builder.scope;
        this.extraAuthorizeParams = Collections.unmodifiableMap(new LinkedHashMap<>(builder.extraAuthorizeParams));
        this.redirectMode = builder.redirectMode;
        this.tokenEncoding = builder.tokenEncoding;
        this.stateInTokenRequest = builder.stateInTokenRequest;
        this.accountIdFromToken = builder.accountIdFromToken;
    }

    /**
     * Anthropic console login: manual code paste, JSON token requests.
     */
    public static OAuthClientConfig anthropic() {
        return builder()
                .backendId(BackendId.ANTHROPIC)
                .clientId("9d1c250a-e61b-44d9-88ed-5944d1962f5e")
                .authorizeUrl("https://claude.ai/oauth/authorize")
                .tokenUrl("https://console.anthropic.com/v1/oauth/token")
                .redirectUri("https://console.anthropic.com/oauth/code/callback")
                .scope("org:create_api_key user:profile user:inference")
                .extraAuthorizeParam("code", "true")
                .redirectMode(RedirectMode.MANUAL_CODE)
                .tokenEncoding(TokenEncoding.JSON)
                .stateInTokenRequest(true)
                .build();
    }

    /**
     * OpenAI Codex login: loopback redirect on port 1455, form encoded token requests.
     */
    public static OAuthClientConfig openAiCodex(String originator) {
        return builder()
                .backendId(BackendId.OPENAI_CODEX)
                .clientId("app_EMoamEEZ73f0CkXaXp7hrann")
                .authorizeUrl("https://auth.openai.com/oauth/authorize")
                .tokenUrl("https://auth.openai.com/oauth/token")
                .redirectUri("http://localhost:1455/auth/callback")
                .scope("openid profile email offline_access")
                .extraAuthorizeParam("id_token_add_organizations", "true")
                .extraAuthorizeParam("codex_cli_simplified_flow", "true")
                .extraAuthorizeParam("originator", originator)
                .redirectMode(RedirectMode.LOOPBACK)
                .tokenEncoding(TokenEncoding.FORM)
                .accountIdFromToken(true)
                .build();
    }

    public BackendId getBackendId() {
        return backendId;
    }

    public String getClientId() {
        return clientId;
    }

    public String getAuthorizeUrl() {
        return authorizeUrl;
    }

    public String getTokenUrl() {
        return tokenUrl;
    }

    public String getRedirectUri() {
        return redirectUri;
    }

    public String getScope() {
        return scope;
    }

    public Map<String, String> getExtraAuthorizeParams() {
        return extraAuthorizeParams;
    }

    public RedirectMode getRedirectMode() {
        return redirectMode;
    }

    public TokenEncoding getTokenEncoding() {
        return tokenEncoding;
    }

    /**
     * Whether the authorization code grant must echo {@code state}
     */
    public boolean isStateInTokenRequest() {
        return stateInTokenRequest;
    }

    /**
     * Whether the account id is read from the access token's claims
     */
    public boolean isAccountIdFromToken() {
        return accountIdFromToken;
    }

    /**
     * Port of the loopback redirect URI.
     */
    public int getCallbackPort() {
        int port = URI.create(redirectUri).getPort();
        return port > 0 ? port : 80;
    }

    /**
     * Path of the loopback redirect URI.
     */
    public String getCallbackPath() {
        String path = URI.create(redirectUri).getPath();
        return path == null || path.isEmpty() ? "/" : path;
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .backendId(backendId)
                .clientId(clientId)
                .authorizeUrl(authorizeUrl)
                .tokenUrl(tokenUrl)
                .redirectUri(redirectUri)
                .scope(scope)
                .redirectMode(redirectMode)
                .tokenEncoding(tokenEncoding)
                .stateInTokenRequest(stateInTokenRequest)
                .accountIdFromToken(accountIdFromToken);
        extraAuthorizeParams.forEach(builder::extraAuthorizeParam);
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private BackendId backendId;
        private String clientId;
        private String authorizeUrl;
        private String tokenUrl;
        private String redirectUri;
        private String scope;
        private final Map<String, String> extraAuthorizeParams = new LinkedHashMap<>();
        private RedirectMode redirectMode = RedirectMode.LOOPBACK;
        private TokenEncoding tokenEncoding = TokenEncoding.FORM;
        private boolean stateInTokenRequest;
        private boolean accountIdFromToken;

        public Builder backendId(BackendId backendId) {
            this.backendId = backendId;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder authorizeUrl(String authorizeUrl) {
            this.authorizeUrl = authorizeUrl;
            return this;
        }

        public Builder tokenUrl(String tokenUrl) {
            this.tokenUrl = tokenUrl;
            return this;
        }

        public Builder redirectUri(String redirectUri) {
            this.redirectUri = redirectUri;
            return this;
        }

        public Builder scope(String scope) {
            this.scope = scope;
            return this;
        }

        public Builder extraAuthorizeParam(String name, String value) {
            this.extraAuthorizeParams.put(name, value);
            return this;
        }

        public Builder redirectMode(RedirectMode redirectMode) {
            this.redirectMode = redirectMode;
            return this;
        }

        public Builder tokenEncoding(TokenEncoding tokenEncoding) {
            this.tokenEncoding = tokenEncoding;
            return this;
        }

        public Builder stateInTokenRequest(boolean stateInTokenRequest) {
            this.stateInTokenRequest = stateInTokenRequest;
            return this;
        }

        public Builder accountIdFromToken(boolean accountIdFromToken) {
            this.accountIdFromToken = accountIdFromToken;
            return this;
        }

        public OAuthClientConfig build() {
            return new OAuthClientConfig(this);
        }
    }
}
