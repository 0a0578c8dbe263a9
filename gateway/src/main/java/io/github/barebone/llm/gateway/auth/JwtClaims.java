package io.github.barebone.llm.gateway.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

/**
 * Reads claims from an access token without verifying its signature.
 * Only used to pick up account metadata the backend embeds in its own tokens.
 */
public final class JwtClaims {

    private static final Logger logger = LoggerFactory.getLogger(JwtClaims.class);

    static final String OPENAI_AUTH_CLAIM = "https://api.openai.com/auth";
    static final String CHATGPT_ACCOUNT_ID = "chatgpt_account_id";

    private JwtClaims() {
    }

    /**
     * Decodes the payload segment of a JWT.
     */
    public static Optional<JsonNode> decodePayload(String token, ObjectMapper objectMapper) {
        if (token == null) {
            return Optional.empty();
        }
        String[] parts = token.split("\\.");
        if (parts.length != 3) {
            return Optional.empty();
        }
        try {
            byte[] json = Base64.getUrlDecoder().decode(stripPadding(parts[1]));
            return Optional.of(objectMapper.readTree(new String(json, StandardCharsets.UTF_8)));
        } catch (IllegalArgumentException | IOException e) {
            logger.debug("Token payload is not a decodable JWT: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Extracts the ChatGPT account id an OpenAI access token carries.
     */
    public static Optional<String> extractAccountId(String accessToken, ObjectMapper objectMapper) {
        return decodePayload(accessToken, objectMapper)
                .map(payload -> payload.path(OPENAI_AUTH_CLAIM).path(CHATGPT_ACCOUNT_ID).asText(""))
                .filter(id -> !id.isEmpty());
    }

    private static String stripPadding(String segment) {
        int end = segment.length();
        while (end > 0 && segment.charAt(end - 1) == '=') {
            end--;
        }
        return segment.substring(0, end);
    }
}
