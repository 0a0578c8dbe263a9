package io.github.barebone.llm.gateway.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * A PKCE verifier and its S256 challenge.
 */
public final class PkceChallenge {

    public static final String METHOD = "S256";

    private static final int VERIFIER_LENGTH_BYTES = 32;
    private static final int STATE_LENGTH_BYTES = 16;
    private static final String HASH_ALGORITHM = "SHA-256";

    private final String verifier;
    private final String challenge;

    private PkceChallenge(String verifier, String challenge) {
        this.verifier = verifier;
        this.challenge = challenge;
    }

    /**
     * Generates a fresh verifier from 32 random bytes, base64url encoded without padding.
     */
    public static PkceChallenge generate(SecureRandom random) {
        byte[] bytes = new byte[VERIFIER_LENGTH_BYTES];
        random.nextBytes(bytes);
        String verifier = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        return new PkceChallenge(verifier, challengeFor(verifier));
    }

    /**
     * Computes base64url(SHA-256(verifier)) without padding.
     */
    public static String challengeFor(String verifier) {
        try {
            MessageDigest digest = MessageDigest.getInstance(HASH_ALGORITHM);
            byte[] hash = digest.digest(verifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Generates an unpredictable OAuth {@code state} value: 16 random bytes as hex.
     */
    public static String createState(SecureRandom random) {
        byte[] bytes = new byte[STATE_LENGTH_BYTES];
        random.nextBytes(bytes);
        StringBuilder hex = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            hex.append(String.format("%02x", b));
        }
        return hex.toString();
    }

    public String getVerifier() {
        return verifier;
    }

    public String getChallenge() {
        return challenge;
    }
}
