package io.github.barebone.llm.gateway.auth;

import org.junit.jupiter.api.Test;

import java.security.SecureRandom;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PkceChallenge.
 */
class PkceChallengeTest {

    @Test
    void testChallengeFor_rfc7636Example() {
        assertEquals("E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM",
                PkceChallenge.challengeFor("dBjftJeZ4CVP-mB92K27uhbUJU1p1r_wW1gFWFOEjXk"));
    }

    @Test
    void testGenerate_verifierIsUnpaddedBase64Url() {
        PkceChallenge pkce = PkceChallenge.generate(new SecureRandom());

        assertEquals(43, pkce.getVerifier().length());
        assertTrue(pkce.getVerifier().matches("[A-Za-z0-9_-]+"));
        assertEquals(PkceChallenge.challengeFor(pkce.getVerifier()), pkce.getChallenge());
    }

    @Test
    void testGenerate_freshVerifierEachTime() {
        SecureRandom random = new SecureRandom();
        Set<String> verifiers = new HashSet<>();
        for (int i = 0; i < 20; i++) {
            verifiers.add(PkceChallenge.generate(random).getVerifier());
        }
        assertEquals(20, verifiers.size());
    }

    @Test
    void testCreateState_is32HexChars() {
        String state = PkceChallenge.createState(new SecureRandom());
        assertTrue(state.matches("[0-9a-f]{32}"), state);
    }

    @Test
    void testMethodIsS256() {
        assertEquals("S256", PkceChallenge.METHOD);
    }
}
