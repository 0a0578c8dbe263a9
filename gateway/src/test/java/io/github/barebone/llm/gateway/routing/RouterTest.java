package io.github.barebone.llm.gateway.routing;

import io.github.barebone.llm.gateway.BackendId;
import io.github.barebone.llm.gateway.providers.BackendAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for Router.
 */
class RouterTest {

    @Mock
    private BackendAdapter anthropic;

    @Mock
    private BackendAdapter openRouter;

    @Mock
    private BackendAdapter codex;

    private Router router;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(anthropic.getBackendId()).thenReturn(BackendId.ANTHROPIC);
        when(openRouter.getBackendId()).thenReturn(BackendId.OPENROUTER);
        when(codex.getBackendId()).thenReturn(BackendId.OPENAI_CODEX);

        router = new Router();
        router.register(anthropic);
        router.register(openRouter);
        router.register(codex);
    }

    // ========== Namespace Prefixes ==========

    @Test
    void testRoute_anthropicNamespaceIsStripped() throws Exception {
        Route route = router.route("anthropic/claude-sonnet-4-20250514");

        assertEquals(BackendId.ANTHROPIC, route.getBackendId());
        assertSame(anthropic, route.getAdapter());
        assertEquals("claude-sonnet-4-20250514", route.getLocalModelId());
    }

    @Test
    void testRoute_openRouterKeepsNestedNamespace() throws Exception {
        Route route = router.route("openrouter/meta-llama/llama-3.1-70b-instruct");

        assertEquals(BackendId.OPENROUTER, route.getBackendId());
        assertEquals("meta-llama/llama-3.1-70b-instruct", route.getLocalModelId());
    }

    @Test
    void testRoute_codexAliases() throws Exception {
        assertEquals("gpt-5-codex", router.route("openai-codex/gpt-5-codex").getLocalModelId());
        assertEquals(BackendId.OPENAI_CODEX, router.route("codex/gpt-5").getBackendId());
    }

    @Test
    void testRoute_barePrefixIsUnknown() {
        UnknownModelException e = assertThrows(UnknownModelException.class, () -> router.route("anthropic/"));
        assertEquals("anthropic/", e.getModelId());
    }

    @Test
    void testRoute_blankIdIsUnknown() {
        assertThrows(UnknownModelException.class, () -> router.route(""));
        assertThrows(UnknownModelException.class, () -> router.route(null));
    }

    // ========== Model Families ==========

    @Test
    void testRoute_claudeFamilyKeepsId() throws Exception {
        Route route = router.route("Claude-3-5-Haiku-latest");

        assertEquals(BackendId.ANTHROPIC, route.getBackendId());
        assertEquals("Claude-3-5-Haiku-latest", route.getLocalModelId());
    }

    @Test
    void testRoute_gpt5FamilyGoesToCodex() throws Exception {
        assertEquals(BackendId.OPENAI_CODEX, router.route("gpt-5.1").getBackendId());
    }

    // ========== Fallback ==========

    @Test
    void testRoute_unmatchedWithoutDefault() {
        NoProviderConfiguredException e = assertThrows(NoProviderConfiguredException.class,
                () -> router.route("mistral-large"));
        assertNull(e.getBackendId());
        assertEquals("mistral-large", e.getModelId());
    }

    @Test
    void testRoute_unmatchedUsesDefaultBackend() throws Exception {
        router.setDefaultBackend(BackendId.OPENROUTER);

        Route route = router.route("mistralai/mistral-large");

        assertSame(openRouter, route.getAdapter());
        assertEquals("mistralai/mistral-large", route.getLocalModelId());
    }

    @Test
    void testRoute_matchedBackendNotRegistered() {
        router.remove(BackendId.ANTHROPIC);

        NoProviderConfiguredException e = assertThrows(NoProviderConfiguredException.class,
                () -> router.route("claude-opus-4"));
        assertEquals("anthropic", e.getBackendId());
    }

    @Test
    void testRoute_defaultDoesNotOverrideMatchedRule() {
        router.remove(BackendId.ANTHROPIC);
        router.setDefaultBackend(BackendId.OPENROUTER);

        assertThrows(NoProviderConfiguredException.class, () -> router.route("anthropic/claude-opus-4"));
    }

    // ========== Registration ==========

    @Test
    void testRegister_replacesAdapter() throws Exception {
        BackendAdapter replacement = mock(BackendAdapter.class);
        when(replacement.getBackendId()).thenReturn(BackendId.ANTHROPIC);

        router.register(replacement);

        assertSame(replacement, router.route("claude-opus-4").getAdapter());
        assertEquals(3, router.getAdapters().size());
    }

    @Test
    void testRoute_isDeterministic() throws Exception {
        Route first = router.route("openrouter/openai/gpt-4o");
        Route second = router.route("openrouter/openai/gpt-4o");

        assertEquals(first.getBackendId(), second.getBackendId());
        assertEquals(first.getLocalModelId(), second.getLocalModelId());
    }
}
