package me.golemcore.agent.adapter.outbound.llm;

import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmAdapterFactoryTest {

    private AgentProperties properties;
    private LlmProviderAdapter primary;
    private NoOpLlmAdapter noOp;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        primary = mock(LlmProviderAdapter.class);
        when(primary.getProviderId()).thenReturn("langchain4j");
        when(primary.isAvailable()).thenReturn(true);
        when(primary.getCurrentModel()).thenReturn("gpt-4o-mini");
        noOp = new NoOpLlmAdapter();
    }

    @Test
    void shouldSelectConfiguredProvider() {
        properties.getLlm().setProvider("langchain4j");
        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(noOp, primary));

        factory.init();

        assertSame(primary, factory.getActiveAdapter());
        assertEquals("langchain4j", factory.getProviderId());
        assertEquals("gpt-4o-mini", factory.getCurrentModel());
        assertTrue(factory.isAvailable());
        verify(primary).initialize();
    }

    @Test
    void shouldDelegateChatToActiveAdapter() {
        properties.getLlm().setProvider("langchain4j");
        CompletableFuture<LlmResponse> response = CompletableFuture.completedFuture(
                LlmResponse.builder().content("hi").build());
        when(primary.chat(any())).thenReturn(response);
        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(noOp, primary));
        factory.init();

        assertSame(response, factory.chat(LlmRequest.builder().build()));
    }

    @Test
    void shouldFallBackToNoOpForUnknownProvider() throws Exception {
        properties.getLlm().setProvider("mystery");
        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(primary, noOp));

        factory.init();

        assertSame(noOp, factory.getActiveAdapter());
        assertFalse(factory.isAvailable());
        assertEquals("[No LLM configured]", factory.chat(LlmRequest.builder().build()).get().getContent());
    }
}
