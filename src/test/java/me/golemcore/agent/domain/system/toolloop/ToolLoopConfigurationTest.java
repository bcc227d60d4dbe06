package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.service.ToolRegistry;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.LlmPort;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.Mockito.mock;

class ToolLoopConfigurationTest {

    private final ToolLoopConfiguration configuration = new ToolLoopConfiguration();

    @Test
    void shouldCreateToolExecutorPort() {
        ToolExecutorPort port = configuration.toolExecutorPort(mock(ToolRegistry.class), new AgentProperties());

        assertInstanceOf(DefaultToolExecutor.class, port);
    }

    @Test
    void shouldCreateHistoryWriter() {
        HistoryWriter historyWriter = configuration.toolLoopHistoryWriter(Clock.systemUTC());

        assertInstanceOf(DefaultHistoryWriter.class, historyWriter);
    }

    @Test
    void shouldWrapLlmPortWithRetryEnvelope() {
        LlmPort llmPort = mock(LlmPort.class);

        ToolLoopSystem system = configuration.toolLoopSystem(
                llmPort,
                mock(ToolExecutorPort.class),
                mock(HistoryWriter.class),
                new AgentProperties(),
                Clock.systemUTC());

        assertNotNull(system);
        assertInstanceOf(DefaultToolLoopSystem.class, system);
        Object wrapped = ReflectionTestUtils.getField(system, "llmPort");
        RetryingLlmPortDecorator decorator = assertInstanceOf(RetryingLlmPortDecorator.class, wrapped);
        assertSame(llmPort, ReflectionTestUtils.getField(decorator, "delegate"));
    }
}
