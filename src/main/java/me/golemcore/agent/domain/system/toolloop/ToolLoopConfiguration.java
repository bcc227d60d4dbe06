package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.service.ToolRegistry;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.LlmPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ToolLoopConfiguration {

    @Bean
    public ToolExecutorPort toolExecutorPort(ToolRegistry toolRegistry, AgentProperties properties) {
        return new DefaultToolExecutor(toolRegistry, properties.getTools());
    }

    @Bean
    public HistoryWriter toolLoopHistoryWriter(Clock clock) {
        return new DefaultHistoryWriter(clock);
    }

    @Bean
    public ToolLoopSystem toolLoopSystem(LlmPort llmPort, ToolExecutorPort toolExecutorPort,
            HistoryWriter historyWriter, AgentProperties properties, Clock clock) {
        LlmPort retrying = new RetryingLlmPortDecorator(llmPort, properties.getReasoning());
        return new DefaultToolLoopSystem(retrying, toolExecutorPort, historyWriter, properties.getLoop(),
                properties.getLlm(), clock);
    }
}
