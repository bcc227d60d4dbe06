package me.golemcore.agent.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.agent.adapter.inbound.web.dto.SystemHealthResponse;
import me.golemcore.agent.domain.service.ToolRegistry;
import me.golemcore.agent.port.outbound.LlmPort;
import me.golemcore.agent.port.outbound.SessionPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.lang.management.ManagementFactory;

@RestController
@RequestMapping("/api/system")
@RequiredArgsConstructor
public class SystemController {

    private final SessionPort sessionPort;
    private final ToolRegistry toolRegistry;
    private final LlmPort llmPort;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @GetMapping("/health")
    public Mono<ResponseEntity<SystemHealthResponse>> health() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();

        SystemHealthResponse response = SystemHealthResponse.builder()
                .status("UP")
                .version(buildProps != null ? buildProps.getVersion() : "dev")
                .uptimeMs(uptimeMs)
                .sessions(sessionPort.size())
                .tools(toolRegistry.size())
                .llmProvider(llmPort.getProviderId())
                .llmModel(llmPort.getCurrentModel())
                .llmAvailable(llmPort.isAvailable())
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }
}
