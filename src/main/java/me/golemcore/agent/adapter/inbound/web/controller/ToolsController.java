package me.golemcore.agent.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.agent.adapter.inbound.web.dto.ToolDto;
import me.golemcore.agent.domain.service.ToolRegistry;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/tools")
@RequiredArgsConstructor
public class ToolsController {

    private final ToolRegistry toolRegistry;
    private final AgentProperties properties;

    @GetMapping
    public Mono<ResponseEntity<List<ToolDto>>> listTools() {
        List<String> defaults = properties.getTools().getEnabled();
        List<ToolDto> dtos = toolRegistry.list().stream()
                .map(definition -> ToolDto.builder()
                        .name(definition.getName())
                        .description(definition.getDescription())
                        .inputSchema(definition.getInputSchema())
                        .enabledByDefault(defaults != null && defaults.contains(definition.getName()))
                        .build())
                .toList();
        return Mono.just(ResponseEntity.ok(dtos));
    }
}
