package me.golemcore.agent.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.adapter.inbound.web.dto.ConfigUpdateRequest;
import me.golemcore.agent.adapter.inbound.web.dto.ConfigUpdateResponse;
import me.golemcore.agent.adapter.inbound.web.dto.SessionConfigDto;
import me.golemcore.agent.adapter.inbound.web.dto.SessionDetailDto;
import me.golemcore.agent.adapter.inbound.web.dto.SessionSummaryDto;
import me.golemcore.agent.adapter.inbound.web.dto.ToolTraceDto;
import me.golemcore.agent.domain.exception.SessionNotFoundException;
import me.golemcore.agent.domain.model.ConfigUpdateResult;
import me.golemcore.agent.domain.model.MemoryKind;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.SessionConfigUpdate;
import me.golemcore.agent.domain.model.SessionSnapshot;
import me.golemcore.agent.port.outbound.SessionPort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
@Slf4j
public class SessionsController {

    private final SessionPort sessionPort;

    @GetMapping
    public Mono<ResponseEntity<List<SessionSummaryDto>>> listSessions() {
        List<SessionSummaryDto> dtos = sessionPort.listAll().stream()
                .map(this::toSummary)
                .toList();
        return Mono.just(ResponseEntity.ok(dtos));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<SessionDetailDto>> getSession(@PathVariable String id) {
        SessionSnapshot snapshot = sessionPort.getSnapshot(id);
        return Mono.just(ResponseEntity.ok(toDetail(snapshot)));
    }

    @PatchMapping("/{id}/config")
    public Mono<ResponseEntity<ConfigUpdateResponse>> updateConfig(@PathVariable String id,
            @RequestBody(required = false) ConfigUpdateRequest request) {
        SessionConfigUpdate update = toUpdate(request);
        // waits on the session lock while an exchange is running
        return Mono.fromCallable(() -> sessionPort.applyConfigUpdate(id, update))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> ResponseEntity.ok(toUpdateResponse(result)));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> deleteSession(@PathVariable String id) {
        if (!sessionPort.delete(id)) {
            throw new SessionNotFoundException(id);
        }
        log.info("[API] Deleted session {}", id);
        return Mono.just(ResponseEntity.noContent().build());
    }

    private SessionConfigUpdate toUpdate(ConfigUpdateRequest request) {
        if (request == null) {
            return new SessionConfigUpdate();
        }
        return SessionConfigUpdate.builder()
                .model(request.getModel())
                .temperature(request.getTemperature())
                .tools(request.getTools())
                .memoryKind(request.getMemoryKind() != null ? MemoryKind.parse(request.getMemoryKind()) : null)
                .build();
    }

    private ConfigUpdateResponse toUpdateResponse(ConfigUpdateResult result) {
        return ConfigUpdateResponse.builder()
                .sessionId(result.getSessionId())
                .config(SessionConfigDto.from(result.getConfig()))
                .discardedSummary(result.isDiscardedSummary())
                .warnings(result.getWarnings())
                .build();
    }

    private SessionSummaryDto toSummary(SessionSnapshot snapshot) {
        return SessionSummaryDto.builder()
                .sessionId(snapshot.getSessionId())
                .createdAt(format(snapshot.getCreatedAt()))
                .lastInteraction(format(snapshot.getLastInteraction()))
                .model(snapshot.getConfig().getModel())
                .memoryKind(snapshot.getConfig().getMemoryKind().name())
                .messageCount(snapshot.getHistory() != null ? snapshot.getHistory().size() : 0)
                .hasSummary(snapshot.getSummary() != null && !snapshot.getSummary().isBlank())
                .build();
    }

    private SessionDetailDto toDetail(SessionSnapshot snapshot) {
        List<SessionDetailDto.MessageDto> history = snapshot.getHistory().stream()
                .map(this::toMessageDto)
                .toList();
        return SessionDetailDto.builder()
                .sessionId(snapshot.getSessionId())
                .createdAt(format(snapshot.getCreatedAt()))
                .lastInteraction(format(snapshot.getLastInteraction()))
                .config(SessionConfigDto.from(snapshot.getConfig()))
                .history(history)
                .summary(snapshot.getSummary())
                .build();
    }

    private SessionDetailDto.MessageDto toMessageDto(Message message) {
        List<ToolTraceDto> trace = message.getToolTrace() != null && !message.getToolTrace().isEmpty()
                ? ToolTraceDto.fromAll(message.getToolTrace())
                : null;
        return SessionDetailDto.MessageDto.builder()
                .role(message.getRole())
                .content(message.getContent())
                .timestamp(format(message.getTimestamp()))
                .toolTrace(trace)
                .build();
    }

    private String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
