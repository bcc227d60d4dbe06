package me.golemcore.agent.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.adapter.inbound.web.dto.ChatRequest;
import me.golemcore.agent.adapter.inbound.web.dto.ChatResponse;
import me.golemcore.agent.adapter.inbound.web.dto.ToolTraceDto;
import me.golemcore.agent.adapter.inbound.web.dto.UsageDto;
import me.golemcore.agent.domain.model.ExchangeRequest;
import me.golemcore.agent.domain.model.ExchangeResult;
import me.golemcore.agent.domain.service.ExchangeDispatcher;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;


/**
 * Conversation entry point. The exchange blocks on the reasoning engine and
 * tools, so the dispatcher runs it on the dedicated exchange executor and
 * never on the event loop. Cancelling the subscription drops a queued request
 * or interrupts its worker, which releases the session lock without
 * committing the turn.
 */
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private final ExchangeDispatcher exchangeDispatcher;

    @PostMapping
    public Mono<ResponseEntity<ChatResponse>> chat(@RequestBody ChatRequest request) {
        if (request == null) {
            return Mono.error(new IllegalArgumentException("Request body is required"));
        }
        ExchangeRequest exchangeRequest = toExchangeRequest(request);
        return Mono.<ExchangeResult>create(sink -> {
            ExchangeDispatcher.Submission submission = exchangeDispatcher.submit(exchangeRequest);
            submission.result().whenComplete((result, error) -> {
                if (error != null) {
                    sink.error(error);
                } else {
                    sink.success(result);
                }
            });
            sink.onCancel(() -> {
                log.debug("[API] Chat request cancelled by client (session {})", request.getSessionId());
                submission.cancel();
            });
        }).map(result -> ResponseEntity.ok(toResponse(result)));
    }

    private ExchangeRequest toExchangeRequest(ChatRequest request) {
        return ExchangeRequest.builder()
                .message(request.getMessage())
                .sessionId(request.getSessionId())
                .temperature(request.getTemperature())
                .tools(request.getTools())
                .model(request.getModel())
                .persist(request.isPersist())
                .build();
    }

    private ChatResponse toResponse(ExchangeResult result) {
        return ChatResponse.builder()
                .sessionId(result.getSessionId())
                .reply(result.getReply())
                .usage(UsageDto.from(result.getUsage()))
                .toolTrace(ToolTraceDto.fromAll(result.getToolTrace()))
                .iterations(result.getIterations())
                .degraded(result.isDegraded())
                .stopReason(result.getStopReason())
                .build();
    }
}
