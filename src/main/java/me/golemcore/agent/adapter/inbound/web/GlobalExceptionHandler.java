package me.golemcore.agent.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.agent.adapter.inbound.web.dto.ToolTraceDto;
import me.golemcore.agent.domain.exception.AgentException;
import me.golemcore.agent.domain.exception.ExchangeCancelledException;
import me.golemcore.agent.domain.exception.InvalidToolArgumentsException;
import me.golemcore.agent.domain.exception.IterationBudgetExceededException;
import me.golemcore.agent.domain.exception.ReasoningEngineUnavailableException;
import me.golemcore.agent.domain.exception.SessionNotFoundException;
import me.golemcore.agent.domain.exception.UnknownToolException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice(basePackages = "me.golemcore.agent.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, ex.getReason(), null, null);
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleSessionNotFound(SessionNotFoundException ex) {
        log.debug("[API] Session not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage(), ex.getCode(), null);
    }

    @ExceptionHandler(UnknownToolException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleUnknownTool(UnknownToolException ex) {
        log.warn("[API] Unknown tool: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), ex.getCode(), null);
    }

    @ExceptionHandler(InvalidToolArgumentsException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleInvalidToolArguments(InvalidToolArgumentsException ex) {
        log.warn("[API] Invalid tool arguments: {}", ex.getMessage());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("tool", ex.getToolName());
        details.put("violations", ex.getViolations());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), ex.getCode(), details);
    }

    @ExceptionHandler(IterationBudgetExceededException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleBudgetExceeded(IterationBudgetExceededException ex) {
        log.warn("[API] Budget exceeded for session {}: {}", ex.getSessionId(), ex.getMessage());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("session_id", ex.getSessionId());
        details.put("iterations", ex.getIterations());
        details.put("reason", ex.getReason());
        details.put("tool_trace", ToolTraceDto.fromAll(ex.getTrace()));
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), ex.getCode(), details);
    }

    @ExceptionHandler(ReasoningEngineUnavailableException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleReasoningUnavailable(ReasoningEngineUnavailableException ex) {
        log.warn("[API] Reasoning engine unavailable after {} attempt(s): {} ({})",
                ex.getAttempts(), ex.getMessage(), ex.getReasonCode());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("attempts", ex.getAttempts());
        details.put("reason_code", ex.getReasonCode());
        details.put("iterations", ex.getIterations());
        details.put("tool_trace", ToolTraceDto.fromAll(ex.getTrace()));
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.SERVICE_UNAVAILABLE.value())
                .message(ex.getMessage())
                .code(ex.getCode())
                .details(details)
                .build();
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE);
        if (ex.getRetryAfter() != null) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds(ex.getRetryAfter())));
        }
        return Mono.just(builder.body(body));
    }

    @ExceptionHandler(ExchangeCancelledException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleCancelled(ExchangeCancelledException ex) {
        log.info("[API] Exchange cancelled: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), ex.getCode(), null);
    }

    @ExceptionHandler(AgentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleAgent(AgentException ex) {
        log.error("[API] Unhandled agent failure ({})", ex.getCode(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), ex.getCode(), null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), "request.invalid", null);
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", null, null);
    }

    static long retryAfterSeconds(Duration retryAfter) {
        long millis = retryAfter.toMillis();
        return Math.max(1L, (millis + 999L) / 1000L);
    }

    private Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String message, String code,
            Map<String, Object> details) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .code(code)
                .details(details)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
