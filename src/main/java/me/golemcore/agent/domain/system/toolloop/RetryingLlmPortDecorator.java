package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.exception.ExchangeCancelledException;
import me.golemcore.agent.domain.exception.ReasoningEngineUnavailableException;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.system.LlmErrorClassifier;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Timeout and retry envelope around reasoning calls. Transient failures
 * (timeouts, rate limits, 5xx, malformed responses) are retried with
 * exponential backoff; anything else fails on the first attempt.
 *
 * <p>
 * The retries run on the calling thread, so the returned future is always
 * complete. Failures complete it with
 * {@link ReasoningEngineUnavailableException}, interruption with
 * {@link ExchangeCancelledException}.
 */
class RetryingLlmPortDecorator implements LlmPort {

    private static final Logger log = LoggerFactory.getLogger(RetryingLlmPortDecorator.class);

    private final LlmPort delegate;
    private final AgentProperties.ReasoningProperties settings;

    RetryingLlmPortDecorator(LlmPort delegate, AgentProperties.ReasoningProperties settings) {
        this.delegate = delegate;
        this.settings = settings;
    }

    @Override
    public String getProviderId() {
        return delegate.getProviderId();
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        try {
            return CompletableFuture.completedFuture(chatWithRetry(request));
        } catch (ReasoningEngineUnavailableException | ExchangeCancelledException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private LlmResponse chatWithRetry(LlmRequest request) {
        int maxAttempts = Math.max(1, settings.getMaxAttempts());
        Duration backoff = settings.getInitialBackoff();

        for (int attempt = 1;; attempt++) {
            Throwable failure;
            String code;
            CompletableFuture<LlmResponse> future = null;
            try {
                future = delegate.chat(request);
                LlmResponse response = future.get(settings.getCallTimeout().toMillis(), TimeUnit.MILLISECONDS);
                if (response != null) {
                    return response;
                }
                failure = new IllegalStateException("Reasoning engine returned no response");
                code = LlmErrorClassifier.MALFORMED_RESPONSE;
            } catch (TimeoutException e) {
                future.cancel(true);
                failure = e;
                code = LlmErrorClassifier.REQUEST_TIMEOUT;
            } catch (ExecutionException e) {
                failure = e.getCause() != null ? e.getCause() : e;
                code = LlmErrorClassifier.classifyFromThrowable(failure);
            } catch (InterruptedException e) {
                if (future != null) {
                    future.cancel(true);
                }
                Thread.currentThread().interrupt();
                throw new ExchangeCancelledException("Interrupted while waiting for the reasoning engine", e);
            } catch (RuntimeException e) {
                failure = e;
                code = LlmErrorClassifier.classifyFromThrowable(e);
            }

            if (!LlmErrorClassifier.isTransientCode(code)) {
                log.error("[LLM] Reasoning call failed ({}): {}", code, failure.getMessage());
                throw new ReasoningEngineUnavailableException(
                        "Reasoning engine call failed: " + failure.getMessage(), attempt, code, null, failure);
            }
            if (attempt >= maxAttempts) {
                log.error("[LLM] Reasoning engine unavailable after {} attempts ({})", attempt, code);
                throw new ReasoningEngineUnavailableException(
                        "Reasoning engine unavailable after " + attempt + " attempts", attempt, code, backoff,
                        failure);
            }

            log.warn("[LLM] Transient failure {} (attempt {}/{}), retrying in {}ms: {}",
                    code, attempt, maxAttempts, backoff.toMillis(), failure.getMessage());
            sleepForRetry(backoff);
            backoff = nextBackoff(backoff);
        }
    }

    private Duration nextBackoff(Duration current) {
        long next = (long) (current.toMillis() * settings.getBackoffMultiplier());
        return Duration.ofMillis(Math.min(next, settings.getMaxBackoff().toMillis()));
    }

    // Visible for testing
    void sleepForRetry(Duration backoff) {
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExchangeCancelledException("Interrupted during reasoning retry backoff", e);
        }
    }

    @Override
    public String getCurrentModel() {
        return delegate.getCurrentModel();
    }

    @Override
    public boolean isAvailable() {
        return delegate.isAvailable();
    }
}
