package me.golemcore.agent.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.exception.ExchangeCancelledException;
import me.golemcore.agent.domain.model.ExchangeRequest;
import me.golemcore.agent.domain.model.ExchangeResult;
import me.golemcore.agent.infrastructure.config.AutoConfiguration;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Hands exchanges to the exchange executor one session at a time.
 *
 * <p>
 * Requests naming a session are chained behind that session's previous
 * request, in arrival order, and only reach the executor once it has
 * finished. A session therefore occupies at most one worker, and a backlog on
 * one session never holds threads that other sessions need. Requests without
 * a session id start a new session and are submitted directly.
 */
@Service
@Slf4j
public class ExchangeDispatcher {

    private final ExchangeService exchangeService;
    private final ExecutorService executor;

    private final Map<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public ExchangeDispatcher(ExchangeService exchangeService,
            @Qualifier(AutoConfiguration.EXCHANGE_EXECUTOR) ExecutorService executor) {
        this.exchangeService = exchangeService;
        this.executor = executor;
    }

    public Submission submit(ExchangeRequest request) {
        Submission submission = new Submission(request);
        String sessionId = request.getSessionId();
        if (sessionId == null || sessionId.isBlank()) {
            submission.start();
            return submission;
        }

        CompletableFuture<Void> done = submission.done;
        CompletableFuture<Void> previous = tails.put(sessionId, done);
        done.whenComplete((ignored, error) -> tails.remove(sessionId, done));
        if (previous == null) {
            submission.start();
        } else {
            log.debug("[Exchange] Session {} busy, request queued", sessionId);
            previous.whenComplete((ignored, error) -> submission.start());
        }
        return submission;
    }

    int pendingSessions() {
        return tails.size();
    }

    /**
     * Handle on one dispatched exchange.
     */
    public final class Submission {

        private final ExchangeRequest request;
        private final CompletableFuture<ExchangeResult> result = new CompletableFuture<>();
        // completes when this request no longer holds its session's turn
        private final CompletableFuture<Void> done = new CompletableFuture<>();

        private Future<?> task;
        private boolean running;
        private boolean cancelled;

        private Submission(ExchangeRequest request) {
            this.request = request;
        }

        public CompletableFuture<ExchangeResult> result() {
            return result;
        }

        /**
         * Drops the request if it is still queued, or interrupts its worker if
         * it is running.
         */
        public synchronized void cancel() {
            if (cancelled || done.isDone()) {
                return;
            }
            cancelled = true;
            if (task != null) {
                task.cancel(true);
            }
            if (!running) {
                log.debug("[Exchange] Queued request for session {} cancelled", request.getSessionId());
                result.completeExceptionally(new ExchangeCancelledException(
                        "Exchange cancelled before it started", null));
                done.complete(null);
            }
        }

        private synchronized void start() {
            if (cancelled) {
                return;
            }
            try {
                task = executor.submit(this::run);
            } catch (RejectedExecutionException e) {
                result.completeExceptionally(e);
                done.complete(null);
            }
        }

        private void run() {
            synchronized (this) {
                if (cancelled) {
                    return;
                }
                running = true;
            }
            try {
                result.complete(exchangeService.exchange(request));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            } finally {
                done.complete(null);
            }
        }
    }
}
