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

package me.golemcore.toolloop.domain.system.toolloop;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import me.golemcore.toolloop.domain.model.ToolCallRequest;
import me.golemcore.toolloop.domain.model.ToolCallResult;
import me.golemcore.toolloop.domain.registry.ToolRegistry;
import me.golemcore.toolloop.port.outbound.ToolAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Provider-agnostic tool loop.
 *
 * <p>
 * Each iteration asks the adapter for tool calls, records the response that
 * requested them, runs all calls concurrently with a per-call timeout and
 * sends the results back. The loop ends when a response carries no calls
 * ({@link ToolLoopState#DONE}) or after {@code maxIterations} rounds
 * ({@link ToolLoopState#CAPPED_EXIT}), in which case the last response is
 * returned as-is.
 *
 * <p>
 * Recoverable tool failures become {@code {"error": ...}} results. A fatal
 * failure in any call aborts the iteration, interrupts the calls still
 * running and propagates to the caller.
 */
public class ToolExecutionLoop implements ToolLoopSystem {

    private static final Logger log = LoggerFactory.getLogger(ToolExecutionLoop.class);

    public static final int DEFAULT_MAX_ITERATIONS = 5;
    public static final Duration DEFAULT_TOOL_TIMEOUT = Duration.ofSeconds(180);

    private final int maxIterations;
    private final Duration toolTimeout;
    private final ToolCallExecutor callExecutor;

    @Builder
    public ToolExecutionLoop(ToolRegistry<?> registry, Integer maxIterations, Duration toolTimeout,
            ArgumentErrorFormatter argumentErrorFormatter, ObjectMapper objectMapper, ExecutorService executor) {
        if (registry == null) {
            throw new IllegalArgumentException("registry is required");
        }
        this.maxIterations = maxIterations != null ? maxIterations : DEFAULT_MAX_ITERATIONS;
        if (this.maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1: " + this.maxIterations);
        }
        this.toolTimeout = toolTimeout != null ? toolTimeout : DEFAULT_TOOL_TIMEOUT;
        if (this.toolTimeout.isNegative() || this.toolTimeout.isZero()) {
            throw new IllegalArgumentException("toolTimeout must be positive: " + this.toolTimeout);
        }
        this.callExecutor = new ToolCallExecutor(
                registry,
                new ToolArgumentNormalizer(objectMapper != null ? objectMapper : new ObjectMapper()),
                argumentErrorFormatter != null ? argumentErrorFormatter : ArgumentErrorFormatter.DEFAULT,
                executor != null ? executor : SharedExecutorHolder.EXECUTOR,
                this.toolTimeout);
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public Duration getToolTimeout() {
        return toolTimeout;
    }

    @Override
    public <R, M> ToolLoopTurnResult<R> run(R initialResponse, ToolAdapter<R, M> adapter) {
        R response = initialResponse;
        int iterations = 0;
        int toolExecutions = 0;
        ToolLoopState state = ToolLoopState.AWAITING_RESPONSE;

        while (iterations < maxIterations) {
            // 1) Does the model want tools?
            List<ToolCallRequest> calls = adapter.extractCalls(response);
            if (calls == null || calls.isEmpty()) {
                adapter.recordAssistantMessage(response);
                log.debug("[ToolLoop] Done after {} iteration(s), {} tool execution(s)", iterations,
                        toolExecutions);
                return new ToolLoopTurnResult<>(response, transition(state, ToolLoopState.DONE), iterations,
                        toolExecutions);
            }

            // 2) Record the tool-call intent before any result goes out
            adapter.recordAssistantMessage(response);
            iterations++;

            state = transition(state, ToolLoopState.DISPATCHING);
            log.debug("[ToolLoop] Iteration {}: dispatching {} call(s)", iterations, calls.size());
            List<ToolCallResult> results = dispatch(calls);
            toolExecutions += results.size();

            state = transition(state, ToolLoopState.RESPONDING);
            List<M> messages = new ArrayList<>(results.size());
            for (ToolCallResult result : results) {
                messages.add(adapter.buildResultMessage(result));
            }
            response = await(adapter.sendResults(messages));
            state = transition(state, ToolLoopState.AWAITING_RESPONSE);
        }

        log.info("[ToolLoop] Reached max iterations ({}), returning last response", maxIterations);
        return new ToolLoopTurnResult<>(response, transition(state, ToolLoopState.CAPPED_EXIT), iterations,
                toolExecutions);
    }

    private static ToolLoopState transition(ToolLoopState from, ToolLoopState to) {
        log.trace("[ToolLoop] {} -> {}", from, to);
        return to;
    }

    /**
     * Runs all calls concurrently. Results keep request order and carry the
     * originating call id. Fails as soon as any call fails fatally.
     */
    private List<ToolCallResult> dispatch(List<ToolCallRequest> calls) {
        List<CompletableFuture<ToolCallResult>> futures = new ArrayList<>(calls.size());
        CompletableFuture<Void> firstFatal = new CompletableFuture<>();
        for (ToolCallRequest call : calls) {
            CompletableFuture<ToolCallResult> future;
            try {
                future = callExecutor.execute(call);
            } catch (RuntimeException | Error e) {
                future = CompletableFuture.failedFuture(e);
            }
            future.whenComplete((result, error) -> {
                if (error != null) {
                    firstFatal.completeExceptionally(error);
                }
            });
            futures.add(future);
        }

        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]));
        try {
            await(CompletableFuture.anyOf(all, firstFatal));
        } catch (RuntimeException | Error e) {
            cancelPending(futures);
            throw e;
        }

        List<ToolCallResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<ToolCallResult> future : futures) {
            results.add(future.join());
        }
        return results;
    }

    private static void cancelPending(List<CompletableFuture<ToolCallResult>> futures) {
        int cancelled = 0;
        for (CompletableFuture<ToolCallResult> future : futures) {
            if (future.cancel(true)) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.debug("[ToolLoop] Cancelled {} pending call(s) after fatal failure", cancelled);
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> T await(CompletableFuture<?> future) {
        try {
            return (T) future.join();
        } catch (CompletionException e) {
            Throwable cause = ToolFailureClassifier.unwrap(e);
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    private static final class SharedExecutorHolder {

        private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

        static final ExecutorService EXECUTOR = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "tool-exec-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
