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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolloop.domain.component.ToolFunction;
import me.golemcore.toolloop.domain.exception.FatalToolException;
import me.golemcore.toolloop.domain.exception.ToolExecutionException;
import me.golemcore.toolloop.domain.model.ToolCallRequest;
import me.golemcore.toolloop.domain.model.ToolCallResult;
import me.golemcore.toolloop.domain.model.ToolDefinition;
import me.golemcore.toolloop.domain.model.ToolFailureKind;
import me.golemcore.toolloop.domain.registry.ToolRegistry;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes a single tool call: lookup, argument normalization, validation,
 * bounded invocation and failure classification.
 *
 * <p>
 * The returned future completes with a {@link ToolCallResult} for every
 * recoverable outcome and completes exceptionally only for fatal tool errors.
 */
@Slf4j
public class ToolCallExecutor {

    private final ToolRegistry<?> registry;
    private final ToolArgumentNormalizer normalizer;
    private final ArgumentErrorFormatter argumentErrorFormatter;
    private final ExecutorService executor;
    private final Duration timeout;

    public ToolCallExecutor(ToolRegistry<?> registry, ToolArgumentNormalizer normalizer,
            ArgumentErrorFormatter argumentErrorFormatter, ExecutorService executor, Duration timeout) {
        this.registry = registry;
        this.normalizer = normalizer;
        this.argumentErrorFormatter = argumentErrorFormatter;
        this.executor = executor;
        this.timeout = timeout;
    }

    public CompletableFuture<ToolCallResult> execute(ToolCallRequest request) {
        ToolDefinition definition = registry.getTool(request.name());
        if (definition == null) {
            log.warn("[Tools] Unknown tool requested: {}", request.name());
            return CompletableFuture.completedFuture(ToolCallResult.failure(request, ToolFailureKind.NOT_FOUND,
                    "Tool '" + request.name() + "' not found in registry."));
        }

        Map<String, Object> arguments;
        try {
            arguments = normalizer.normalize(request.arguments());
        } catch (ToolExecutionException e) {
            log.debug("[Tools] Could not decode arguments for '{}': {}", request.name(), e.getMessage());
            return CompletableFuture.completedFuture(ToolCallResult.failure(request,
                    ToolFailureKind.INVALID_ARGUMENTS, argumentErrorFormatter.format(request.name(), e)));
        }

        if (definition.getArgumentModel() != null) {
            try {
                arguments = definition.getArgumentModel().validate(arguments);
            } catch (RuntimeException e) {
                log.debug("[Tools] Argument validation failed for '{}': {}", request.name(), e.getMessage());
                return CompletableFuture.completedFuture(ToolCallResult.failure(request,
                        ToolFailureKind.VALIDATION_FAILED,
                        "Argument validation failed: " + ToolFailureClassifier.safeMessage(e)));
            }
        }

        log.debug("[Tools] Executing '{}' (id={}, async={})", request.name(), request.callId(),
                definition.isAsync());
        return invoke(request, definition.getFunction(), arguments);
    }

    /**
     * Runs the function on the executor and bounds the whole call, including
     * an asynchronous tool's returned stage, by the timeout. The worker task is
     * interrupted when the call times out or the returned future is cancelled.
     */
    private CompletableFuture<ToolCallResult> invoke(ToolCallRequest request, ToolFunction function,
            Map<String, Object> arguments) {
        CompletableFuture<Object> pending = new CompletableFuture<>();
        Future<?> task = executor.submit(() -> {
            try {
                pending.complete(function.invoke(arguments));
            } catch (Throwable e) {
                pending.completeExceptionally(e);
            }
        });

        CompletableFuture<Object> bounded = pending.thenCompose(ToolCallExecutor::awaitStage)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        CompletableFuture<ToolCallResult> outcome = bounded
                .handle((value, error) -> toResult(request, value, error));
        outcome.whenComplete((value, error) -> {
            boolean timedOut = value != null && value.failureKind() == ToolFailureKind.TIMEOUT;
            if (!task.isDone() && (timedOut || error instanceof CancellationException)) {
                log.debug("[Tools] Interrupting '{}' (id={})", request.name(), request.callId());
                task.cancel(true);
            }
        });
        return outcome;
    }

    @SuppressWarnings("unchecked")
    private static CompletionStage<Object> awaitStage(Object value) {
        if (value instanceof CompletionStage<?> stage) {
            return (CompletionStage<Object>) stage;
        }
        return CompletableFuture.completedFuture(value);
    }

    private ToolCallResult toResult(ToolCallRequest request, Object value, Throwable error) {
        if (error == null) {
            return ToolCallResult.success(request, value);
        }
        Throwable cause = ToolFailureClassifier.unwrap(error);
        if (cause instanceof TimeoutException) {
            log.warn("[Tools] Tool '{}' timed out after {}", request.name(), timeout);
            return ToolCallResult.failure(request, ToolFailureKind.TIMEOUT,
                    "Tool execution timed out after " + formatSeconds(timeout) + " seconds.");
        }
        if (ToolFailureClassifier.isRecoverable(cause)) {
            log.warn("[Tools] Tool '{}' failed: {}", request.name(), ToolFailureClassifier.safeMessage(cause));
            return ToolCallResult.failure(request, ToolFailureKind.EXECUTION_FAILED,
                    ToolFailureClassifier.safeMessage(cause));
        }

        log.error("[Tools] Tool '{}' failed fatally", request.name(), cause);
        if (cause instanceof RuntimeException runtime) {
            throw runtime;
        }
        if (cause instanceof Error fatal) {
            throw fatal;
        }
        throw new FatalToolException(request.name(), cause);
    }

    private static String formatSeconds(Duration duration) {
        long millis = duration.toMillis();
        if (millis % 1000 == 0) {
            return Long.toString(millis / 1000);
        }
        return Double.toString(millis / 1000.0);
    }
}
