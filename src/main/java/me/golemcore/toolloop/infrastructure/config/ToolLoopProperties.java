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

package me.golemcore.toolloop.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the tool loop, bound from the
 * {@code toolloop.*} prefix.
 *
 * <pre>
 * toolloop.max-iterations=5
 * toolloop.tool-timeout=180s
 * toolloop.schema.max-depth=20
 * toolloop.executor.thread-name-prefix=tool-exec-
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "toolloop")
public class ToolLoopProperties {

    /**
     * Maximum tool-call rounds per turn before the loop returns the last
     * response as-is.
     */
    private int maxIterations = 5;

    /**
     * Per-call execution timeout.
     */
    private Duration toolTimeout = Duration.ofSeconds(180);

    private SchemaProperties schema = new SchemaProperties();
    private ExecutorProperties executor = new ExecutorProperties();

    // ==================== SCHEMA ====================

    @Data
    public static class SchemaProperties {

        /**
         * Maximum nested reference expansions while inlining a schema.
         */
        private int maxDepth = 20;
    }

    // ==================== EXECUTOR ====================

    @Data
    public static class ExecutorProperties {

        private String threadNamePrefix = "tool-exec-";
    }
}
