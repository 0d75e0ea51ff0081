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

package me.golemcore.toolloop.domain.exception;

/**
 * Raised when reference inlining nests deeper than the configured limit. Kept
 * apart from cycle detection failures so callers can tell a deep but acyclic
 * schema from a recursive one.
 */
public class SchemaDepthExceededException extends ToolValidationException {

    private final int maxDepth;

    public SchemaDepthExceededException(int maxDepth, String reference) {
        super("Max recursion depth (" + maxDepth + ") exceeded while resolving schema reference '"
                + reference + "'.");
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
