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

package me.golemcore.toolloop.domain.model;

/**
 * Machine-readable classification of recoverable tool call failures.
 *
 * <p>
 * This exists to avoid relying on string matching in tool error messages.
 */
public enum ToolFailureKind {

    /**
     * The requested tool is not registered.
     */
    NOT_FOUND,

    /**
     * Raw arguments could not be decoded into a JSON object.
     */
    INVALID_ARGUMENTS,

    /**
     * Decoded arguments were rejected by the tool's argument model.
     */
    VALIDATION_FAILED,

    /**
     * The tool did not finish within the per-call timeout.
     */
    TIMEOUT,

    /**
     * The tool raised a recoverable exception.
     */
    EXECUTION_FAILED
}
