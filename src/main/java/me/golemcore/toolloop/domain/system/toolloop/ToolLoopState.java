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

/**
 * States of one tool loop turn.
 */
public enum ToolLoopState {

    AWAITING_RESPONSE,

    DISPATCHING,

    RESPONDING,

    /**
     * The last response requested no tool calls.
     */
    DONE,

    /**
     * The iteration limit was reached; the last response may still request
     * tool calls.
     */
    CAPPED_EXIT;

    public boolean isTerminal() {
        return this == DONE || this == CAPPED_EXIT;
    }
}
