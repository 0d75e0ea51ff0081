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
 * Wraps a checked exception thrown by a tool that is outside the recoverable
 * set. Propagates out of the loop and aborts the turn.
 */
public class FatalToolException extends ToolException {

    private final String toolName;

    public FatalToolException(String toolName, Throwable cause) {
        super("Tool '" + toolName + "' failed fatally: " + cause, cause);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
