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

package me.golemcore.toolloop.domain.component;

import java.util.Map;

/**
 * Validates and coerces raw tool arguments before invocation.
 */
@FunctionalInterface
public interface ToolArgumentModel {

    /**
     * @param arguments
     *            normalized arguments as decoded from the model output
     * @return arguments coerced to the types the tool function expects
     * @throws RuntimeException
     *             when the arguments do not satisfy the model
     */
    Map<String, Object> validate(Map<String, Object> arguments);
}
