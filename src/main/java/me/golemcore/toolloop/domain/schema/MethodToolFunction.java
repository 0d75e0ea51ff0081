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

package me.golemcore.toolloop.domain.schema;

import me.golemcore.toolloop.domain.component.ToolFunction;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Map;

/**
 * Invokes a tool method reflectively, mapping named arguments to positions.
 * Exceptions thrown by the method surface unwrapped.
 */
public class MethodToolFunction implements ToolFunction {

    private final Object target;
    private final Method method;
    private final MethodArgumentModel argumentModel;

    public MethodToolFunction(Object target, Method method, MethodArgumentModel argumentModel) {
        this.target = target;
        this.method = method;
        this.argumentModel = argumentModel;
        method.trySetAccessible();
    }

    public Method getMethod() {
        return method;
    }

    @Override
    public Object invoke(Map<String, Object> arguments) throws Exception {
        Object[] values = argumentModel.toInvocationArguments(arguments);
        try {
            return method.invoke(target, values);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    @Override
    public String toString() {
        return method.getDeclaringClass().getSimpleName() + "#" + method.getName();
    }
}
