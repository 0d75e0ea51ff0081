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

import me.golemcore.toolloop.domain.exception.ToolExecutionException;

import java.io.FileNotFoundException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Decides which tool exceptions are reported back to the model and which
 * abort the turn.
 *
 * <p>
 * The recoverable set is closed: tool execution failures, missing, existing,
 * forbidden or malformed paths, and value/type errors. Everything else is
 * fatal.
 */
public final class ToolFailureClassifier {

    private static final List<Class<? extends Throwable>> RECOVERABLE = List.of(
            ToolExecutionException.class,
            FileNotFoundException.class,
            NoSuchFileException.class,
            FileAlreadyExistsException.class,
            AccessDeniedException.class,
            NotDirectoryException.class,
            DirectoryNotEmptyException.class,
            InvalidPathException.class,
            SecurityException.class,
            IllegalArgumentException.class,
            ClassCastException.class);

    private ToolFailureClassifier() {
    }

    public static boolean isRecoverable(Throwable error) {
        if (error == null) {
            return false;
        }
        for (Class<? extends Throwable> type : RECOVERABLE) {
            if (type.isInstance(error)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException}
     * wrappers.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public static String safeMessage(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }
}
