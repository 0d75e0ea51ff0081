package me.golemcore.toolloop.domain.system.toolloop;

import me.golemcore.toolloop.domain.exception.ToolExecutionException;
import org.junit.jupiter.api.Test;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolFailureClassifierTest {

    @Test
    void shouldTreatKnownFailuresAsRecoverable() {
        assertTrue(ToolFailureClassifier.isRecoverable(new ToolExecutionException("boom")));
        assertTrue(ToolFailureClassifier.isRecoverable(new FileNotFoundException("a.txt")));
        assertTrue(ToolFailureClassifier.isRecoverable(new NoSuchFileException("a.txt")));
        assertTrue(ToolFailureClassifier.isRecoverable(new AccessDeniedException("/root")));
        assertTrue(ToolFailureClassifier.isRecoverable(new InvalidPathException("\0", "nul")));
        assertTrue(ToolFailureClassifier.isRecoverable(new NumberFormatException("x")));
        assertTrue(ToolFailureClassifier.isRecoverable(new ClassCastException("x")));
        assertTrue(ToolFailureClassifier.isRecoverable(new SecurityException("x")));
    }

    @Test
    void shouldTreatEverythingElseAsFatal() {
        assertFalse(ToolFailureClassifier.isRecoverable(new IllegalStateException("x")));
        assertFalse(ToolFailureClassifier.isRecoverable(new IOException("x")));
        assertFalse(ToolFailureClassifier.isRecoverable(new NullPointerException()));
        assertFalse(ToolFailureClassifier.isRecoverable(new OutOfMemoryError()));
        assertFalse(ToolFailureClassifier.isRecoverable(null));
    }

    @Test
    void shouldUnwrapFutureWrappers() {
        IllegalStateException root = new IllegalStateException("root");

        assertSame(root, ToolFailureClassifier.unwrap(new CompletionException(new ExecutionException(root))));
        assertSame(root, ToolFailureClassifier.unwrap(root));
    }

    @Test
    void shouldFallBackToClassNameForBlankMessage() {
        assertEquals("NullPointerException", ToolFailureClassifier.safeMessage(new NullPointerException()));
        assertEquals("boom", ToolFailureClassifier.safeMessage(new ToolExecutionException("boom")));
    }
}
