package org.schemasync.error;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;

import static org.junit.jupiter.api.Assertions.*;

class SchemaSyncExceptionTest {

    @Test
    @DisplayName("wrap keeps type, recoverability and context of the classified cause")
    void wrapKeepsClassification() {
        SchemaSyncException cause = SchemaSyncException.recoverable(ErrorType.CONNECTION, "lost", new ConnectException())
                .withContext("error_code", 2013);

        SchemaSyncException wrapped = SchemaSyncException.wrap(cause, "failed to execute migration statement 2")
                .withContext("statement_index", 2);

        assertEquals(ErrorType.CONNECTION, wrapped.getType());
        assertTrue(wrapped.isRecoverable());
        assertEquals(2013, wrapped.getContext().get("error_code"));
        assertEquals(2, wrapped.getContext().get("statement_index"));
        assertSame(cause, wrapped.getCause());
    }

    @Test
    @DisplayName("User message falls back to the technical message")
    void userMessage() {
        SchemaSyncException e = SchemaSyncException.validation("host is required");
        assertEquals("host is required", e.getUserMessage());
        assertEquals("Check your settings", e.withUserMessage("Check your settings").getUserMessage());
    }

    @Test
    @DisplayName("Context is read-only for callers")
    void contextIsReadOnly() {
        SchemaSyncException e = SchemaSyncException.validation("x").withContext("k", "v");
        assertThrows(UnsupportedOperationException.class, () -> e.getContext().put("other", 1));
    }

    @Test
    @DisplayName("Every recoverable-prone type has troubleshooting hints")
    void troubleshooting() {
        assertFalse(ErrorType.CONNECTION.troubleshooting().isEmpty());
        assertFalse(ErrorType.PERMISSION.troubleshooting().isEmpty());
        assertTrue(ErrorType.UNKNOWN.troubleshooting().isEmpty());
    }
}
