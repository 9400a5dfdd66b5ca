package io.github.cyfko.esql.core.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CommandDefinitionExceptionTest {

    @Test
    @DisplayName("Should create CommandDefinitionException with message")
    void shouldCreateWithMessage() {
        // Given
        String message = "Invalid query";

        // When
        CommandDefinitionException exception = new CommandDefinitionException(message);

        // Then
        assertEquals(message, exception.getMessage());
        assertNull(exception.getCause());
    }

    @Test
    @DisplayName("Should create CommandDefinitionException with message and cause")
    void shouldCreateWithMessageAndCause() {
        // Given
        String message = "Invalid query";
        Throwable cause = new IllegalStateException("Root cause");

        // When
        CommandDefinitionException exception = new CommandDefinitionException(message, cause);

        // Then
        assertEquals(message, exception.getMessage());
        assertSame(cause, exception.getCause());
    }

    @Test
    @DisplayName("Should be unchecked")
    void shouldBeUnchecked() {
        assertInstanceOf(RuntimeException.class, new CommandDefinitionException("test"));
    }
}
