package io.github.cyfko.esql.core.model;

import io.github.cyfko.esql.core.exception.CommandDefinitionException;
import io.github.cyfko.esql.core.expression.Expr;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CommandArgumentsTest {

    @Nested
    @DisplayName("Classification")
    class Classification {

        @Test
        @DisplayName("Should classify plain values as positional")
        void shouldClassifyPositional() {
            // When
            CommandArguments arguments = CommandArguments.of("STATS", Expr.of("MIN(i)"), "MAX(i)");

            // Then
            CommandArguments.Positional positional = assertInstanceOf(CommandArguments.Positional.class, arguments);
            assertEquals(List.of(Expr.of("MIN(i)"), "MAX(i)"), positional.values());
            assertEquals(2, arguments.size());
        }

        @Test
        @DisplayName("Should classify assignments as named")
        void shouldClassifyNamed() {
            // When
            CommandArguments arguments = CommandArguments.of("EVAL",
                    Assignment.of("a", 1), Assignment.of("b", "x"));

            // Then
            CommandArguments.Named named = assertInstanceOf(CommandArguments.Named.class, arguments);
            assertEquals("a", named.assignments().get(0).name());
            assertEquals("x", named.assignments().get(1).value());
        }

        @Test
        @DisplayName("Should reject positional and named arguments together")
        void shouldRejectMixedArguments() {
            CommandDefinitionException exception = assertThrows(CommandDefinitionException.class,
                    () -> CommandArguments.of("STATS", "MIN(i)", Assignment.of("count", "COUNT(*)")));

            assertEquals("STATS supports positional or named arguments but not both", exception.getMessage());
        }

        @Test
        @DisplayName("Should treat no argument as empty positional arguments")
        void shouldHandleNoArguments() {
            CommandArguments arguments = CommandArguments.of("STATS");

            assertInstanceOf(CommandArguments.Positional.class, arguments);
            assertTrue(arguments.isEmpty());
        }

        @Test
        @DisplayName("Should reject null positional values")
        void shouldRejectNullPositionalValues() {
            CommandDefinitionException exception = assertThrows(CommandDefinitionException.class,
                    () -> CommandArguments.of("EVAL", "a + 1", null));

            assertTrue(exception.getMessage().startsWith("EVAL argument at position 1 is null"));
        }
    }

    @Test
    @DisplayName("Should build named arguments from a map in iteration order")
    void shouldBuildNamedArgumentsFromMap() {
        // Given
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("z", 1);
        columns.put("a", 2);

        // When
        CommandArguments.Named named = (CommandArguments.Named) CommandArguments.of(columns);

        // Then
        assertEquals(List.of(Assignment.of("z", 1), Assignment.of("a", 2)), named.assignments());
    }

    @Test
    @DisplayName("Should expose unmodifiable argument lists")
    void shouldExposeUnmodifiableLists() {
        CommandArguments.Positional positional = (CommandArguments.Positional) CommandArguments.of("EVAL", "a");

        assertThrows(UnsupportedOperationException.class, () -> positional.values().add("b"));
    }

    @Nested
    @DisplayName("Assignment")
    class AssignmentTests {

        @Test
        @DisplayName("Should accept null values")
        void shouldAcceptNullValues() {
            Assignment assignment = Assignment.of("c", null);

            assertEquals("c", assignment.name());
            assertNull(assignment.value());
        }

        @Test
        @DisplayName("Should reject null or empty names")
        void shouldRejectInvalidNames() {
            assertThrows(CommandDefinitionException.class, () -> Assignment.of(null, 1));
            assertThrows(CommandDefinitionException.class, () -> Assignment.of("", 1));
        }
    }
}
