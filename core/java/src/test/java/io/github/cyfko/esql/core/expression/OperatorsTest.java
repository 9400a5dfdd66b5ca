package io.github.cyfko.esql.core.expression;

import io.github.cyfko.esql.core.exception.CommandDefinitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OperatorsTest {

    @Test
    @DisplayName("Should combine conditions with AND")
    void shouldCombineWithAnd() {
        assertEquals("(emp_no > 10000) AND (still_hired == true) AND (languages < 3)",
                Operators.and("emp_no > 10000", Expr.of("still_hired").eq(true), Expr.of("languages").lt(3)).render());
    }

    @Test
    @DisplayName("Should combine conditions with OR")
    void shouldCombineWithOr() {
        assertEquals("(a == 1) OR (b == 2)", Operators.or("a == 1", "b == 2").render());
    }

    @Test
    @DisplayName("Should negate a condition")
    void shouldNegate() {
        assertEquals("NOT (languages IS NULL)", Operators.not(Expr.of("languages").isNull()).render());
    }

    @Test
    @DisplayName("Should require at least two conditions to combine")
    void shouldRequireTwoConditions() {
        assertThrows(CommandDefinitionException.class, () -> Operators.and("a"));
        assertThrows(CommandDefinitionException.class, () -> Operators.or());
        assertThrows(CommandDefinitionException.class, () -> Operators.not(null));
    }
}
