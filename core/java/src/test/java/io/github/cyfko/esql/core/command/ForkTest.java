package io.github.cyfko.esql.core.command;

import io.github.cyfko.esql.core.Esql;
import io.github.cyfko.esql.core.exception.CommandDefinitionException;
import io.github.cyfko.esql.core.exception.QueryStructureException;
import io.github.cyfko.esql.core.expression.Expr;
import io.github.cyfko.esql.core.expression.Functions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.stream.IntStream;

import static io.github.cyfko.esql.core.Esql.assign;
import static org.junit.jupiter.api.Assertions.*;

class ForkTest {

    private static Command[] branches(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> Esql.branch().where("emp_no == " + (10001 + i)))
                .toArray(Command[]::new);
    }

    @Nested
    @DisplayName("Rendering")
    class Rendering {

        @Test
        @DisplayName("Should render each branch as a parenthesized clause on its own line")
        void shouldRenderTwoBranches() {
            // Given
            From from = Esql.from("employees");

            // When
            String query = from.fork(
                    Esql.branch().where("emp_no == 10001"),
                    Esql.branch().where("emp_no == 10002")).render();

            // Then
            assertEquals("FROM employees\n"
                    + "| FORK ( WHERE emp_no == 10001 )\n"
                    + "       ( WHERE emp_no == 10002 )", query);
        }

        @Test
        @DisplayName("Should flatten the stages of a branch onto one line")
        void shouldFlattenBranchStages() {
            String query = Esql.from("employees")
                    .fork(Esql.branch().where(Expr.of("emp_no").eq(10001)).limit(1),
                          Esql.branch().stats(assign("c", Functions.count())).by("languages").limit(5))
                    .keep("emp_no", "c", "_fork")
                    .render();

            assertEquals("FROM employees\n"
                    + "| FORK ( WHERE emp_no == 10001 | LIMIT 1 )\n"
                    + "       ( STATS c = COUNT(*) BY languages | LIMIT 5 )\n"
                    + "| KEEP emp_no, c, _fork", query);
        }

        @Test
        @DisplayName("Should accept up to eight branches")
        void shouldAcceptEightBranches() {
            String query = Esql.from("employees").fork(branches(8)).render();

            assertTrue(query.startsWith("FROM employees\n| FORK ( WHERE emp_no == 10001 )\n"));
            assertTrue(query.endsWith("\n       ( WHERE emp_no == 10008 )"));
            assertEquals(8, query.split("\\(").length - 1);
        }

        @Test
        @DisplayName("Should not render a branch on its own")
        void shouldNotRenderBranchAlone() {
            Command branch = Esql.branch().where("emp_no == 10001");

            assertThrows(QueryStructureException.class, branch::render);
        }
    }

    @Nested
    @DisplayName("Structure")
    class Structure {

        @Test
        @DisplayName("Should fail at the call when the chain is already forked")
        void shouldRejectSecondFork() {
            Command forked = Esql.from("employees").fork(branches(2)).limit(10);

            assertThrows(QueryStructureException.class, () -> forked.fork(branches(2)));
        }

        @Test
        @DisplayName("Should reject less than two or more than eight branches")
        void shouldRejectBranchCount() {
            From from = Esql.from("employees");

            assertThrows(CommandDefinitionException.class, () -> from.fork(branches(1)));
            assertThrows(CommandDefinitionException.class, () -> from.fork(branches(9)));
            assertThrows(CommandDefinitionException.class, () -> from.fork());
            assertFalse(from.isExtended());
        }

        @Test
        @DisplayName("Should reject null branches")
        void shouldRejectNullBranch() {
            assertThrows(CommandDefinitionException.class,
                    () -> Esql.from("employees").fork(Esql.branch().limit(1), null));
        }

        @Test
        @DisplayName("Should reject branches not started with branch()")
        void shouldRejectSourceRootedBranch() {
            assertThrows(QueryStructureException.class,
                    () -> Esql.from("employees").fork(Esql.from("other").limit(1), Esql.branch().limit(1)));
        }

        @Test
        @DisplayName("Should reject empty branches")
        void shouldRejectEmptyBranch() {
            assertThrows(QueryStructureException.class,
                    () -> Esql.from("employees").fork(Esql.branch(), Esql.branch().limit(1)));
        }

        @Test
        @DisplayName("Should reject branches containing a fork")
        void shouldRejectNestedFork() {
            Command nested = Esql.branch().fork(branches(2));

            assertThrows(QueryStructureException.class,
                    () -> Esql.from("employees").fork(nested, Esql.branch().limit(1)));
        }

        @Test
        @DisplayName("Should freeze branch tails once forked")
        void shouldFreezeBranchTails() {
            // Given
            Dissect tail = Esql.branch().dissect("message", "%{a} %{b}");

            // When
            Esql.from("logs").fork(tail, Esql.branch().limit(1));

            // Then
            assertTrue(tail.isExtended());
            assertThrows(QueryStructureException.class, () -> tail.appendSeparator(","));
        }
    }
}
