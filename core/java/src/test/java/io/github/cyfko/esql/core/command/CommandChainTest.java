package io.github.cyfko.esql.core.command;

import io.github.cyfko.esql.core.Esql;
import io.github.cyfko.esql.core.config.RenderPolicy;
import io.github.cyfko.esql.core.exception.CommandDefinitionException;
import io.github.cyfko.esql.core.exception.QueryStructureException;
import io.github.cyfko.esql.core.spi.QueryExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import static io.github.cyfko.esql.core.Esql.assign;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for chain composition: ordering, freezing of extended commands, shared prefixes and
 * execution through a {@link QueryExecutor}.
 */
class CommandChainTest {

    @Mock
    private QueryExecutor<String> executor;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Nested
    @DisplayName("Rendering")
    class Rendering {

        @Test
        @DisplayName("Should render stages in construction order")
        void shouldRenderInOrder() {
            String query = Esql.from("employees")
                    .keep("first_name", "last_name")
                    .sort("first_name ASC")
                    .render();

            assertEquals("FROM employees\n| KEEP first_name, last_name\n| SORT first_name ASC", query);
        }

        @Test
        @DisplayName("Should render the same text on every call")
        void shouldRenderIdempotently() {
            Command query = Esql.from("employees").where("emp_no > 10000").limit(3);

            assertEquals(query.render(), query.render());
            assertEquals(query.render(), query.toString());
        }

        @Test
        @DisplayName("Should describe chains that cannot be rendered instead of throwing")
        void shouldDescribeUnrenderableChains() {
            // Given
            LookupJoin join = Esql.from("system_metrics").lookupJoin("host_inventory");
            Command branch = Esql.branch().where("a == 1").limit(1);

            // When
            String joinText = assertDoesNotThrow(() -> join.toString());
            String branchText = assertDoesNotThrow(() -> branch.toString());

            // Then
            assertTrue(joinText.startsWith("Command[From | LookupJoin] (not renderable: "));
            assertTrue(joinText.contains("host_inventory"));
            assertEquals("Command[Where | Limit] (not renderable: FORK branch)", branchText);
        }

        @Test
        @DisplayName("Should apply the render policy to literals")
        void shouldApplyRenderPolicy() {
            Row row = Esql.row(assign("name", "José"));

            assertEquals("ROW name = \"Jos\\u00E9\"", row.render());
            assertEquals("ROW name = \"José\"", row.render(RenderPolicy.unicode()));
        }

        @Test
        @DisplayName("Should link each command to its parent")
        void shouldLinkParents() {
            From from = Esql.from("employees");
            Limit limit = from.limit(1);

            assertSame(from, limit.parent().orElseThrow());
        }
    }

    @Nested
    @DisplayName("Freezing")
    class Freezing {

        @Test
        @DisplayName("Should mark a command as extended once a child is derived")
        void shouldMarkExtended() {
            From from = Esql.from("employees");
            assertFalse(from.isExtended());

            from.limit(1);

            assertTrue(from.isExtended());
        }

        @Test
        @DisplayName("Should reject continuations on extended commands")
        void shouldRejectContinuationOnExtendedCommand() {
            // Given
            From from = Esql.from("employees");
            Stats stats = from.stats("COUNT(*)");
            stats.limit(1);

            // Then
            QueryStructureException exception = assertThrows(QueryStructureException.class, () -> stats.by("languages"));
            assertTrue(exception.getMessage().contains("by(...)"));
            assertThrows(QueryStructureException.class, () -> from.metadata("_id"));
        }

        @Test
        @DisplayName("Should not extend a command when the child fails validation")
        void shouldNotExtendOnFailedChild() {
            From from = Esql.from("employees");

            assertThrows(CommandDefinitionException.class, () -> from.limit(-1));

            assertFalse(from.isExtended());
            assertEquals("FROM employees METADATA _id", from.metadata("_id").render());
        }
    }

    @Nested
    @DisplayName("Templates")
    class Templates {

        @Test
        @DisplayName("Should derive independent chains from a shared prefix")
        void shouldShareFrozenPrefix() {
            // Given
            Command base = Esql.from("employees").where("still_hired == true");

            // When
            Command first = base.limit(1);
            Command second = base.sort("emp_no").limit(2);

            // Then
            assertEquals("FROM employees\n| WHERE still_hired == true\n| LIMIT 1", first.render());
            assertEquals("FROM employees\n| WHERE still_hired == true\n| SORT emp_no\n| LIMIT 2", second.render());
            assertEquals("FROM employees\n| WHERE still_hired == true", base.render());
        }
    }

    @Nested
    @DisplayName("Execution")
    class Execution {

        @Test
        @DisplayName("Should hand the rendered query to the executor")
        void shouldExecuteRenderedQuery() {
            // Given
            when(executor.execute(anyString())).thenReturn("response");

            // When
            String response = Esql.from("employees").limit(1).executeWith(executor);

            // Then
            assertEquals("response", response);
            verify(executor).execute("FROM employees\n| LIMIT 1");
        }

        @Test
        @DisplayName("Should not call the executor when the query cannot be rendered")
        void shouldNotExecuteInvalidQuery() {
            LookupJoin join = Esql.from("system_metrics").lookupJoin("host_inventory");

            assertThrows(QueryStructureException.class, () -> join.executeWith(executor));
            verifyNoInteractions(executor);
        }

        @Test
        @DisplayName("Should reject a null executor")
        void shouldRejectNullExecutor() {
            assertThrows(NullPointerException.class, () -> Esql.from("employees").executeWith(null));
        }
    }
}
