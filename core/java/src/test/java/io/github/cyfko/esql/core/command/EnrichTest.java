package io.github.cyfko.esql.core.command;

import io.github.cyfko.esql.core.Esql;
import io.github.cyfko.esql.core.exception.CommandDefinitionException;
import io.github.cyfko.esql.core.expression.Expr;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static io.github.cyfko.esql.core.Esql.assign;
import static org.junit.jupiter.api.Assertions.*;

class EnrichTest {

    @Test
    @DisplayName("Should render the policy alone")
    void shouldRenderPolicyOnly() {
        assertEquals("ROW language_code = \"1\"\n| ENRICH languages_policy",
                Esql.row(assign("language_code", "1")).enrich("languages_policy").render());
    }

    @Test
    @DisplayName("Should render the match field and renamed enrich fields")
    void shouldRenderOnAndNamedWith() {
        String query = Esql.row(assign("a", "1"))
                .enrich("languages_policy")
                .on("a")
                .with(assign("name", "language_name"))
                .render();

        assertEquals("ROW a = \"1\"\n| ENRICH languages_policy ON a WITH name = language_name", query);
    }

    @Test
    @DisplayName("Should render positional enrich fields")
    void shouldRenderPositionalWith() {
        String query = Esql.row(assign("a", "1"))
                .enrich("languages_policy")
                .on("a")
                .with("language_name", "language family")
                .render();

        assertEquals("ROW a = \"1\"\n| ENRICH languages_policy ON a WITH language_name, `language family`", query);
    }

    @Test
    @DisplayName("Should render renamed enrich fields from a map")
    void shouldRenderMapWith() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("name", "language_name");
        fields.put("family", "language_family");

        String query = Esql.row(assign("a", "1")).enrich("languages_policy").with(fields).render();

        assertEquals("ROW a = \"1\"\n| ENRICH languages_policy WITH name = language_name, family = language_family", query);
    }

    @Test
    @DisplayName("Should reject mixed, empty or non-name enrich fields")
    void shouldRejectInvalidFields() {
        Enrich enrich = Esql.row(assign("a", "1")).enrich("languages_policy");

        assertThrows(CommandDefinitionException.class, () -> enrich.with("language_name", assign("n", "x")));
        assertThrows(CommandDefinitionException.class, () -> enrich.with());
        assertThrows(CommandDefinitionException.class, () -> enrich.with(Map.of()));
        assertThrows(CommandDefinitionException.class, () -> enrich.with(Expr.of("language_name")));
        assertThrows(CommandDefinitionException.class, () -> enrich.with(assign("n", 1)));
    }

    @Test
    @DisplayName("Should reject an empty policy name")
    void shouldRejectEmptyPolicy() {
        assertThrows(CommandDefinitionException.class, () -> Esql.from("employees").enrich(""));
    }
}
