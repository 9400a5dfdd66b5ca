package io.github.cyfko.esql.core.command;

import io.github.cyfko.esql.core.Esql;
import io.github.cyfko.esql.core.exception.CommandDefinitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChangePointTest {

    @Test
    @DisplayName("Should render the value column alone")
    void shouldRenderValueOnly() {
        assertEquals("FROM k8s\n| CHANGE_POINT value", Esql.from("k8s").changePoint("value").render());
    }

    @Test
    @DisplayName("Should render the key column")
    void shouldRenderKey() {
        assertEquals("FROM k8s\n| CHANGE_POINT value ON key",
                Esql.from("k8s").changePoint("value").on("key").render());
    }

    @Test
    @DisplayName("Should render output column names")
    void shouldRenderOutputNames() {
        String query = Esql.from("k8s")
                .changePoint("value")
                .on("key")
                .as("change_type", "change_pvalue")
                .render();

        assertEquals("FROM k8s\n| CHANGE_POINT value ON key AS change_type, change_pvalue", query);
    }

    @Test
    @DisplayName("Should default the output name that was not given")
    void shouldDefaultMissingOutputName() {
        assertEquals("FROM k8s\n| CHANGE_POINT value AS change_type, pvalue",
                Esql.from("k8s").changePoint("value").as("change_type", null).render());
        assertEquals("FROM k8s\n| CHANGE_POINT value AS type, p",
                Esql.from("k8s").changePoint("value").as(null, "p").render());
    }

    @Test
    @DisplayName("Should omit the AS clause when no output name is given")
    void shouldOmitAsClause() {
        assertEquals("FROM k8s\n| CHANGE_POINT value",
                Esql.from("k8s").changePoint("value").as(null, null).render());
    }

    @Test
    @DisplayName("Should reject an empty value column")
    void shouldRejectEmptyValue() {
        assertThrows(CommandDefinitionException.class, () -> Esql.from("k8s").changePoint(""));
    }
}
