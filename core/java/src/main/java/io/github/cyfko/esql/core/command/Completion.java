package io.github.cyfko.esql.core.command;

import io.github.cyfko.esql.core.exception.CommandDefinitionException;
import io.github.cyfko.esql.core.exception.QueryStructureException;
import io.github.cyfko.esql.core.model.Assignment;
import io.github.cyfko.esql.core.model.CommandArguments;
import io.github.cyfko.esql.core.utils.ExpressionRenderer;
import io.github.cyfko.esql.core.utils.IdentifierFormatter;

/**
 * The {@code COMPLETION} processing command: sends a prompt to an inference endpoint.
 * <p>
 * The inference endpoint is mandatory and supplied through {@link #with(String)}; its absence is
 * reported by {@link #render()}.
 * </p>
 *
 * <pre>{@code
 * Esql.row(assign("question", "What is Elasticsearch?"))
 *     .completion(assign("answer", "question")).with("test_completion_model");
 * // ROW question = "What is Elasticsearch?"
 * // | COMPLETION answer = question WITH {"inference_id": "test_completion_model"}
 * }</pre>
 */
public class Completion extends Command {

    private final CommandArguments prompt;
    private String inferenceId;

    public Completion(Command parent, Object... prompt) {
        this(requireSinglePrompt(CommandArguments.of("COMPLETION", prompt)), parent);
    }

    private Completion(CommandArguments prompt, Command parent) {
        super(parent);
        this.prompt = prompt;
    }

    private static CommandArguments requireSinglePrompt(CommandArguments prompt) {
        if (prompt.size() != 1) {
            throw new CommandDefinitionException(
                    "COMPLETION requires exactly one positional or one named prompt, got " + prompt.size());
        }
        return prompt;
    }

    /**
     * Sets the inference endpoint that answers the prompt.
     *
     * @param inferenceId the inference endpoint id
     * @return this command
     */
    public Completion with(String inferenceId) {
        ensureTail("with(...)");
        this.inferenceId = IdentifierFormatter.requireIdentifier("COMPLETION inference id", inferenceId);
        return this;
    }

    @Override
    protected String renderStage(ExpressionRenderer renderer) {
        if (inferenceId == null) {
            throw new QueryStructureException("COMPLETION requires an inference id: call with(...) before rendering");
        }
        String with = " WITH {" + renderer.quote("inference_id") + ": " + renderer.quote(inferenceId) + "}";
        if (prompt instanceof CommandArguments.Named) {
            Assignment named = ((CommandArguments.Named) prompt).assignments().get(0);
            return "COMPLETION " + IdentifierFormatter.format(named.name()) + " = " + renderer.formatExpr(named.value()) + with;
        }
        Object positional = ((CommandArguments.Positional) prompt).values().get(0);
        return "COMPLETION " + renderer.formatExpr(positional) + with;
    }
}
