package io.github.cyfko.esql.core.command;

import io.github.cyfko.esql.core.exception.CommandDefinitionException;
import io.github.cyfko.esql.core.exception.QueryStructureException;
import io.github.cyfko.esql.core.utils.ExpressionRenderer;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The {@code FORK} processing command.
 * <p>
 * Each branch is a chain started with {@code Esql.branch()}. When rendered, the stages of a
 * branch are flattened onto one line, joined with {@code " | "} and wrapped in parentheses;
 * branches after the first start on a new line aligned under the first one.
 * </p>
 *
 * <pre>{@code
 * Esql.from("employees")
 *     .fork(Esql.branch().where("emp_no == 10001"),
 *           Esql.branch().where("emp_no == 10002").limit(1));
 * // FROM employees
 * // | FORK ( WHERE emp_no == 10001 )
 * //        ( WHERE emp_no == 10002 | LIMIT 1 )
 * }</pre>
 *
 * <p>A chain holds at most one {@code FORK}, and branches cannot contain one.</p>
 */
public class Fork extends Command {

    public static final int MIN_BRANCHES = 2;
    public static final int MAX_BRANCHES = 8;

    private static final String BRANCH_INDENT = "\n       ";
    private static final Pattern LINE_BREAK = Pattern.compile("\\s*\\n\\s*");

    private final List<Command> branches;

    public Fork(Command parent, Command... branches) {
        this(validate(requireUnforked(parent), branches), parent);
    }

    private Fork(List<Command> branches, Command parent) {
        super(parent);
        this.branches = branches;
        branches.forEach(Command::markExtended);
    }

    private static Command requireUnforked(Command parent) {
        if (parent == null) {
            throw new QueryStructureException("FORK requires a preceding command");
        }
        if (parent.isForked()) {
            throw new QueryStructureException("A query can only have one FORK");
        }
        return parent;
    }

    private static List<Command> validate(Command parent, Command[] branches) {
        if (branches == null || branches.length < MIN_BRANCHES || branches.length > MAX_BRANCHES) {
            throw new CommandDefinitionException("FORK requires between " + MIN_BRANCHES + " and " + MAX_BRANCHES
                    + " branches, got " + (branches == null ? 0 : branches.length));
        }
        for (Command branch : branches) {
            if (branch == null) {
                throw new CommandDefinitionException("FORK branch cannot be null");
            }
            if (branch == parent) {
                throw new QueryStructureException("A command cannot be a branch of its own FORK");
            }
            List<Command> stages = branch.stages();
            if (!(stages.get(0) instanceof Branch)) {
                throw new QueryStructureException("FORK branches must start with Esql.branch(), got a chain starting with "
                        + stages.get(0).getClass().getSimpleName());
            }
            if (stages.size() < 2) {
                throw new QueryStructureException("FORK branch must contain at least one processing command");
            }
            if (branch.isForked()) {
                throw new QueryStructureException("FORK branches cannot contain a FORK");
            }
        }
        return List.of(branches);
    }

    @Override
    protected String renderStage(ExpressionRenderer renderer) {
        return "FORK " + branches.stream()
                .map(branch -> "( " + flatten(branch, renderer) + " )")
                .collect(Collectors.joining(BRANCH_INDENT));
    }

    private static String flatten(Command branch, ExpressionRenderer renderer) {
        List<Command> stages = branch.stages();
        return stages.subList(1, stages.size()).stream()
                .map(stage -> LINE_BREAK.matcher(stage.renderStage(renderer)).replaceAll(" "))
                .collect(Collectors.joining(" | "));
    }
}
