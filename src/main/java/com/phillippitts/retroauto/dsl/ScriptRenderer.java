package com.phillippitts.retroauto.dsl;

import com.phillippitts.retroauto.domain.InterruptRule;
import com.phillippitts.retroauto.domain.Region;
import com.phillippitts.retroauto.domain.Value;
import com.phillippitts.retroauto.dsl.ast.ActionCall;
import com.phillippitts.retroauto.dsl.ast.AssignStatement;
import com.phillippitts.retroauto.dsl.ast.BinaryExpr;
import com.phillippitts.retroauto.dsl.ast.BreakStatement;
import com.phillippitts.retroauto.dsl.ast.ConditionalBranch;
import com.phillippitts.retroauto.dsl.ast.ContinueStatement;
import com.phillippitts.retroauto.dsl.ast.Expression;
import com.phillippitts.retroauto.dsl.ast.Flow;
import com.phillippitts.retroauto.dsl.ast.GotoStatement;
import com.phillippitts.retroauto.dsl.ast.IfStatement;
import com.phillippitts.retroauto.dsl.ast.ImageQuery;
import com.phillippitts.retroauto.dsl.ast.LabelStatement;
import com.phillippitts.retroauto.dsl.ast.Literal;
import com.phillippitts.retroauto.dsl.ast.LoopStatement;
import com.phillippitts.retroauto.dsl.ast.Program;
import com.phillippitts.retroauto.dsl.ast.RunFlowStatement;
import com.phillippitts.retroauto.dsl.ast.Statement;
import com.phillippitts.retroauto.dsl.ast.TupleExpr;
import com.phillippitts.retroauto.dsl.ast.UnaryExpr;
import com.phillippitts.retroauto.dsl.ast.VariableRef;
import com.phillippitts.retroauto.dsl.ast.WhileStatement;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders a {@link Program} back to canonical script source.
 *
 * <p>Output is normalised (two-space indentation, one statement per line, minimal
 * parentheses) and parses back to a structurally equal Program.
 */
public final class ScriptRenderer {

    private static final String INDENT = "  ";
    private static final Pattern IDENTIFIER = Pattern.compile("[\\p{L}_][\\p{L}\\p{Nd}_]*");
    private static final Set<String> RESERVED = Set.of(
            "if", "elif", "else", "end", "loop", "while", "label", "goto", "run", "break",
            "continue", "true", "false", "and", "or", "not");

    private ScriptRenderer() {
    }

    public static String render(Program program) {
        StringBuilder out = new StringBuilder();

        if (!program.config().isEmpty()) {
            out.append('@').append(Parser.CONFIG_SECTION).append('\n');
            for (Map.Entry<String, Value> e : program.config().entrySet()) {
                out.append(INDENT).append(e.getKey()).append(" = ").append(value(e.getValue())).append('\n');
            }
            out.append('\n');
        }

        if (!program.hotkeys().isEmpty()) {
            out.append('@').append(Parser.HOTKEYS_SECTION).append('\n');
            for (Map.Entry<String, String> e : program.hotkeys().entrySet()) {
                out.append(INDENT).append(e.getKey()).append(" = ").append(quote(e.getValue())).append('\n');
            }
            out.append('\n');
        }

        if (!program.interrupts().isEmpty()) {
            out.append('@').append(Parser.INTERRUPTS_SECTION).append('\n');
            for (InterruptRule rule : program.interrupts()) {
                out.append(INDENT).append(rule(rule)).append('\n');
            }
            out.append('\n');
        }

        for (Flow flow : program.flows().values()) {
            out.append('@').append(flow.name()).append(":\n");
            statements(flow.body(), 1, out);
            out.append('\n');
        }
        return out.toString();
    }

    /** Renders a single expression, e.g. for snapshots and log lines. */
    public static String render(Expression expr) {
        return expression(expr, 0);
    }

    private static String rule(InterruptRule rule) {
        StringBuilder sb = new StringBuilder()
                .append(rule.id()).append(": ")
                .append(name(rule.triggerAssetId())).append(" -> ").append(name(rule.targetFlow()))
                .append(" priority=").append(rule.priority())
                .append(" cooldown=").append(duration(rule.cooldown()))
                .append(" threshold=").append(decimal(rule.threshold()));
        Region r = rule.region();
        if (r != null) {
            sb.append(" region=(").append(r.x()).append(", ").append(r.y()).append(", ")
                    .append(r.width()).append(", ").append(r.height()).append(')');
        }
        return sb.toString();
    }

    private static void statements(List<Statement> body, int depth, StringBuilder out) {
        for (Statement stmt : body) {
            statement(stmt, depth, out);
        }
    }

    private static void statement(Statement stmt, int depth, StringBuilder out) {
        String pad = INDENT.repeat(depth);
        if (stmt instanceof ActionCall call) {
            out.append(pad).append(call.kind().keyword()).append('(').append(arguments(call)).append(")\n");
        } else if (stmt instanceof AssignStatement assign) {
            out.append(pad).append('$').append(assign.variable()).append(" = ")
                    .append(expression(assign.value(), 0)).append('\n');
        } else if (stmt instanceof LabelStatement label) {
            out.append(pad).append("label ").append(label.name()).append('\n');
        } else if (stmt instanceof GotoStatement jump) {
            out.append(pad).append("goto ").append(jump.label()).append('\n');
        } else if (stmt instanceof RunFlowStatement run) {
            out.append(pad).append("run ").append(name(run.flowName())).append('\n');
        } else if (stmt instanceof BreakStatement) {
            out.append(pad).append("break\n");
        } else if (stmt instanceof ContinueStatement) {
            out.append(pad).append("continue\n");
        } else if (stmt instanceof IfStatement ifStmt) {
            String keyword = "if ";
            for (ConditionalBranch branch : ifStmt.branches()) {
                out.append(pad).append(keyword).append(expression(branch.condition(), 0)).append(":\n");
                statements(branch.body(), depth + 1, out);
                keyword = "elif ";
            }
            if (!ifStmt.elseBody().isEmpty()) {
                out.append(pad).append("else:\n");
                statements(ifStmt.elseBody(), depth + 1, out);
            }
            out.append(pad).append("end\n");
        } else if (stmt instanceof LoopStatement loop) {
            out.append(pad).append("loop");
            if (loop.count() != null) {
                out.append(' ').append(expression(loop.count(), 0));
            }
            out.append(":\n");
            statements(loop.body(), depth + 1, out);
            out.append(pad).append("end\n");
        } else if (stmt instanceof WhileStatement loop) {
            out.append(pad).append("while ").append(expression(loop.condition(), 0)).append(":\n");
            statements(loop.body(), depth + 1, out);
            out.append(pad).append("end\n");
        } else {
            throw new IllegalArgumentException("Unsupported statement: " + stmt);
        }
    }

    private static String arguments(ActionCall call) {
        String positional = call.args().stream()
                .map(arg -> expression(arg, 0))
                .collect(Collectors.joining(", "));
        String named = call.options().entrySet().stream()
                .map(e -> e.getKey() + "=" + expression(e.getValue(), 0))
                .collect(Collectors.joining(", "));
        if (positional.isEmpty()) {
            return named;
        }
        return named.isEmpty() ? positional : positional + ", " + named;
    }

    private static String expression(Expression expr, int parentPrecedence) {
        if (expr instanceof Literal literal) {
            return value(literal.value());
        }
        if (expr instanceof VariableRef ref) {
            return "$" + ref.name();
        }
        if (expr instanceof TupleExpr tuple) {
            return tuple.items().stream()
                    .map(item -> expression(item, 0))
                    .collect(Collectors.joining(", ", "(", ")"));
        }
        if (expr instanceof UnaryExpr unary) {
            // operands other than atoms need parentheses to keep the unary binding
            return unary.op().symbol() + expression(unary.operand(), Integer.MAX_VALUE);
        }
        if (expr instanceof BinaryExpr binary) {
            int precedence = binary.op().precedence();
            // left associative: an equal-precedence right operand must be parenthesised
            String text = expression(binary.left(), precedence) + " " + binary.op().symbol() + " "
                    + expression(binary.right(), precedence + 1);
            return precedence < parentPrecedence ? "(" + text + ")" : text;
        }
        if (expr instanceof ImageQuery query) {
            StringBuilder sb = new StringBuilder("image(").append(expression(query.asset(), 0));
            query.options().forEach((k, v) -> sb.append(", ").append(k).append('=').append(expression(v, 0)));
            return sb.append(')').toString();
        }
        throw new IllegalArgumentException("Unsupported expression: " + expr);
    }

    /** Source form of a value, e.g. {@code "text"}, {@code 250ms}, {@code (1, 2)}. */
    public static String value(Value value) {
        return switch (value.type()) {
            case INT -> Long.toString(value.asLong());
            case FLOAT -> decimal(value.asDouble());
            case STRING -> quote(value.asText());
            case BOOL -> value.asBoolean() ? "true" : "false";
            case DURATION -> duration(value.asDuration());
            case LIST -> value.asList().stream()
                    .map(ScriptRenderer::value)
                    .collect(Collectors.joining(", ", "(", ")"));
        };
    }

    static String duration(Duration d) {
        long ms = d.toMillis();
        if (ms != 0 && ms % 60_000 == 0) {
            return (ms / 60_000) + "m";
        }
        if (ms != 0 && ms % 1000 == 0) {
            return (ms / 1000) + "s";
        }
        return ms + "ms";
    }

    private static String decimal(double d) {
        String text = BigDecimal.valueOf(d).toPlainString();
        return text.contains(".") ? text : text + ".0";
    }

    private static String name(String text) {
        if (IDENTIFIER.matcher(text).matches() && !RESERVED.contains(text)) {
            return text;
        }
        return quote(text);
    }

    private static String quote(String text) {
        StringBuilder sb = new StringBuilder("\"");
        for (char c : text.toCharArray()) {
            switch (c) {
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
