package com.phillippitts.retroauto.service.engine;

import com.phillippitts.retroauto.domain.ColorMode;
import com.phillippitts.retroauto.domain.MatchRequest;
import com.phillippitts.retroauto.domain.Region;
import com.phillippitts.retroauto.domain.Value;
import com.phillippitts.retroauto.domain.ValueType;
import com.phillippitts.retroauto.dsl.ast.BinaryExpr;
import com.phillippitts.retroauto.dsl.ast.BinaryOperator;
import com.phillippitts.retroauto.dsl.ast.Expression;
import com.phillippitts.retroauto.dsl.ast.ImageQuery;
import com.phillippitts.retroauto.dsl.ast.Literal;
import com.phillippitts.retroauto.dsl.ast.TupleExpr;
import com.phillippitts.retroauto.dsl.ast.UnaryExpr;
import com.phillippitts.retroauto.dsl.ast.VariableRef;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates expressions against the variable store. Image queries go through the vision
 * matcher and update the last match.
 *
 * <p>Type errors, undefined variables and division by zero raise
 * {@link IllegalArgumentException}; the executor turns them into located fatal errors.
 */
final class ExpressionEvaluator {

    private final VariableStore variables;
    private final VisionQueries vision;

    ExpressionEvaluator(VariableStore variables, VisionQueries vision) {
        this.variables = variables;
        this.vision = vision;
    }

    Value evaluate(Expression expr) {
        if (expr instanceof Literal literal) {
            return literal.value();
        }
        if (expr instanceof VariableRef ref) {
            return variables.require(ref.name());
        }
        if (expr instanceof TupleExpr tuple) {
            List<Value> items = new ArrayList<>(tuple.items().size());
            for (Expression item : tuple.items()) {
                items.add(evaluate(item));
            }
            return Value.ofList(items);
        }
        if (expr instanceof UnaryExpr unary) {
            return unary(unary);
        }
        if (expr instanceof BinaryExpr binary) {
            return binary(binary);
        }
        if (expr instanceof ImageQuery query) {
            return Value.ofBool(vision.find(matchRequest(query)).isPresent());
        }
        throw new IllegalArgumentException("Unsupported expression: " + expr);
    }

    boolean isTrue(Expression expr) {
        return evaluate(expr).isTruthy();
    }

    MatchRequest matchRequest(ImageQuery query) {
        String asset = evaluate(query.asset()).asText();
        Region region = null;
        double threshold = MatchRequest.DEFAULT_THRESHOLD;
        if (query.options().containsKey("region")) {
            region = region(evaluate(query.options().get("region")));
        }
        if (query.options().containsKey("threshold")) {
            threshold = evaluate(query.options().get("threshold")).asDouble();
        }
        return new MatchRequest(asset, region, threshold, ColorMode.GRAYSCALE);
    }

    private static Region region(Value value) {
        List<Value> parts = value.asList();
        if (parts.size() != 4) {
            throw new IllegalArgumentException("region must be a tuple (x, y, w, h)");
        }
        return new Region(Math.toIntExact(parts.get(0).asLong()), Math.toIntExact(parts.get(1).asLong()),
                Math.toIntExact(parts.get(2).asLong()), Math.toIntExact(parts.get(3).asLong()));
    }

    private Value unary(UnaryExpr unary) {
        Value operand = evaluate(unary.operand());
        return switch (unary.op()) {
            case NOT -> Value.ofBool(!operand.isTruthy());
            case NEGATE -> switch (operand.type()) {
                case INT -> Value.ofInt(Math.negateExact(operand.asLong()));
                case FLOAT -> Value.ofFloat(-operand.asDouble());
                case DURATION -> Value.ofDuration(operand.asDuration().negated());
                default -> throw new IllegalArgumentException("Cannot negate " + operand);
            };
        };
    }

    private Value binary(BinaryExpr binary) {
        // short-circuit before evaluating the right side
        if (binary.op() == BinaryOperator.AND) {
            return Value.ofBool(isTrue(binary.left()) && isTrue(binary.right()));
        }
        if (binary.op() == BinaryOperator.OR) {
            return Value.ofBool(isTrue(binary.left()) || isTrue(binary.right()));
        }

        Value left = evaluate(binary.left());
        Value right = evaluate(binary.right());
        return switch (binary.op()) {
            case EQ -> Value.ofBool(equal(left, right));
            case NEQ -> Value.ofBool(!equal(left, right));
            case LT -> Value.ofBool(compare(left, right) < 0);
            case LE -> Value.ofBool(compare(left, right) <= 0);
            case GT -> Value.ofBool(compare(left, right) > 0);
            case GE -> Value.ofBool(compare(left, right) >= 0);
            case ADD -> add(left, right);
            case SUB, MUL, DIV, MOD -> arithmetic(binary, left, right);
            default -> throw new IllegalArgumentException("Unsupported operator " + binary.op());
        };
    }

    private static Value add(Value left, Value right) {
        if (left.type() == ValueType.STRING || right.type() == ValueType.STRING) {
            return Value.ofString(left.asText() + right.asText());
        }
        if (left.type() == ValueType.DURATION || right.type() == ValueType.DURATION) {
            return Value.ofDuration(left.asDuration().plus(right.asDuration()));
        }
        if (left.type() == ValueType.INT && right.type() == ValueType.INT) {
            return Value.ofInt(Math.addExact(left.asLong(), right.asLong()));
        }
        return Value.ofFloat(left.asDouble() + right.asDouble());
    }

    private static Value arithmetic(BinaryExpr binary, Value left, Value right) {
        if (binary.op() == BinaryOperator.SUB
                && (left.type() == ValueType.DURATION || right.type() == ValueType.DURATION)) {
            return Value.ofDuration(left.asDuration().minus(right.asDuration()));
        }
        if (left.type() == ValueType.INT && right.type() == ValueType.INT) {
            long a = left.asLong();
            long b = right.asLong();
            return switch (binary.op()) {
                case SUB -> Value.ofInt(Math.subtractExact(a, b));
                case MUL -> Value.ofInt(Math.multiplyExact(a, b));
                case DIV -> Value.ofInt(a / nonZero(b));
                case MOD -> Value.ofInt(a % nonZero(b));
                default -> throw new IllegalArgumentException("Unsupported operator " + binary.op());
            };
        }
        double a = left.asDouble();
        double b = right.asDouble();
        return switch (binary.op()) {
            case SUB -> Value.ofFloat(a - b);
            case MUL -> Value.ofFloat(a * b);
            case DIV -> Value.ofFloat(a / nonZero(b));
            case MOD -> Value.ofFloat(a % nonZero(b));
            default -> throw new IllegalArgumentException("Unsupported operator " + binary.op());
        };
    }

    private static long nonZero(long divisor) {
        if (divisor == 0) {
            throw new IllegalArgumentException("Division by zero");
        }
        return divisor;
    }

    private static double nonZero(double divisor) {
        if (divisor == 0.0) {
            throw new IllegalArgumentException("Division by zero");
        }
        return divisor;
    }

    static boolean equal(Value left, Value right) {
        if (left.isNumeric() && right.isNumeric()) {
            return left.type() == ValueType.INT && right.type() == ValueType.INT
                    ? left.asLong() == right.asLong()
                    : Double.compare(left.asDouble(), right.asDouble()) == 0;
        }
        return left.equals(right);
    }

    static int compare(Value left, Value right) {
        if (left.isNumeric() && right.isNumeric()) {
            return left.type() == ValueType.INT && right.type() == ValueType.INT
                    ? Long.compare(left.asLong(), right.asLong())
                    : Double.compare(left.asDouble(), right.asDouble());
        }
        if (left.type() == ValueType.DURATION || right.type() == ValueType.DURATION) {
            return left.asDuration().compareTo(right.asDuration());
        }
        if (left.type() == ValueType.STRING && right.type() == ValueType.STRING) {
            return left.asText().compareTo(right.asText());
        }
        throw new IllegalArgumentException("Cannot compare " + left + " with " + right);
    }
}
