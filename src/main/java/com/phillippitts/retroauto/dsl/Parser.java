package com.phillippitts.retroauto.dsl;

import com.phillippitts.retroauto.domain.ActionKind;
import com.phillippitts.retroauto.domain.ErrorPolicy;
import com.phillippitts.retroauto.domain.InterruptRule;
import com.phillippitts.retroauto.domain.MatchRequest;
import com.phillippitts.retroauto.domain.Region;
import com.phillippitts.retroauto.domain.Value;
import com.phillippitts.retroauto.domain.ValueType;
import com.phillippitts.retroauto.dsl.ast.ActionCall;
import com.phillippitts.retroauto.dsl.ast.AssignStatement;
import com.phillippitts.retroauto.dsl.ast.BinaryExpr;
import com.phillippitts.retroauto.dsl.ast.BinaryOperator;
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
import com.phillippitts.retroauto.dsl.ast.UnaryOperator;
import com.phillippitts.retroauto.dsl.ast.VariableRef;
import com.phillippitts.retroauto.dsl.ast.WhileStatement;
import com.phillippitts.retroauto.exception.ParseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recursive-descent parser producing an immutable {@link Program}.
 *
 * <p>Besides syntax, the parser validates everything that can be known statically: action
 * arity and option names, label and flow references, duplicate names and the placement of
 * {@code break}/{@code continue}. The first problem aborts with a {@link ParseException}.
 */
public class Parser {

    public static final String CONFIG_SECTION = "config";
    public static final String HOTKEYS_SECTION = "hotkeys";
    public static final String INTERRUPTS_SECTION = "interrupts";

    /** Keys accepted inside {@code @config}. */
    public static final Set<String> CONFIG_KEYS = Set.of(
            "entry", "on_error", "max_depth", "wait_timeout", "poll_interval",
            "tick_interval", "tolerate_missing_assets");

    public static final Set<String> HOTKEY_KEYS = Set.of("start", "stop", "pause");

    static final Duration MIN_POLL_INTERVAL = Duration.ofMillis(10);
    static final Duration MIN_TICK_INTERVAL = Duration.ofMillis(50);

    private static final Set<String> RULE_OPTIONS = Set.of("priority", "cooldown", "threshold", "region");

    private final List<Token> tokens;
    private int current = 0;

    private final Map<String, Flow> flows = new LinkedHashMap<>();
    private final Map<String, Value> config = new LinkedHashMap<>();
    private final Map<String, String> hotkeys = new LinkedHashMap<>();
    private final List<InterruptRule> interrupts = new ArrayList<>();

    // references checked once every flow is known
    private final List<Reference> flowReferences = new ArrayList<>();

    // per-flow state
    private final Map<String, Token> labels = new HashMap<>();
    private final List<Token> gotos = new ArrayList<>();
    private int loopDepth = 0;

    private record Reference(String flowName, Token at) {
    }

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /** Lexes and parses {@code source} in one call. */
    public static Program parseSource(String source) {
        return new Parser(new Lexer(source).tokenize()).parse();
    }

    public Program parse() {
        skipNewlines();
        while (!isAtEnd()) {
            Token section = consume(TokenType.SECTION, "Expected a section such as @config or @main:");
            switch (section.lexeme()) {
                case CONFIG_SECTION -> parseConfig(section);
                case HOTKEYS_SECTION -> parseHotkeys(section);
                case INTERRUPTS_SECTION -> parseInterrupts(section);
                default -> parseFlow(section);
            }
            skipNewlines();
        }

        if (flows.isEmpty()) {
            throw error(peek(), "Script defines no flows");
        }
        for (Reference ref : flowReferences) {
            if (!flows.containsKey(ref.flowName())) {
                throw error(ref.at(), "Unknown flow '" + ref.flowName() + "'");
            }
        }
        String entry = config.containsKey("entry") ? config.get("entry").asText() : Program.DEFAULT_ENTRY;
        if (!flows.containsKey(entry)) {
            throw new ParseException("Entry flow '" + entry + "' is not defined", 1, 1);
        }
        return new Program(flows, entry, config, hotkeys, interrupts);
    }

    // ================= sections =================

    private void parseConfig(Token section) {
        optionalColon();
        consumeLineEnd();
        while (check(TokenType.IDENTIFIER)) {
            Token key = advance();
            if (!CONFIG_KEYS.contains(key.lexeme())) {
                throw error(key, "Unknown config key '" + key.lexeme() + "'");
            }
            if (config.containsKey(key.lexeme())) {
                throw error(key, "Duplicate config key '" + key.lexeme() + "'");
            }
            consume(TokenType.ASSIGN, "Expected '=' after config key");
            Token valueToken = peek();
            Value value = constant(expression(), valueToken);
            validateConfig(key, value, valueToken);
            config.put(key.lexeme(), value);
            consumeLineEnd();
        }
    }

    private void validateConfig(Token key, Value value, Token at) {
        switch (key.lexeme()) {
            case "entry" -> requireType(value, ValueType.STRING, at, "entry must be a flow name");
            case "on_error" -> {
                requireType(value, ValueType.STRING, at, "on_error must be pause, skip or abort");
                policy(value.asText(), at);
            }
            case "max_depth" -> {
                requireType(value, ValueType.INT, at, "max_depth must be an integer");
                if (value.asLong() < 1 || value.asLong() > Integer.MAX_VALUE) {
                    throw error(at, "max_depth must be between 1 and " + Integer.MAX_VALUE);
                }
            }
            case "wait_timeout" ->
                    requireType(value, ValueType.DURATION, at, "wait_timeout must be a duration");
            case "poll_interval", "tick_interval" -> {
                requireType(value, ValueType.DURATION, at, key.lexeme() + " must be a duration");
                Duration min = "tick_interval".equals(key.lexeme()) ? MIN_TICK_INTERVAL : MIN_POLL_INTERVAL;
                if (value.asDuration().compareTo(min) < 0) {
                    throw error(at, key.lexeme() + " must be at least " + min.toMillis() + "ms");
                }
            }
            case "tolerate_missing_assets" ->
                    requireType(value, ValueType.BOOL, at, "tolerate_missing_assets must be true or false");
            default -> throw error(key, "Unknown config key '" + key.lexeme() + "'");
        }
    }

    private void parseHotkeys(Token section) {
        optionalColon();
        consumeLineEnd();
        while (check(TokenType.IDENTIFIER)) {
            Token key = advance();
            if (!HOTKEY_KEYS.contains(key.lexeme())) {
                throw error(key, "Unknown hotkey '" + key.lexeme() + "' (expected start, stop or pause)");
            }
            consume(TokenType.ASSIGN, "Expected '=' after hotkey name");
            Token binding = peek();
            Value value = constant(expression(), binding);
            requireType(value, ValueType.STRING, binding, "Hotkey binding must be a key name");
            hotkeys.put(key.lexeme(), value.asText());
            consumeLineEnd();
        }
    }

    private void parseInterrupts(Token section) {
        optionalColon();
        consumeLineEnd();
        Set<String> ids = new HashSet<>();
        for (InterruptRule existing : interrupts) {
            ids.add(existing.id());
        }
        while (check(TokenType.IDENTIFIER)) {
            Token id = advance();
            if (!ids.add(id.lexeme())) {
                throw error(id, "Duplicate interrupt rule '" + id.lexeme() + "'");
            }
            consume(TokenType.COLON, "Expected ':' after rule id");
            Token asset = name("Expected trigger asset after ':'");
            consume(TokenType.ARROW, "Expected '->' before target flow");
            Token target = name("Expected target flow after '->'");
            flowReferences.add(new Reference(target.lexeme(), target));

            int priority = 0;
            Duration cooldown = InterruptRule.DEFAULT_COOLDOWN;
            double threshold = MatchRequest.DEFAULT_THRESHOLD;
            Region region = null;
            Set<String> seen = new HashSet<>();
            while (check(TokenType.IDENTIFIER)) {
                Token option = advance();
                if (!RULE_OPTIONS.contains(option.lexeme())) {
                    throw error(option, "Unknown interrupt option '" + option.lexeme() + "'");
                }
                if (!seen.add(option.lexeme())) {
                    throw error(option, "Duplicate interrupt option '" + option.lexeme() + "'");
                }
                consume(TokenType.ASSIGN, "Expected '=' after option name");
                Token at = peek();
                Value value = constant(expression(), at);
                switch (option.lexeme()) {
                    case "priority" -> {
                        requireType(value, ValueType.INT, at, "priority must be an integer");
                        priority = toInt(value, at, "priority");
                    }
                    case "cooldown" -> {
                        requireType(value, ValueType.DURATION, at, "cooldown must be a duration");
                        cooldown = value.asDuration();
                    }
                    case "threshold" -> threshold = threshold(value, at);
                    case "region" -> region = region(value, at);
                    default -> throw error(option, "Unknown interrupt option '" + option.lexeme() + "'");
                }
            }
            interrupts.add(new InterruptRule(id.lexeme(), asset.lexeme(), region, threshold,
                    target.lexeme(), priority, cooldown));
            consumeLineEnd();
        }
    }

    private void parseFlow(Token section) {
        String name = section.lexeme();
        if (flows.containsKey(name)) {
            throw error(section, "Duplicate flow '" + name + "'");
        }
        consume(TokenType.COLON, "Expected ':' after flow name");
        consumeLineEnd();

        labels.clear();
        gotos.clear();
        loopDepth = 0;

        List<Statement> body = block(Set.of(TokenType.SECTION, TokenType.EOF));
        for (Token target : gotos) {
            if (!labels.containsKey(target.lexeme())) {
                throw error(target, "Unknown label '" + target.lexeme() + "' in flow '" + name + "'");
            }
        }
        flows.put(name, new Flow(name, body));
    }

    // ================= statements =================

    private List<Statement> block(Set<TokenType> terminators) {
        List<Statement> statements = new ArrayList<>();
        while (!terminators.contains(peek().type())) {
            if (isAtEnd()) {
                throw error(peek(), "Unexpected end of script, missing 'end'");
            }
            statements.add(statement());
        }
        return statements;
    }

    private Statement statement() {
        Token start = peek();
        Statement stmt = switch (start.type()) {
            case VARIABLE -> assignment();
            case LABEL -> label();
            case GOTO -> gotoStatement();
            case RUN -> runFlow();
            case BREAK, CONTINUE -> loopControl();
            case IF -> ifStatement();
            case LOOP -> loopStatement();
            case WHILE -> whileStatement();
            case IDENTIFIER -> actionCall();
            default -> throw error(start, "Unexpected '" + start.lexeme() + "' at start of statement");
        };
        // block statements already consumed their own line end after 'end'
        if (!(stmt instanceof IfStatement || stmt instanceof LoopStatement || stmt instanceof WhileStatement)) {
            consumeLineEnd();
        }
        return stmt;
    }

    private Statement assignment() {
        Token variable = advance();
        consume(TokenType.ASSIGN, "Expected '=' after variable");
        return new AssignStatement(variable.lexeme(), expression());
    }

    private Statement label() {
        advance();
        Token name = consume(TokenType.IDENTIFIER, "Expected label name");
        if (labels.putIfAbsent(name.lexeme(), name) != null) {
            throw error(name, "Duplicate label '" + name.lexeme() + "'");
        }
        return new LabelStatement(name.lexeme());
    }

    private Statement gotoStatement() {
        advance();
        Token name = consume(TokenType.IDENTIFIER, "Expected label name after 'goto'");
        gotos.add(name);
        return new GotoStatement(name.lexeme());
    }

    private Statement runFlow() {
        advance();
        Token name = name("Expected flow name after 'run'");
        flowReferences.add(new Reference(name.lexeme(), name));
        return new RunFlowStatement(name.lexeme());
    }

    private Statement loopControl() {
        Token keyword = advance();
        if (loopDepth == 0) {
            throw error(keyword, "'" + keyword.lexeme() + "' outside of a loop");
        }
        return keyword.type() == TokenType.BREAK ? new BreakStatement() : new ContinueStatement();
    }

    private Statement ifStatement() {
        advance();
        List<ConditionalBranch> branches = new ArrayList<>();
        branches.add(branch());
        List<Statement> elseBody = List.of();
        while (true) {
            if (match(TokenType.ELIF)) {
                branches.add(branch());
            } else if (match(TokenType.ELSE)) {
                consume(TokenType.COLON, "Expected ':' after 'else'");
                consumeLineEnd();
                elseBody = block(Set.of(TokenType.END));
                break;
            } else {
                break;
            }
        }
        consumeEnd("if");
        return new IfStatement(branches, elseBody);
    }

    private ConditionalBranch branch() {
        Expression condition = expression();
        consume(TokenType.COLON, "Expected ':' after condition");
        consumeLineEnd();
        List<Statement> body = block(Set.of(TokenType.ELIF, TokenType.ELSE, TokenType.END));
        return new ConditionalBranch(condition, body);
    }

    private Statement loopStatement() {
        advance();
        Expression count = check(TokenType.COLON) ? null : expression();
        if (count instanceof Literal literal) {
            Value v = literal.value();
            if (v.type() != ValueType.INT) {
                throw error(previous(), "Loop count must be an integer");
            }
        }
        consume(TokenType.COLON, "Expected ':' after loop count");
        consumeLineEnd();
        List<Statement> body = loopBody();
        consumeEnd("loop");
        return new LoopStatement(count, body);
    }

    private Statement whileStatement() {
        advance();
        Expression condition = expression();
        consume(TokenType.COLON, "Expected ':' after while condition");
        consumeLineEnd();
        List<Statement> body = loopBody();
        consumeEnd("while");
        return new WhileStatement(condition, body);
    }

    private List<Statement> loopBody() {
        loopDepth++;
        try {
            return block(Set.of(TokenType.END));
        } finally {
            loopDepth--;
        }
    }

    private Statement actionCall() {
        Token name = advance();
        ActionKind kind = ActionKind.fromKeyword(name.lexeme())
                .orElseThrow(() -> error(name, "Unknown action '" + name.lexeme() + "'"));
        consume(TokenType.LPAREN, "Expected '(' after action name");

        List<Expression> args = new ArrayList<>();
        Map<String, Expression> options = new LinkedHashMap<>();
        if (!check(TokenType.RPAREN)) {
            do {
                if (check(TokenType.IDENTIFIER) && checkNext(TokenType.ASSIGN)) {
                    Token option = advance();
                    advance();
                    if (!kind.acceptsOption(option.lexeme())) {
                        throw error(option, "Action '" + kind.keyword() + "' has no option '" + option.lexeme() + "'");
                    }
                    if (options.containsKey(option.lexeme())) {
                        throw error(option, "Duplicate option '" + option.lexeme() + "'");
                    }
                    Expression value = expression();
                    if (ActionKind.ON_ERROR_OPTION.equals(option.lexeme())) {
                        validatePolicyOption(value, option);
                    }
                    options.put(option.lexeme(), value);
                } else {
                    if (!options.isEmpty()) {
                        throw error(peek(), "Positional argument after named option");
                    }
                    args.add(expression());
                }
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RPAREN, "Expected ')' after arguments");

        if (args.size() < kind.minArgs() || args.size() > kind.maxArgs()) {
            String expected = kind.minArgs() == kind.maxArgs()
                    ? String.valueOf(kind.minArgs())
                    : kind.minArgs() + ".." + kind.maxArgs();
            throw error(name, "Action '" + kind.keyword() + "' takes " + expected
                    + " argument(s), got " + args.size());
        }
        return new ActionCall(kind, args, options);
    }

    private void validatePolicyOption(Expression value, Token at) {
        if (value instanceof Literal literal) {
            requireType(literal.value(), ValueType.STRING, at, "on_error must be pause, skip or abort");
            policy(literal.value().asText(), at);
        }
    }

    // ================= expressions =================

    private Expression expression() {
        return or();
    }

    private Expression or() {
        Expression expr = and();
        while (match(TokenType.OR)) {
            expr = new BinaryExpr(BinaryOperator.OR, expr, and());
        }
        return expr;
    }

    private Expression and() {
        Expression expr = equality();
        while (match(TokenType.AND)) {
            expr = new BinaryExpr(BinaryOperator.AND, expr, equality());
        }
        return expr;
    }

    private Expression equality() {
        Expression expr = comparison();
        while (check(TokenType.EQ) || check(TokenType.NEQ)) {
            BinaryOperator op = advance().type() == TokenType.EQ ? BinaryOperator.EQ : BinaryOperator.NEQ;
            expr = new BinaryExpr(op, expr, comparison());
        }
        return expr;
    }

    private Expression comparison() {
        Expression expr = additive();
        while (true) {
            BinaryOperator op = switch (peek().type()) {
                case LT -> BinaryOperator.LT;
                case LE -> BinaryOperator.LE;
                case GT -> BinaryOperator.GT;
                case GE -> BinaryOperator.GE;
                default -> null;
            };
            if (op == null) {
                return expr;
            }
            advance();
            expr = new BinaryExpr(op, expr, additive());
        }
    }

    private Expression additive() {
        Expression expr = multiplicative();
        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            BinaryOperator op = advance().type() == TokenType.PLUS ? BinaryOperator.ADD : BinaryOperator.SUB;
            expr = new BinaryExpr(op, expr, multiplicative());
        }
        return expr;
    }

    private Expression multiplicative() {
        Expression expr = unary();
        while (true) {
            BinaryOperator op = switch (peek().type()) {
                case STAR -> BinaryOperator.MUL;
                case SLASH -> BinaryOperator.DIV;
                case PERCENT -> BinaryOperator.MOD;
                default -> null;
            };
            if (op == null) {
                return expr;
            }
            advance();
            expr = new BinaryExpr(op, expr, unary());
        }
    }

    private Expression unary() {
        if (match(TokenType.NOT)) {
            return new UnaryExpr(UnaryOperator.NOT, unary());
        }
        if (match(TokenType.MINUS)) {
            return new UnaryExpr(UnaryOperator.NEGATE, unary());
        }
        return primary();
    }

    private Expression primary() {
        if (check(TokenType.NEWLINE) || isAtEnd()) {
            throw error(peek(), "Expected expression");
        }
        Token token = advance();
        return switch (token.type()) {
            case INTEGER -> new Literal(Value.ofInt(parseLong(token)));
            case FLOAT -> new Literal(Value.ofFloat(parseDouble(token)));
            case STRING -> new Literal(Value.ofString(token.lexeme()));
            case DURATION -> new Literal(Value.ofDuration(parseDuration(token)));
            case TRUE -> new Literal(Value.TRUE);
            case FALSE -> new Literal(Value.FALSE);
            case VARIABLE -> new VariableRef(token.lexeme());
            case LPAREN -> parenthesized();
            case IDENTIFIER -> {
                if ("image".equals(token.lexeme()) && check(TokenType.LPAREN)) {
                    yield imageQuery(token);
                }
                // bare words name assets, keys and policies
                yield new Literal(Value.ofString(token.lexeme()));
            }
            default -> throw error(token, "Expected expression but found '" + token.lexeme() + "'");
        };
    }

    private Expression parenthesized() {
        Expression first = expression();
        if (!check(TokenType.COMMA)) {
            consume(TokenType.RPAREN, "Expected ')'");
            return first;
        }
        List<Expression> items = new ArrayList<>();
        items.add(first);
        while (match(TokenType.COMMA)) {
            items.add(expression());
        }
        consume(TokenType.RPAREN, "Expected ')' after tuple");
        return new TupleExpr(items);
    }

    private Expression imageQuery(Token keyword) {
        consume(TokenType.LPAREN, "Expected '(' after 'image'");
        Expression asset = expression();
        Map<String, Expression> options = new LinkedHashMap<>();
        while (match(TokenType.COMMA)) {
            Token option = consume(TokenType.IDENTIFIER, "Expected option name");
            if (!ImageQuery.OPTIONS.contains(option.lexeme())) {
                throw error(option, "image() has no option '" + option.lexeme() + "'");
            }
            if (options.containsKey(option.lexeme())) {
                throw error(option, "Duplicate option '" + option.lexeme() + "'");
            }
            consume(TokenType.ASSIGN, "Expected '=' after option name");
            options.put(option.lexeme(), expression());
        }
        consume(TokenType.RPAREN, "Expected ')' after image query");
        return new ImageQuery(asset, options);
    }

    // ================= constants =================

    /** Folds a literal, a negated number or a tuple of those; anything else is rejected. */
    private Value constant(Expression expr, Token at) {
        if (expr instanceof Literal literal) {
            return literal.value();
        }
        if (expr instanceof UnaryExpr unary && unary.op() == UnaryOperator.NEGATE) {
            Value inner = constant(unary.operand(), at);
            return switch (inner.type()) {
                case INT -> Value.ofInt(-inner.asLong());
                case FLOAT -> Value.ofFloat(-inner.asDouble());
                default -> throw error(at, "Only numbers can be negated");
            };
        }
        if (expr instanceof TupleExpr tuple) {
            List<Value> items = new ArrayList<>();
            for (Expression item : tuple.items()) {
                items.add(constant(item, at));
            }
            return Value.ofList(items);
        }
        throw error(at, "Expected a constant value");
    }

    private double threshold(Value value, Token at) {
        if (!value.isNumeric()) {
            throw error(at, "threshold must be a number");
        }
        double t = value.asDouble();
        if (!(t >= 0.0 && t <= 1.0)) {
            throw error(at, "threshold must be within [0, 1]");
        }
        return t;
    }

    private Region region(Value value, Token at) {
        if (value.type() != ValueType.LIST || value.asList().size() != 4) {
            throw error(at, "region must be a tuple (x, y, width, height)");
        }
        List<Value> parts = value.asList();
        for (Value part : parts) {
            if (part.type() != ValueType.INT) {
                throw error(at, "region values must be integers");
            }
        }
        try {
            return new Region(toInt(parts.get(0), at, "region x"), toInt(parts.get(1), at, "region y"),
                    toInt(parts.get(2), at, "region width"), toInt(parts.get(3), at, "region height"));
        } catch (IllegalArgumentException e) {
            throw error(at, e.getMessage());
        }
    }

    private ErrorPolicy policy(String text, Token at) {
        try {
            return ErrorPolicy.parse(text);
        } catch (IllegalArgumentException e) {
            throw error(at, e.getMessage());
        }
    }

    private void requireType(Value value, ValueType type, Token at, String message) {
        if (value.type() != type) {
            throw error(at, message);
        }
    }

    private long parseLong(Token token) {
        try {
            return Long.parseLong(token.lexeme());
        } catch (NumberFormatException e) {
            throw error(token, "Integer out of range: " + token.lexeme());
        }
    }

    private double parseDouble(Token token) {
        double d = Double.parseDouble(token.lexeme());
        if (!Double.isFinite(d)) {
            throw error(token, "Number out of range: " + token.lexeme());
        }
        return d;
    }

    private int toInt(Value value, Token at, String what) {
        long n = value.asLong();
        if (n < Integer.MIN_VALUE || n > Integer.MAX_VALUE) {
            throw error(at, what + " out of range: " + n);
        }
        return (int) n;
    }

    private Duration parseDuration(Token token) {
        String text = token.lexeme();
        String digits;
        Duration unit;
        if (text.endsWith("ms")) {
            digits = text.substring(0, text.length() - 2);
            unit = Duration.ofMillis(1);
        } else if (text.endsWith("s")) {
            digits = text.substring(0, text.length() - 1);
            unit = Duration.ofSeconds(1);
        } else {
            digits = text.substring(0, text.length() - 1);
            unit = Duration.ofMinutes(1);
        }
        try {
            return unit.multipliedBy(Long.parseLong(digits));
        } catch (NumberFormatException | ArithmeticException e) {
            throw error(token, "Duration out of range: " + text);
        }
    }

    // ================= helpers =================

    /** Identifier or string naming a flow or asset. */
    private Token name(String message) {
        if (check(TokenType.IDENTIFIER) || check(TokenType.STRING)) {
            return advance();
        }
        throw error(peek(), message);
    }

    private void consumeEnd(String construct) {
        consume(TokenType.END, "Expected 'end' to close '" + construct + "'");
        consumeLineEnd();
    }

    private void optionalColon() {
        match(TokenType.COLON);
    }

    private void consumeLineEnd() {
        if (check(TokenType.EOF)) {
            return;
        }
        consume(TokenType.NEWLINE, "Expected end of line");
    }

    private void skipNewlines() {
        while (match(TokenType.NEWLINE)) {
            // collapse
        }
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(peek(), message);
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkNext(TokenType type) {
        return current + 1 < tokens.size() && tokens.get(current + 1).type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            current++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private static ParseException error(Token token, String message) {
        return new ParseException(message, token.line(), token.col());
    }
}
