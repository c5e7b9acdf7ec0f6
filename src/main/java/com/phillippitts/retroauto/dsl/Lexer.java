package com.phillippitts.retroauto.dsl;

import com.phillippitts.retroauto.exception.ParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns script source into tokens.
 *
 * <p>The language is line oriented: line breaks become {@link TokenType#NEWLINE} tokens
 * (runs of blank lines and comment-only lines collapse into one), while spaces and tabs
 * are insignificant. {@code //} and {@code #} start a comment that runs to end of line.
 * The first malformed token aborts lexing with a {@link ParseException}.
 */
public class Lexer {

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("if", TokenType.IF),
            Map.entry("elif", TokenType.ELIF),
            Map.entry("else", TokenType.ELSE),
            Map.entry("end", TokenType.END),
            Map.entry("loop", TokenType.LOOP),
            Map.entry("while", TokenType.WHILE),
            Map.entry("label", TokenType.LABEL),
            Map.entry("goto", TokenType.GOTO),
            Map.entry("run", TokenType.RUN),
            Map.entry("break", TokenType.BREAK),
            Map.entry("continue", TokenType.CONTINUE),
            Map.entry("true", TokenType.TRUE),
            Map.entry("false", TokenType.FALSE),
            Map.entry("and", TokenType.AND),
            Map.entry("or", TokenType.OR),
            Map.entry("not", TokenType.NOT)
    );

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int pos = 0;
    private int line = 1;
    private int col = 1;

    public Lexer(String source) {
        this.source = source == null ? "" : source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            skipWhitespace();
            if (isAtEnd()) {
                break;
            }
            int startLine = line;
            int startCol = col;
            char c = advance();

            switch (c) {
                case '\n' -> newline(startLine, startCol);
                case '#' -> skipComment();
                case '/' -> {
                    if (match('/')) {
                        skipComment();
                    } else {
                        add(TokenType.SLASH, "/", startLine, startCol);
                    }
                }
                case '+' -> add(TokenType.PLUS, "+", startLine, startCol);
                case '*' -> add(TokenType.STAR, "*", startLine, startCol);
                case '%' -> add(TokenType.PERCENT, "%", startLine, startCol);
                case '(' -> add(TokenType.LPAREN, "(", startLine, startCol);
                case ')' -> add(TokenType.RPAREN, ")", startLine, startCol);
                case ',' -> add(TokenType.COMMA, ",", startLine, startCol);
                case ':' -> add(TokenType.COLON, ":", startLine, startCol);
                case '-' -> {
                    boolean arrow = match('>');
                    add(arrow ? TokenType.ARROW : TokenType.MINUS, arrow ? "->" : "-", startLine, startCol);
                }
                case '=' -> {
                    boolean eq = match('=');
                    add(eq ? TokenType.EQ : TokenType.ASSIGN, eq ? "==" : "=", startLine, startCol);
                }
                case '!' -> {
                    boolean neq = match('=');
                    add(neq ? TokenType.NEQ : TokenType.NOT, neq ? "!=" : "!", startLine, startCol);
                }
                case '<' -> {
                    boolean le = match('=');
                    add(le ? TokenType.LE : TokenType.LT, le ? "<=" : "<", startLine, startCol);
                }
                case '>' -> {
                    boolean ge = match('=');
                    add(ge ? TokenType.GE : TokenType.GT, ge ? ">=" : ">", startLine, startCol);
                }
                case '&' -> {
                    if (!match('&')) {
                        throw error("Unexpected '&'", startLine, startCol);
                    }
                    add(TokenType.AND, "&&", startLine, startCol);
                }
                case '|' -> {
                    if (!match('|')) {
                        throw error("Unexpected '|'", startLine, startCol);
                    }
                    add(TokenType.OR, "||", startLine, startCol);
                }
                case '"', '\'' -> stringLiteral(c, startLine, startCol);
                case '$' -> prefixedName(TokenType.VARIABLE, "variable", startLine, startCol);
                case '@' -> prefixedName(TokenType.SECTION, "section", startLine, startCol);
                default -> {
                    if (isDigit(c)) {
                        numberLiteral(c, startLine, startCol);
                    } else if (isAlpha(c)) {
                        identifier(c, startLine, startCol);
                    } else {
                        throw error("Unexpected character: " + c, startLine, startCol);
                    }
                }
            }
        }

        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type() != TokenType.NEWLINE) {
            tokens.add(new Token(TokenType.NEWLINE, "\\n", line, col));
        }
        tokens.add(new Token(TokenType.EOF, "", line, col));
        return tokens;
    }

    // ================= helpers =================

    private void newline(int startLine, int startCol) {
        // leading and repeated line breaks carry no meaning
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() == TokenType.NEWLINE) {
            return;
        }
        add(TokenType.NEWLINE, "\\n", startLine, startCol);
    }

    private void numberLiteral(char first, int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();
        sb.append(first);
        while (!isAtEnd() && isDigit(peek())) {
            sb.append(advance());
        }

        if (!isAtEnd() && peek() == '.' && isDigit(peekNext())) {
            sb.append(advance());
            while (!isAtEnd() && isDigit(peek())) {
                sb.append(advance());
            }
            add(TokenType.FLOAT, sb.toString(), startLine, startCol);
            return;
        }

        if (!isAtEnd() && isAlpha(peek())) {
            StringBuilder suffix = new StringBuilder();
            while (!isAtEnd() && isAlphaNumeric(peek())) {
                suffix.append(advance());
            }
            String unit = suffix.toString();
            if (!unit.equals("ms") && !unit.equals("s") && !unit.equals("m")) {
                throw error("Unknown duration unit '" + unit + "' (expected ms, s or m)", startLine, startCol);
            }
            add(TokenType.DURATION, sb + unit, startLine, startCol);
            return;
        }

        add(TokenType.INTEGER, sb.toString(), startLine, startCol);
    }

    private void identifier(char first, int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();
        sb.append(first);
        while (!isAtEnd() && isAlphaNumeric(peek())) {
            sb.append(advance());
        }
        String text = sb.toString();
        add(KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER), text, startLine, startCol);
    }

    private void prefixedName(TokenType type, String what, int startLine, int startCol) {
        if (isAtEnd() || !isAlpha(peek())) {
            throw error("Expected " + what + " name", startLine, startCol);
        }
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && isAlphaNumeric(peek())) {
            sb.append(advance());
        }
        add(type, sb.toString(), startLine, startCol);
    }

    private void stringLiteral(char quote, int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c == '\n') {
                throw error("Unterminated string", startLine, startCol);
            }
            if (c == '\\') {
                if (isAtEnd()) {
                    break;
                }
                char esc = advance();
                switch (esc) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    case '\\' -> sb.append('\\');
                    case '"' -> sb.append('"');
                    case '\'' -> sb.append('\'');
                    default -> throw error("Invalid escape \\" + esc, line, col - 2);
                }
            } else {
                sb.append(c);
            }
        }
        if (isAtEnd()) {
            throw error("Unterminated string", startLine, startCol);
        }
        advance();
        add(TokenType.STRING, sb.toString(), startLine, startCol);
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r') {
                advance();
            } else {
                break;
            }
        }
    }

    private void skipComment() {
        while (!isAtEnd() && peek() != '\n') {
            advance();
        }
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private char advance() {
        char c = source.charAt(pos++);
        if (c == '\n') {
            line++;
            col = 1;
        } else {
            col++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(pos) != expected) {
            return false;
        }
        advance();
        return true;
    }

    private char peek() {
        return source.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 < source.length() ? source.charAt(pos + 1) : '\0';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void add(TokenType type, String lexeme, int l, int c) {
        tokens.add(new Token(type, lexeme, l, c));
    }

    private static ParseException error(String msg, int l, int c) {
        return new ParseException(msg, l, c);
    }
}
