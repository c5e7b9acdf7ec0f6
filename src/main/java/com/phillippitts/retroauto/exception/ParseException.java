package com.phillippitts.retroauto.exception;

/**
 * Thrown when script source cannot be turned into a Program.
 * Always fatal: the script does not start and no partial Program is produced.
 */
public class ParseException extends RetroAutoException {

    private final int line;
    private final int column;
    private final String reason;

    public ParseException(String reason, int line, int column) {
        super("Parse error at line " + line + ", column " + column + ": " + reason);
        this.reason = reason;
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /** Message without the location prefix. */
    public String getReason() {
        return reason;
    }
}
