package ai.robot.tidy.model;

import java.util.Objects;

/**
 * Smallest addressable unit of a statement. The value is mutable so rules can rewrite text in place;
 * kind and position are fixed.
 */
public final class Token {

    public static final int UNKNOWN_LINE = -1;

    private final TokenKind kind;
    private String value;
    private final int lineNumber;
    private final int column;

    public Token(TokenKind kind, String value, int lineNumber, int column) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.value = Objects.requireNonNull(value, "value");
        this.lineNumber = lineNumber;
        this.column = column;
    }

    public static Token of(TokenKind kind, String value) {
        return new Token(kind, value, UNKNOWN_LINE, UNKNOWN_LINE);
    }

    public static Token of(TokenKind kind) {
        return of(kind, kind.defaultValue());
    }

    /**
     * Synthesized token attributed to {@code lineNumber}, so selection checks keep treating it as part
     * of the statement it was derived from.
     */
    public static Token at(TokenKind kind, String value, int lineNumber) {
        return new Token(kind, value, lineNumber, UNKNOWN_LINE);
    }

    public TokenKind kind() {
        return kind;
    }

    public String value() {
        return value;
    }

    public void setValue(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public int lineNumber() {
        return lineNumber;
    }

    public int column() {
        return column;
    }

    public boolean hasPosition() {
        return lineNumber > 0;
    }

    public Token copy() {
        return new Token(kind, value, lineNumber, column);
    }

    public Token withKind(TokenKind newKind) {
        return new Token(newKind, value, lineNumber, column);
    }

    @Override
    public String toString() {
        return kind + "(" + value.replace("\n", "\\n").replace("\r", "\\r") + ")@" + lineNumber;
    }
}
