package ai.robot.tidy.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Element of the document tree below the document root.
 */
public abstract class Node {

    public abstract NodeKind kind();

    /**
     * Collects every token of this node and its descendants in source order.
     */
    public abstract void collectTokens(List<Token> target);

    public final List<Token> tokens() {
        List<Token> tokens = new ArrayList<>();
        collectTokens(tokens);
        return tokens;
    }

    /**
     * First source line covered by this node, or {@link Token#UNKNOWN_LINE} when every token was synthesized.
     */
    public int lineNumber() {
        for (Token token : tokens()) {
            if (token.hasPosition()) {
                return token.lineNumber();
            }
        }
        return Token.UNKNOWN_LINE;
    }

    /**
     * Last source line covered by this node, or {@link Token#UNKNOWN_LINE} when every token was synthesized.
     */
    public int endLineNumber() {
        List<Token> tokens = tokens();
        for (int i = tokens.size() - 1; i >= 0; i--) {
            if (tokens.get(i).hasPosition()) {
                return tokens.get(i).lineNumber();
            }
        }
        return Token.UNKNOWN_LINE;
    }

    public boolean isStatement(StatementKind statementKind) {
        return this instanceof Statement statement && statement.statementKind() == statementKind;
    }
}
