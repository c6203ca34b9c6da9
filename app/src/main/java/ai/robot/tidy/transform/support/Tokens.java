package ai.robot.tidy.transform.support;

import ai.robot.tidy.config.FormattingContext;
import ai.robot.tidy.model.Statement;
import ai.robot.tidy.model.Token;
import ai.robot.tidy.model.TokenKind;
import java.util.ArrayList;
import java.util.List;

/**
 * Builders for separator and end-of-line tokens.
 */
public final class Tokens {

    private Tokens() {
    }

    public static Token separator(String value, int lineNumber) {
        return Token.at(TokenKind.SEPARATOR, value, lineNumber);
    }

    public static Token eol(FormattingContext context, int lineNumber) {
        return Token.at(TokenKind.EOL, context.eol(), lineNumber);
    }

    /**
     * Leading whitespace of a statement, i.e. the value of its first token when that token is a separator.
     */
    public static String indentOf(Statement statement) {
        List<Token> tokens = statement.tokenList();
        if (!tokens.isEmpty() && tokens.get(0).kind() == TokenKind.SEPARATOR) {
            return tokens.get(0).value();
        }
        return "";
    }

    /**
     * Separator token for {@code indent}, or nothing when the indent is empty.
     */
    public static List<Token> indentation(String indent, int lineNumber) {
        return indent.isEmpty() ? List.of() : List.of(separator(indent, lineNumber));
    }

    /**
     * Lays out {@code tokens} as one physical line: the indent, the tokens joined by the default separator,
     * then an end-of-line token.
     */
    public static List<Token> line(String indent, List<Token> tokens, FormattingContext context, int lineNumber) {
        List<Token> line = new ArrayList<>(tokens.size() * 2 + 2);
        line.addAll(indentation(indent, lineNumber));
        for (int i = 0; i < tokens.size(); i++) {
            if (i > 0) {
                line.add(separator(context.separator(), lineNumber));
            }
            line.add(tokens.get(i));
        }
        line.add(eol(context, lineNumber));
        return line;
    }
}
