package ai.robot.tidy.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One logical line (possibly continued over several physical lines) made of tokens, separators included.
 */
public final class Statement extends Node {

    private final StatementKind statementKind;
    private final List<Token> tokens;

    public Statement(StatementKind statementKind, List<Token> tokens) {
        this.statementKind = Objects.requireNonNull(statementKind, "statementKind");
        this.tokens = new ArrayList<>(Objects.requireNonNull(tokens, "tokens"));
    }

    public static Statement of(StatementKind statementKind, Token... tokens) {
        return new Statement(statementKind, List.of(tokens));
    }

    public static Statement emptyLine(String lineEnding) {
        return of(StatementKind.EMPTY_LINE, Token.of(TokenKind.EOL, lineEnding));
    }

    @Override
    public NodeKind kind() {
        return NodeKind.STATEMENT;
    }

    public StatementKind statementKind() {
        return statementKind;
    }

    /**
     * Live, mutable token list.
     */
    public List<Token> tokenList() {
        return tokens;
    }

    public void replaceTokens(List<Token> newTokens) {
        List<Token> copy = new ArrayList<>(newTokens);
        tokens.clear();
        tokens.addAll(copy);
    }

    @Override
    public void collectTokens(List<Token> target) {
        target.addAll(tokens);
    }

    public List<Token> dataTokens() {
        List<Token> data = new ArrayList<>();
        for (Token token : tokens) {
            if (token.kind().isData()) {
                data.add(token);
            }
        }
        return data;
    }

    public Optional<Token> firstToken(TokenKind kind) {
        for (Token token : tokens) {
            if (token.kind() == kind) {
                return Optional.of(token);
            }
        }
        return Optional.empty();
    }

    public List<Token> tokensOf(TokenKind kind) {
        List<Token> matching = new ArrayList<>();
        for (Token token : tokens) {
            if (token.kind() == kind) {
                matching.add(token);
            }
        }
        return matching;
    }

    /**
     * Keyword name of a keyword call, if any.
     */
    public Optional<String> keyword() {
        return firstToken(TokenKind.KEYWORD).map(Token::value);
    }

    /**
     * Kind of the setting name token for {@link StatementKind#SETTING} statements.
     */
    public Optional<TokenKind> settingKind() {
        if (statementKind != StatementKind.SETTING) {
            return Optional.empty();
        }
        List<Token> data = dataTokens();
        if (data.isEmpty() || !data.get(0).kind().isSetting()) {
            return Optional.empty();
        }
        return Optional.of(data.get(0).kind());
    }

    /**
     * Splits the tokens into physical lines; each line ends with its end-of-line token when one exists.
     */
    public List<List<Token>> lines() {
        List<List<Token>> lines = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        for (Token token : tokens) {
            current.add(token);
            if (token.kind() == TokenKind.EOL) {
                lines.add(current);
                current = new ArrayList<>();
            }
        }
        if (!current.isEmpty()) {
            lines.add(current);
        }
        return lines;
    }

    @Override
    public String toString() {
        return statementKind + tokens.toString();
    }
}
