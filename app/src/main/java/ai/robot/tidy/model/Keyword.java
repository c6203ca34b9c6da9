package ai.robot.tidy.model;

import java.util.List;

/**
 * User keyword definition inside a keywords section.
 */
public final class Keyword extends Block {

    public Keyword(Statement name, List<? extends Node> body) {
        super(name, body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.KEYWORD;
    }

    public String name() {
        return header().firstToken(TokenKind.KEYWORD_NAME).map(Token::value).orElse("");
    }
}
