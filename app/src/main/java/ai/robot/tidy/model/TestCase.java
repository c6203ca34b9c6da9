package ai.robot.tidy.model;

import java.util.List;

public final class TestCase extends Block {

    public TestCase(Statement name, List<? extends Node> body) {
        super(name, body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TEST_CASE;
    }

    public String name() {
        return header().firstToken(TokenKind.TESTCASE_NAME).map(Token::value).orElse("");
    }
}
