package ai.robot.tidy.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Node made of a header statement followed by a body of nested nodes.
 */
public abstract class Block extends Node {

    private Statement header;
    private final List<Node> body;

    protected Block(Statement header, List<? extends Node> body) {
        this.header = Objects.requireNonNull(header, "header");
        this.body = new ArrayList<>(Objects.requireNonNull(body, "body"));
    }

    public Statement header() {
        return header;
    }

    public void setHeader(Statement header) {
        this.header = Objects.requireNonNull(header, "header");
    }

    /**
     * Live, mutable body.
     */
    public List<Node> body() {
        return body;
    }

    @Override
    public void collectTokens(List<Token> target) {
        header.collectTokens(target);
        for (Node node : body) {
            node.collectTokens(target);
        }
    }
}
