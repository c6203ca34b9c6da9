package ai.robot.tidy.writer;

import ai.robot.tidy.model.Document;
import ai.robot.tidy.model.Node;
import ai.robot.tidy.model.Token;

/**
 * Turns a tree back into text by concatenating token values in order.
 */
public class DocumentRenderer {

    public String render(Document document) {
        return join(document.tokens());
    }

    public String render(Node node) {
        return join(node.tokens());
    }

    private String join(Iterable<Token> tokens) {
        StringBuilder builder = new StringBuilder();
        for (Token token : tokens) {
            builder.append(token.value());
        }
        return builder.toString();
    }
}
