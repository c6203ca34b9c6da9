package ai.robot.tidy.transform.support;

import ai.robot.tidy.config.FormattingContext;
import ai.robot.tidy.model.Node;
import ai.robot.tidy.model.Statement;
import ai.robot.tidy.model.StatementKind;
import java.util.List;

/**
 * Trimming and padding of blank-line statements in a body.
 */
public final class BlankLines {

    private BlankLines() {
    }

    public static boolean isBlank(Node node) {
        return node.isStatement(StatementKind.EMPTY_LINE);
    }

    public static void trimLeading(List<Node> body) {
        while (!body.isEmpty() && isBlank(body.get(0))) {
            body.remove(0);
        }
    }

    public static void trimTrailing(List<Node> body) {
        while (!body.isEmpty() && isBlank(body.get(body.size() - 1))) {
            body.remove(body.size() - 1);
        }
    }

    public static void trim(List<Node> body) {
        trimLeading(body);
        trimTrailing(body);
    }

    public static void append(List<Node> body, int count, FormattingContext context) {
        for (int i = 0; i < count; i++) {
            body.add(Statement.emptyLine(context.eol()));
        }
    }
}
