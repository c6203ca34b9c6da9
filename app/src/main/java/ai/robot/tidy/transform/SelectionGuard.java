package ai.robot.tidy.transform;

import ai.robot.tidy.config.FormattingContext;
import ai.robot.tidy.model.Node;
import ai.robot.tidy.model.Token;
import java.util.function.Supplier;

/**
 * Skips a rule's per-node body when the node lies entirely outside the configured selection window.
 */
public final class SelectionGuard {

    private SelectionGuard() {
    }

    public static boolean outsideSelection(Node node, FormattingContext context) {
        if (context.selection().isEmpty()) {
            return false;
        }
        int first = node.lineNumber();
        int last = node.endLineNumber();
        if (first == Token.UNKNOWN_LINE || last == Token.UNKNOWN_LINE) {
            // synthesized during this run
            return false;
        }
        return context.selection().get().excludes(first, last);
    }

    public static Rewrite guard(Node node, FormattingContext context, Supplier<Rewrite> body) {
        if (outsideSelection(node, context)) {
            return Rewrite.keep();
        }
        return body.get();
    }
}
