package ai.robot.tidy.transform;

import ai.robot.tidy.model.Node;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of visiting one node: keep it, replace it with zero or more nodes, or delete it.
 */
public final class Rewrite {

    public enum Action {
        KEEP,
        REPLACE,
        DELETE
    }

    private static final Rewrite KEEP = new Rewrite(Action.KEEP, List.of());
    private static final Rewrite DELETE = new Rewrite(Action.DELETE, List.of());

    private final Action action;
    private final List<Node> replacement;

    private Rewrite(Action action, List<Node> replacement) {
        this.action = action;
        this.replacement = replacement;
    }

    public static Rewrite keep() {
        return KEEP;
    }

    public static Rewrite delete() {
        return DELETE;
    }

    public static Rewrite replaceWith(Node node) {
        return new Rewrite(Action.REPLACE, List.of(Objects.requireNonNull(node, "node")));
    }

    public static Rewrite replaceWith(List<? extends Node> nodes) {
        return new Rewrite(Action.REPLACE, List.copyOf(Objects.requireNonNull(nodes, "nodes")));
    }

    public Action action() {
        return action;
    }

    public List<Node> replacement() {
        return replacement;
    }

    @Override
    public String toString() {
        return action == Action.REPLACE ? "REPLACE" + replacement : action.name();
    }
}
