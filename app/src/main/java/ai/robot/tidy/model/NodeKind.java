package ai.robot.tidy.model;

/**
 * Closed set of node kinds. Traversal switches over it, so adding a kind forces every visitor to be updated.
 */
public enum NodeKind {
    SECTION,
    TEST_CASE,
    KEYWORD,
    IF_BLOCK,
    STATEMENT
}
