package ai.robot.tidy.model;

/**
 * Classification of a single logical line.
 */
public enum StatementKind {
    SECTION_HEADER,
    SETTING,
    VARIABLE,
    TEST_CASE_NAME,
    KEYWORD_NAME,
    KEYWORD_CALL,
    TEMPLATE_ARGUMENTS,
    IF_HEADER,
    ELSE_IF_HEADER,
    ELSE_HEADER,
    END,
    COMMENT,
    EMPTY_LINE
}
