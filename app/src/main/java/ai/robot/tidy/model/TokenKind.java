package ai.robot.tidy.model;

/**
 * Closed set of token kinds produced by the front end and by rules.
 */
public enum TokenKind {
    SEPARATOR(Category.NON_DATA),
    EOL(Category.NON_DATA),
    COMMENT(Category.NON_DATA),
    CONTINUATION(Category.NON_DATA),

    SETTING_HEADER(Category.SECTION_HEADER),
    VARIABLE_HEADER(Category.SECTION_HEADER),
    TESTCASE_HEADER(Category.SECTION_HEADER),
    KEYWORD_HEADER(Category.SECTION_HEADER),
    COMMENT_HEADER(Category.SECTION_HEADER),

    TESTCASE_NAME(Category.DATA),
    KEYWORD_NAME(Category.DATA),

    DOCUMENTATION(Category.SETTING),
    SUITE_SETUP(Category.SETTING),
    SUITE_TEARDOWN(Category.SETTING),
    METADATA(Category.SETTING),
    TEST_SETUP(Category.SETTING),
    TEST_TEARDOWN(Category.SETTING),
    TEST_TEMPLATE(Category.SETTING),
    TEST_TIMEOUT(Category.SETTING),
    FORCE_TAGS(Category.SETTING),
    DEFAULT_TAGS(Category.SETTING),
    LIBRARY(Category.SETTING),
    RESOURCE(Category.SETTING),
    VARIABLES(Category.SETTING),
    SETUP(Category.SETTING),
    TEARDOWN(Category.SETTING),
    TEMPLATE(Category.SETTING),
    TIMEOUT(Category.SETTING),
    TAGS(Category.SETTING),
    ARGUMENTS(Category.SETTING),
    RETURN(Category.SETTING),

    NAME(Category.DATA),
    ARGUMENT(Category.DATA),
    ASSIGN(Category.DATA),
    KEYWORD(Category.DATA),
    VARIABLE(Category.DATA),

    IF(Category.CONTROL, "IF"),
    ELSE_IF(Category.CONTROL, "ELSE IF"),
    ELSE(Category.CONTROL, "ELSE"),
    END(Category.CONTROL, "END");

    private enum Category {
        NON_DATA,
        SECTION_HEADER,
        SETTING,
        CONTROL,
        DATA
    }

    private final Category category;
    private final String defaultValue;

    TokenKind(Category category) {
        this(category, "");
    }

    TokenKind(Category category, String defaultValue) {
        this.category = category;
        this.defaultValue = defaultValue;
    }

    public boolean isData() {
        return category != Category.NON_DATA;
    }

    public boolean isSetting() {
        return category == Category.SETTING;
    }

    public boolean isSectionHeader() {
        return category == Category.SECTION_HEADER;
    }

    public boolean isControl() {
        return category == Category.CONTROL;
    }

    /**
     * Text a freshly created token of this kind carries when no value is given, e.g. {@code ELSE IF}.
     */
    public String defaultValue() {
        return defaultValue;
    }
}
