package ai.robot.tidy.model;

import java.util.Locale;

/**
 * Top-level section types with their canonical header text.
 */
public enum SectionKind {
    SETTINGS("Settings", TokenKind.SETTING_HEADER),
    VARIABLES("Variables", TokenKind.VARIABLE_HEADER),
    TEST_CASES("Test Cases", TokenKind.TESTCASE_HEADER),
    KEYWORDS("Keywords", TokenKind.KEYWORD_HEADER),
    COMMENTS("Comments", TokenKind.COMMENT_HEADER);

    private final String title;
    private final TokenKind headerToken;

    SectionKind(String title, TokenKind headerToken) {
        this.title = title;
        this.headerToken = headerToken;
    }

    public String canonicalHeader() {
        return "*** " + title + " ***";
    }

    public TokenKind headerToken() {
        return headerToken;
    }

    public static SectionKind fromHeaderToken(TokenKind kind) {
        for (SectionKind sectionKind : values()) {
            if (sectionKind.headerToken == kind) {
                return sectionKind;
            }
        }
        throw new IllegalArgumentException("Not a section header token: " + kind);
    }

    @Override
    public String toString() {
        return title.toLowerCase(Locale.ROOT);
    }
}
