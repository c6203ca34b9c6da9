package ai.robot.tidy.transform.rules;

import ai.robot.tidy.model.Document;
import ai.robot.tidy.model.Statement;
import ai.robot.tidy.model.TokenKind;
import ai.robot.tidy.transform.ModelVisitor;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Collects the local setting kinds whose suite-level counterpart has a value, e.g. {@code [Setup]} when
 * {@code Test Setup} is set.
 */
final class SuiteSettingsFinder extends ModelVisitor {

    static final Map<TokenKind, TokenKind> LOCAL_OVERRIDES = Map.of(
            TokenKind.TEST_SETUP, TokenKind.SETUP,
            TokenKind.TEST_TEARDOWN, TokenKind.TEARDOWN,
            TokenKind.TEST_TEMPLATE, TokenKind.TEMPLATE,
            TokenKind.TEST_TIMEOUT, TokenKind.TIMEOUT,
            TokenKind.DEFAULT_TAGS, TokenKind.TAGS);

    private final Set<TokenKind> overridden = EnumSet.noneOf(TokenKind.class);

    private SuiteSettingsFinder() {
    }

    static Set<TokenKind> find(Document document) {
        SuiteSettingsFinder finder = new SuiteSettingsFinder();
        finder.visitDocument(document);
        return finder.overridden;
    }

    @Override
    protected void visitStatement(Statement statement) {
        statement.settingKind()
                .filter(LOCAL_OVERRIDES::containsKey)
                .filter(kind -> statement.dataTokens().size() != 1)
                .ifPresent(kind -> overridden.add(LOCAL_OVERRIDES.get(kind)));
    }
}
