package ai.robot.tidy.transform.rules;

import ai.robot.tidy.config.FormattingContext;
import ai.robot.tidy.model.SectionKind;
import ai.robot.tidy.model.Statement;
import ai.robot.tidy.model.StatementKind;
import ai.robot.tidy.model.Token;
import ai.robot.tidy.transform.ModelTransformer;
import ai.robot.tidy.transform.Rewrite;
import ai.robot.tidy.transform.RuleParameters;
import ai.robot.tidy.transform.SelectionGuard;
import java.util.List;
import java.util.Locale;

/**
 * Rewrites every section header to {@code *** Name ***}, e.g. {@code *settings} becomes {@code *** Settings ***}.
 */
public class NormalizeSectionHeaderName extends ModelTransformer {

    static final String UPPERCASE = "uppercase";

    private final boolean uppercase;

    public NormalizeSectionHeaderName(boolean uppercase) {
        this.uppercase = uppercase;
    }

    public static NormalizeSectionHeaderName fromParameters(RuleParameters parameters) {
        return new NormalizeSectionHeaderName(parameters.getBoolean(UPPERCASE, false));
    }

    @Override
    protected Rewrite visitStatement(Statement statement, FormattingContext context) {
        if (statement.statementKind() != StatementKind.SECTION_HEADER) {
            return Rewrite.keep();
        }
        return SelectionGuard.guard(statement, context, () -> {
            List<Token> data = statement.dataTokens();
            if (!data.isEmpty() && data.get(0).kind().isSectionHeader()) {
                Token name = data.get(0);
                String header = SectionKind.fromHeaderToken(name.kind()).canonicalHeader();
                name.setValue(uppercase ? header.toUpperCase(Locale.ROOT) : header);
            }
            return Rewrite.keep();
        });
    }
}
