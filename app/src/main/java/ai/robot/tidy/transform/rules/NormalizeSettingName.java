package ai.robot.tidy.transform.rules;

import ai.robot.tidy.config.FormattingContext;
import ai.robot.tidy.model.Statement;
import ai.robot.tidy.model.Token;
import ai.robot.tidy.transform.ModelTransformer;
import ai.robot.tidy.transform.Rewrite;
import ai.robot.tidy.transform.RuleParameters;
import ai.robot.tidy.transform.SelectionGuard;
import ai.robot.tidy.transform.support.Names;

/**
 * Collapses whitespace in setting names and title-cases them: {@code suite   SETUP} becomes
 * {@code Suite Setup}, {@code [setup]} becomes {@code [Setup]}.
 */
public class NormalizeSettingName extends ModelTransformer {

    public static NormalizeSettingName fromParameters(RuleParameters parameters) {
        return new NormalizeSettingName();
    }

    @Override
    protected Rewrite visitStatement(Statement statement, FormattingContext context) {
        if (statement.settingKind().isEmpty()) {
            return Rewrite.keep();
        }
        return SelectionGuard.guard(statement, context, () -> {
            Token name = statement.dataTokens().get(0);
            name.setValue(normalize(name.value()));
            return Rewrite.keep();
        });
    }

    static String normalize(String name) {
        if (name.startsWith("[")) {
            String inner = name.endsWith("]") && name.length() > 1
                    ? name.substring(1, name.length() - 1)
                    : name.substring(1);
            return "[" + Names.canonicalSettingName(inner) + "]";
        }
        return Names.canonicalSettingName(name);
    }
}
