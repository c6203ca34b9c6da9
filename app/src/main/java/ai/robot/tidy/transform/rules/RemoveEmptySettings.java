package ai.robot.tidy.transform.rules;

import ai.robot.tidy.config.FormattingContext;
import ai.robot.tidy.model.Document;
import ai.robot.tidy.model.Statement;
import ai.robot.tidy.model.Token;
import ai.robot.tidy.model.TokenKind;
import ai.robot.tidy.transform.ModelTransformer;
import ai.robot.tidy.transform.Rewrite;
import ai.robot.tidy.transform.Rule;
import ai.robot.tidy.transform.RuleParameters;
import ai.robot.tidy.transform.SelectionGuard;
import ai.robot.tidy.transform.support.Tokens;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deletes settings that carry no value. In {@code overwrite_ok} mode an empty local setting that overrides
 * a suite-level value is kept, because removing it would change behavior; with {@code more_explicit} it is
 * rewritten to {@code NONE}.
 */
public class RemoveEmptySettings implements Rule {

    static final String WORK_MODE = "work_mode";
    static final String MORE_EXPLICIT = "more_explicit";

    public enum WorkMode {
        OVERWRITE_OK,
        ALWAYS
    }

    private static final Map<String, WorkMode> WORK_MODES = workModes();

    private final WorkMode workMode;
    private final boolean moreExplicit;

    public RemoveEmptySettings(WorkMode workMode, boolean moreExplicit) {
        this.workMode = workMode;
        this.moreExplicit = moreExplicit;
    }

    public static RemoveEmptySettings fromParameters(RuleParameters parameters) {
        return new RemoveEmptySettings(
                parameters.getChoice(WORK_MODE, "overwrite_ok", WORK_MODES),
                parameters.getBoolean(MORE_EXPLICIT, true));
    }

    private static Map<String, WorkMode> workModes() {
        Map<String, WorkMode> modes = new LinkedHashMap<>();
        modes.put("overwrite_ok", WorkMode.OVERWRITE_OK);
        modes.put("always", WorkMode.ALWAYS);
        return modes;
    }

    @Override
    public void apply(Document document, FormattingContext context) {
        Set<TokenKind> overridden = workMode == WorkMode.OVERWRITE_OK
                ? SuiteSettingsFinder.find(document)
                : EnumSet.noneOf(TokenKind.class);
        new Remover(overridden).apply(document, context);
    }

    private final class Remover extends ModelTransformer {

        private final Set<TokenKind> overridden;

        private Remover(Set<TokenKind> overridden) {
            this.overridden = overridden;
        }

        @Override
        protected Rewrite visitStatement(Statement statement, FormattingContext context) {
            if (statement.settingKind().isEmpty() || statement.dataTokens().size() != 1) {
                return Rewrite.keep();
            }
            return SelectionGuard.guard(statement, context, () -> {
                TokenKind kind = statement.settingKind().get();
                if (workMode == WorkMode.ALWAYS || !overridden.contains(kind)) {
                    return Rewrite.delete();
                }
                if (moreExplicit) {
                    statement.replaceTokens(explicitNone(statement, context));
                }
                return Rewrite.keep();
            });
        }

        private List<Token> explicitNone(Statement statement, FormattingContext context) {
            int line = statement.lineNumber();
            Token setting = statement.dataTokens().get(0);
            List<Token> tokens = new ArrayList<>(Tokens.indentation(Tokens.indentOf(statement), line));
            tokens.add(setting);
            tokens.add(Tokens.separator(context.separator(), line));
            tokens.add(Token.at(TokenKind.ARGUMENT, "NONE", line));
            tokens.add(Tokens.eol(context, line));
            return tokens;
        }
    }
}
