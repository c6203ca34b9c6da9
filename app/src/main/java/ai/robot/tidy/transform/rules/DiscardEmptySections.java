package ai.robot.tidy.transform.rules;

import ai.robot.tidy.config.FormattingContext;
import ai.robot.tidy.model.Node;
import ai.robot.tidy.model.Section;
import ai.robot.tidy.model.SectionKind;
import ai.robot.tidy.model.StatementKind;
import ai.robot.tidy.transform.ModelTransformer;
import ai.robot.tidy.transform.Rewrite;
import ai.robot.tidy.transform.RuleParameters;
import ai.robot.tidy.transform.SelectionGuard;

/**
 * Deletes sections whose body holds nothing but blank lines. With {@code allow_only_comments=False},
 * comment lines do not keep a section alive either, except in the comments section itself.
 */
public class DiscardEmptySections extends ModelTransformer {

    static final String ALLOW_ONLY_COMMENTS = "allow_only_comments";

    private final boolean allowOnlyComments;

    public DiscardEmptySections(boolean allowOnlyComments) {
        this.allowOnlyComments = allowOnlyComments;
    }

    public static DiscardEmptySections fromParameters(RuleParameters parameters) {
        return new DiscardEmptySections(parameters.getBoolean(ALLOW_ONLY_COMMENTS, true));
    }

    @Override
    protected Rewrite visitSection(Section section, FormattingContext context) {
        return SelectionGuard.guard(section, context,
                () -> isEmpty(section) ? Rewrite.delete() : Rewrite.keep());
    }

    private boolean isEmpty(Section section) {
        boolean commentsAreEmpty = !allowOnlyComments && section.sectionKind() != SectionKind.COMMENTS;
        for (Node child : section.body()) {
            if (child.isStatement(StatementKind.EMPTY_LINE)) {
                continue;
            }
            if (commentsAreEmpty && child.isStatement(StatementKind.COMMENT)) {
                continue;
            }
            return false;
        }
        return true;
    }
}
