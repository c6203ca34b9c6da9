package ai.robot.tidy.transform.rules;

import ai.robot.tidy.config.FormattingContext;
import ai.robot.tidy.model.Block;
import ai.robot.tidy.model.Document;
import ai.robot.tidy.model.Keyword;
import ai.robot.tidy.model.Section;
import ai.robot.tidy.model.TestCase;
import ai.robot.tidy.transform.ModelTransformer;
import ai.robot.tidy.transform.Rewrite;
import ai.robot.tidy.transform.Rule;
import ai.robot.tidy.transform.RuleParameters;
import ai.robot.tidy.transform.SelectionGuard;
import ai.robot.tidy.transform.support.BlankLines;

/**
 * Normalizes blank lines: none at the start or end of any section, test case or keyword, then a fixed
 * number after each of them. The last section of the document ends with exactly one blank line and the last
 * test case or keyword of a section gets none. Test cases of a templated suite are not separated unless
 * {@code separate_templated_tests} is set.
 */
public class NormalizeNewLines implements Rule {

    static final String SECTION_LINES = "section_lines";
    static final String TEST_CASE_LINES = "test_case_lines";
    static final String KEYWORD_LINES = "keyword_lines";
    static final String SEPARATE_TEMPLATED_TESTS = "separate_templated_tests";

    private final int sectionLines;
    private final int testCaseLines;
    private final int keywordLines;
    private final boolean separateTemplatedTests;

    public NormalizeNewLines(int sectionLines, int testCaseLines, int keywordLines, boolean separateTemplatedTests) {
        this.sectionLines = sectionLines;
        this.testCaseLines = testCaseLines;
        this.keywordLines = keywordLines;
        this.separateTemplatedTests = separateTemplatedTests;
    }

    public static NormalizeNewLines fromParameters(RuleParameters parameters) {
        int testCaseLines = parameters.getInt(TEST_CASE_LINES, 1, 0);
        return new NormalizeNewLines(
                parameters.getInt(SECTION_LINES, 1, 0),
                testCaseLines,
                parameters.getOptionalInt(KEYWORD_LINES, 0).orElse(testCaseLines),
                parameters.getBoolean(SEPARATE_TEMPLATED_TESTS, false));
    }

    @Override
    public void apply(Document document, FormattingContext context) {
        new Spacer(NewLinesLayout.scan(document, separateTemplatedTests)).apply(document, context);
    }

    private final class Spacer extends ModelTransformer {

        private final NewLinesLayout layout;

        private Spacer(NewLinesLayout layout) {
            this.layout = layout;
        }

        @Override
        protected Rewrite visitSection(Section section, FormattingContext context) {
            if (!SelectionGuard.outsideSelection(section, context)) {
                BlankLines.trim(section.body());
                BlankLines.append(section.body(), layout.isLastSection(section) ? 1 : sectionLines, context);
            }
            visitChildren(section, context);
            return Rewrite.keep();
        }

        @Override
        protected Rewrite visitTestCase(TestCase testCase, FormattingContext context) {
            return space(testCase, layout.templated() ? 0 : testCaseLines, context);
        }

        @Override
        protected Rewrite visitKeyword(Keyword keyword, FormattingContext context) {
            return space(keyword, keywordLines, context);
        }

        private Rewrite space(Block block, int lines, FormattingContext context) {
            return SelectionGuard.guard(block, context, () -> {
                BlankLines.trim(block.body());
                if (!layout.isLastInSection(block)) {
                    BlankLines.append(block.body(), lines, context);
                }
                return Rewrite.keep();
            });
        }
    }
}
