package ai.robot.tidy.transform.rules;

import ai.robot.tidy.model.Document;
import ai.robot.tidy.model.Section;
import ai.robot.tidy.model.SectionKind;
import ai.robot.tidy.model.Statement;
import ai.robot.tidy.model.Token;
import ai.robot.tidy.model.TokenKind;
import ai.robot.tidy.transform.ModelVisitor;
import java.util.List;

/**
 * Detects a suite-level {@code Test Template} with a keyword name.
 */
final class TestTemplateFinder extends ModelVisitor {

    private boolean templated;

    private TestTemplateFinder() {
    }

    static boolean isTemplated(Document document) {
        TestTemplateFinder finder = new TestTemplateFinder();
        finder.visitDocument(document);
        return finder.templated;
    }

    @Override
    protected void visitSection(Section section) {
        if (section.sectionKind() == SectionKind.SETTINGS) {
            visitChildren(section);
        }
    }

    @Override
    protected void visitStatement(Statement statement) {
        if (statement.settingKind().filter(kind -> kind == TokenKind.TEST_TEMPLATE).isEmpty()) {
            return;
        }
        List<Token> data = statement.dataTokens();
        for (Token token : data.subList(1, data.size())) {
            if (!token.value().isBlank()) {
                templated = true;
                return;
            }
        }
    }
}
