package ai.robot.tidy.transform.rules;

import ai.robot.tidy.model.Document;
import ai.robot.tidy.model.Node;
import ai.robot.tidy.model.Section;
import ai.robot.tidy.model.SectionKind;
import ai.robot.tidy.model.Statement;
import ai.robot.tidy.model.StatementKind;
import ai.robot.tidy.model.Token;
import ai.robot.tidy.model.TokenKind;
import ai.robot.tidy.transform.ModelVisitor;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Counts the assignment signs used in a document. The sign of a token is everything after its closing brace.
 */
final class AssignmentTypeDetector extends ModelVisitor {

    private final Map<String, Integer> counts = new LinkedHashMap<>();

    private AssignmentTypeDetector() {
    }

    /**
     * Most common sign, or empty when the document uses fewer than two distinct signs. Ties go to the
     * sign seen first.
     */
    static Optional<String> detect(Document document) {
        AssignmentTypeDetector detector = new AssignmentTypeDetector();
        detector.visitDocument(document);
        return detector.mostCommon();
    }

    static String signOf(String value) {
        return value.substring(value.indexOf('}') + 1);
    }

    @Override
    protected void visitSection(Section section) {
        if (section.sectionKind() != SectionKind.VARIABLES) {
            visitChildren(section);
            return;
        }
        for (Node child : section.body()) {
            if (child instanceof Statement statement && statement.statementKind() == StatementKind.VARIABLE) {
                statement.firstToken(TokenKind.VARIABLE).ifPresent(this::count);
            }
        }
    }

    @Override
    protected void visitStatement(Statement statement) {
        if (statement.statementKind() != StatementKind.KEYWORD_CALL) {
            return;
        }
        List<Token> assign = statement.tokensOf(TokenKind.ASSIGN);
        if (!assign.isEmpty()) {
            count(assign.get(assign.size() - 1));
        }
    }

    private void count(Token token) {
        counts.merge(signOf(token.value()), 1, Integer::sum);
    }

    private Optional<String> mostCommon() {
        if (counts.size() < 2) {
            return Optional.empty();
        }
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return Optional.ofNullable(best);
    }
}
