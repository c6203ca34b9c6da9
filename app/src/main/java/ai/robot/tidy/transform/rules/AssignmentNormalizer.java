package ai.robot.tidy.transform.rules;

import ai.robot.tidy.config.FormattingContext;
import ai.robot.tidy.model.Document;
import ai.robot.tidy.model.Node;
import ai.robot.tidy.model.Section;
import ai.robot.tidy.model.SectionKind;
import ai.robot.tidy.model.Statement;
import ai.robot.tidy.model.StatementKind;
import ai.robot.tidy.model.Token;
import ai.robot.tidy.model.TokenKind;
import ai.robot.tidy.transform.ModelTransformer;
import ai.robot.tidy.transform.Rewrite;
import ai.robot.tidy.transform.Rule;
import ai.robot.tidy.transform.RuleParameters;
import ai.robot.tidy.transform.SelectionGuard;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gives every assignment the same trailing sign: the last assigned variable of a keyword call and the
 * name of each variable section entry. In autodetect mode the most common sign of the document wins,
 * and a document using a single sign is left alone.
 */
public class AssignmentNormalizer implements Rule {

    private static final Logger LOGGER = LoggerFactory.getLogger(AssignmentNormalizer.class);
    static final String EQUAL_SIGN_TYPE = "equal_sign_type";
    private static final Pattern TRAILING_SIGN = Pattern.compile("\\s?=$");
    private static final Map<String, Optional<String>> STYLES = styles();

    private final Optional<String> style;

    /**
     * @param style sign to append after the closing brace, or empty to autodetect per document
     */
    public AssignmentNormalizer(Optional<String> style) {
        this.style = style;
    }

    public static AssignmentNormalizer fromParameters(RuleParameters parameters) {
        return new AssignmentNormalizer(parameters.getChoice(EQUAL_SIGN_TYPE, "autodetect", STYLES));
    }

    private static Map<String, Optional<String>> styles() {
        Map<String, Optional<String>> styles = new LinkedHashMap<>();
        styles.put("autodetect", Optional.empty());
        styles.put("remove", Optional.of(""));
        styles.put("equal_sign", Optional.of("="));
        styles.put("space_and_equal_sign", Optional.of(" ="));
        return styles;
    }

    @Override
    public void apply(Document document, FormattingContext context) {
        Optional<String> target = style.isPresent() ? style : AssignmentTypeDetector.detect(document);
        if (target.isEmpty()) {
            LOGGER.debug("Assignment style of {} is already consistent", document.source());
            return;
        }
        new SignWriter(target.get()).apply(document, context);
    }

    static String normalize(String value, String sign) {
        return TRAILING_SIGN.matcher(value).replaceFirst("") + sign;
    }

    private static final class SignWriter extends ModelTransformer {

        private final String sign;

        private SignWriter(String sign) {
            this.sign = sign;
        }

        @Override
        protected Rewrite visitSection(Section section, FormattingContext context) {
            if (section.sectionKind() != SectionKind.VARIABLES) {
                return super.visitSection(section, context);
            }
            for (Node child : section.body()) {
                if (child instanceof Statement statement
                        && statement.statementKind() == StatementKind.VARIABLE
                        && !SelectionGuard.outsideSelection(statement, context)) {
                    statement.firstToken(TokenKind.VARIABLE).ifPresent(this::rewrite);
                }
            }
            return Rewrite.keep();
        }

        @Override
        protected Rewrite visitStatement(Statement statement, FormattingContext context) {
            if (statement.statementKind() != StatementKind.KEYWORD_CALL) {
                return Rewrite.keep();
            }
            return SelectionGuard.guard(statement, context, () -> {
                List<Token> assign = statement.tokensOf(TokenKind.ASSIGN);
                if (!assign.isEmpty()) {
                    rewrite(assign.get(assign.size() - 1));
                }
                return Rewrite.keep();
            });
        }

        private void rewrite(Token token) {
            token.setValue(normalize(token.value(), sign));
        }
    }
}
