package ai.robot.tidy.transform.rules;

import ai.robot.tidy.config.FormattingContext;
import ai.robot.tidy.model.Document;
import ai.robot.tidy.model.RobotSource;
import ai.robot.tidy.transform.Rule;
import ai.robot.tidy.writer.DocumentRenderer;

final class RuleHarness {

    private static final DocumentRenderer RENDERER = new DocumentRenderer();

    private RuleHarness() {
    }

    static String format(Rule rule, String source) {
        return format(rule, source, FormattingContext.defaults());
    }

    static String format(Rule rule, String source, FormattingContext context) {
        Document document = RobotSource.parse(source);
        rule.apply(document, context);
        return RENDERER.render(document);
    }

    static String render(Document document) {
        return RENDERER.render(document);
    }
}
