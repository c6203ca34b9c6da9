package ai.robot.tidy.transform;

import ai.robot.tidy.config.FormattingContext;
import ai.robot.tidy.model.Document;
import ai.robot.tidy.writer.DocumentRenderer;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Ordered list of rules applied to one document at a time. Each rule sees the tree as left by the previous one.
 */
public class FormattingPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(FormattingPipeline.class);
    static final String MDC_DOCUMENT = "document";
    static final String MDC_RULE = "rule";

    private final List<ConfiguredRule> rules;
    private final DocumentRenderer renderer;

    public FormattingPipeline(List<ConfiguredRule> rules) {
        this(rules, new DocumentRenderer());
    }

    public FormattingPipeline(List<ConfiguredRule> rules, DocumentRenderer renderer) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    public List<ConfiguredRule> rules() {
        return rules;
    }

    public List<String> ruleNames() {
        return rules.stream().map(ConfiguredRule::name).toList();
    }

    /**
     * Runs every rule over {@code document}, mutating it in place.
     *
     * @throws FormattingException when a rule fails; the document may be partially rewritten
     */
    public FormattingResult format(Document document, FormattingContext context) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(context, "context");
        String before = renderer.render(document);
        MDC.put(MDC_DOCUMENT, document.source());
        try {
            for (ConfiguredRule rule : rules) {
                MDC.put(MDC_RULE, rule.name());
                LOGGER.debug("Applying {} to {}", rule.name(), document.source());
                try {
                    rule.rule().apply(document, context);
                } catch (RuntimeException ex) {
                    throw new FormattingException("Rule " + rule.name() + " failed on " + document.source()
                            + ": " + ex.getMessage(), ex);
                }
            }
        } finally {
            MDC.remove(MDC_RULE);
            MDC.remove(MDC_DOCUMENT);
        }
        String after = renderer.render(document);
        return new FormattingResult(document.source(), !before.equals(after), after);
    }
}
