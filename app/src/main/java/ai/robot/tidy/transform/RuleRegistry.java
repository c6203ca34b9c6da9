package ai.robot.tidy.transform;

import ai.robot.tidy.transform.rules.AlignVariablesSection;
import ai.robot.tidy.transform.rules.AssignmentNormalizer;
import ai.robot.tidy.transform.rules.DiscardEmptySections;
import ai.robot.tidy.transform.rules.NormalizeNewLines;
import ai.robot.tidy.transform.rules.NormalizeSectionHeaderName;
import ai.robot.tidy.transform.rules.NormalizeSettingName;
import ai.robot.tidy.transform.rules.RemoveEmptySettings;
import ai.robot.tidy.transform.rules.ReplaceRunKeywordIf;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves rule names to factories and assembles pipelines. Construction of every rule happens here, so
 * parameter errors surface before any document is touched.
 */
public class RuleRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(RuleRegistry.class);

    private final Map<RuleKind, Function<RuleParameters, Rule>> factories;

    public RuleRegistry() {
        this(defaultFactories());
    }

    RuleRegistry(Map<RuleKind, Function<RuleParameters, Rule>> factories) {
        Objects.requireNonNull(factories, "factories");
        for (RuleKind kind : RuleKind.values()) {
            if (!factories.containsKey(kind)) {
                throw new IllegalStateException("No factory registered for " + kind.ruleName());
            }
        }
        this.factories = new EnumMap<>(factories);
    }

    private static Map<RuleKind, Function<RuleParameters, Rule>> defaultFactories() {
        Map<RuleKind, Function<RuleParameters, Rule>> factories = new EnumMap<>(RuleKind.class);
        factories.put(RuleKind.REMOVE_EMPTY_SETTINGS, RemoveEmptySettings::fromParameters);
        factories.put(RuleKind.DISCARD_EMPTY_SECTIONS, DiscardEmptySections::fromParameters);
        factories.put(RuleKind.REPLACE_RUN_KEYWORD_IF, ReplaceRunKeywordIf::fromParameters);
        factories.put(RuleKind.ASSIGNMENT_NORMALIZER, AssignmentNormalizer::fromParameters);
        factories.put(RuleKind.NORMALIZE_SETTING_NAME, NormalizeSettingName::fromParameters);
        factories.put(RuleKind.NORMALIZE_SECTION_HEADER_NAME, NormalizeSectionHeaderName::fromParameters);
        factories.put(RuleKind.ALIGN_VARIABLES_SECTION, AlignVariablesSection::fromParameters);
        factories.put(RuleKind.NORMALIZE_NEW_LINES, NormalizeNewLines::fromParameters);
        return factories;
    }

    public RuleKind lookup(String name) {
        return RuleKind.fromName(name)
                .orElseThrow(() -> ConfigurationException.unknownRule(name, RuleKind.ruleNames()));
    }

    public Rule create(RuleParameters parameters) {
        return factories.get(parameters.rule()).apply(parameters);
    }

    /**
     * Builds the pipeline for one run. With no explicit transforms every rule runs in default order;
     * otherwise exactly the listed rules run in the listed order. Parameters from {@code configure}
     * apply to the named rule wherever it runs, and inline parameters of a transform entry win over them.
     */
    public FormattingPipeline createPipeline(List<RuleSpec> transforms, List<RuleSpec> configure) {
        Map<RuleKind, Map<String, String>> configured = new EnumMap<>(RuleKind.class);
        for (RuleSpec spec : configure) {
            RuleKind kind = lookup(spec.ruleName());
            configured.computeIfAbsent(kind, ignored -> new LinkedHashMap<>()).putAll(spec.parameters());
        }

        List<RuleParameters> selected = new ArrayList<>();
        if (transforms.isEmpty()) {
            for (RuleKind kind : RuleKind.values()) {
                selected.add(new RuleParameters(kind, configured.getOrDefault(kind, Map.of())));
            }
        } else {
            for (RuleSpec spec : transforms) {
                RuleKind kind = lookup(spec.ruleName());
                Map<String, String> merged = new LinkedHashMap<>(configured.getOrDefault(kind, Map.of()));
                merged.putAll(spec.parameters());
                selected.add(new RuleParameters(kind, merged));
            }
        }

        List<ConfiguredRule> rules = new ArrayList<>();
        for (RuleParameters parameters : selected) {
            Rule rule = create(parameters);
            if (!parameters.isEnabled()) {
                LOGGER.debug("Rule {} disabled by configuration", parameters.rule().ruleName());
                continue;
            }
            rules.add(new ConfiguredRule(parameters.rule(), rule));
        }
        LOGGER.debug("Pipeline: {}", rules.stream().map(ConfiguredRule::name).toList());
        return new FormattingPipeline(rules);
    }
}
