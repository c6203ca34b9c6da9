package ai.robot.tidy.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Every rule known to the registry. Declaration order is the default pipeline order.
 */
public enum RuleKind {
    REMOVE_EMPTY_SETTINGS("RemoveEmptySettings",
            "Removes settings without a value. Empty overrides of suite settings are kept, or made explicit with NONE.",
            ParameterSpec.of("work_mode", "overwrite_ok",
                    "overwrite_ok keeps empty local settings that override a suite setting; always removes them too"),
            ParameterSpec.of("more_explicit", "True", "Replaces a kept empty override with an explicit NONE value")),
    DISCARD_EMPTY_SECTIONS("DiscardEmptySections",
            "Removes sections that contain only blank lines (and optionally comments).",
            ParameterSpec.of("allow_only_comments", "True", "Keeps sections whose only content is comments")),
    REPLACE_RUN_KEYWORD_IF("ReplaceRunKeywordIf",
            "Replaces Run Keyword If calls with native IF / ELSE IF / ELSE / END blocks."),
    ASSIGNMENT_NORMALIZER("AssignmentNormalizer",
            "Normalizes the equal sign after assigned variables and variable section entries.",
            ParameterSpec.of("equal_sign_type", "autodetect",
                    "One of autodetect, remove, equal_sign, space_and_equal_sign")),
    NORMALIZE_SETTING_NAME("NormalizeSettingName",
            "Collapses whitespace in setting names and title-cases them."),
    NORMALIZE_SECTION_HEADER_NAME("NormalizeSectionHeaderName",
            "Rewrites section headers to their canonical *** Name *** form.",
            ParameterSpec.of("uppercase", "False", "Upper-cases the canonical header name")),
    ALIGN_VARIABLES_SECTION("AlignVariablesSection",
            "Aligns the columns of the variables section.",
            ParameterSpec.of("up_to_column", "2", "Number of aligned columns, 0 aligns every column"),
            ParameterSpec.of("skip_types", "", "Comma separated variable types left untouched: scalar, list, dict"),
            ParameterSpec.of("min_width", "0", "Fixed column width, 0 derives widths from the longest token")),
    NORMALIZE_NEW_LINES("NormalizeNewLines",
            "Normalizes blank lines between sections, test cases and keywords.",
            ParameterSpec.of("section_lines", "1", "Blank lines after every section but the last"),
            ParameterSpec.of("test_case_lines", "1", "Blank lines after every test case but the last of a section"),
            ParameterSpec.of("keyword_lines", "", "Blank lines after every keyword but the last, defaults to test_case_lines"),
            ParameterSpec.of("separate_templated_tests", "False", "Separates test cases of templated suites too"));

    /**
     * Parameter accepted by every rule.
     */
    public static final String ENABLED = "enabled";

    private final String ruleName;
    private final String description;
    private final List<ParameterSpec> parameters;

    RuleKind(String ruleName, String description, ParameterSpec... parameters) {
        this.ruleName = ruleName;
        this.description = description;
        this.parameters = List.of(parameters);
    }

    public String ruleName() {
        return ruleName;
    }

    public String description() {
        return description;
    }

    public List<ParameterSpec> parameters() {
        return parameters;
    }

    public List<String> parameterNames() {
        List<String> names = new ArrayList<>(parameters.size() + 1);
        names.add(ENABLED);
        for (ParameterSpec parameter : parameters) {
            names.add(parameter.name());
        }
        return names;
    }

    public boolean accepts(String parameter) {
        return parameterNames().contains(parameter);
    }

    public static Optional<RuleKind> fromName(String name) {
        for (RuleKind kind : values()) {
            if (kind.ruleName.equals(name)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    public static List<String> ruleNames() {
        List<String> names = new ArrayList<>();
        for (RuleKind kind : values()) {
            names.add(kind.ruleName);
        }
        return names;
    }
}
