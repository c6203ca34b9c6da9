package ai.robot.tidy.transform.rules;

import static org.assertj.core.api.Assertions.assertThat;

import ai.robot.tidy.config.FormattingContext;
import ai.robot.tidy.config.LineEnding;
import ai.robot.tidy.config.SelectionWindow;
import ai.robot.tidy.transform.RuleKind;
import ai.robot.tidy.transform.RuleParameters;
import ai.robot.tidy.transform.rules.RemoveEmptySettings.WorkMode;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RemoveEmptySettingsTest {

    private static final String SOURCE = """
            *** Settings ***
            Test Setup    Open
            Test Timeout
            Suite Setup

            *** Test Cases ***
            Test
                [Setup]
                [Timeout]
                [Tags]
                No Operation
            """;

    @Test
    void makesOverridesOfSuiteSettingsExplicit() {
        String formatted = RuleHarness.format(new RemoveEmptySettings(WorkMode.OVERWRITE_OK, true), SOURCE);

        assertThat(formatted).isEqualTo("""
                *** Settings ***
                Test Setup    Open

                *** Test Cases ***
                Test
                    [Setup]    NONE
                    No Operation
                """);
    }

    @Test
    void keepsOverridesAsWrittenWithoutMoreExplicit() {
        String formatted = RuleHarness.format(new RemoveEmptySettings(WorkMode.OVERWRITE_OK, false), SOURCE);

        assertThat(formatted).isEqualTo("""
                *** Settings ***
                Test Setup    Open

                *** Test Cases ***
                Test
                    [Setup]
                    No Operation
                """);
    }

    @Test
    void removesEveryEmptySettingInAlwaysMode() {
        String formatted = RuleHarness.format(new RemoveEmptySettings(WorkMode.ALWAYS, true), SOURCE);

        assertThat(formatted).isEqualTo("""
                *** Settings ***
                Test Setup    Open

                *** Test Cases ***
                Test
                    No Operation
                """);
    }

    @Test
    void usesConfiguredLineEndingForRewrittenSetting() {
        FormattingContext context = new FormattingContext(2, LineEnding.WINDOWS, Optional.empty());

        String formatted = RuleHarness.format(new RemoveEmptySettings(WorkMode.OVERWRITE_OK, true), """
                *** Settings ***
                Default Tags    smoke

                *** Keywords ***
                Kw
                  [Tags]
                  No Operation
                """, context);

        assertThat(formatted).contains("  [Tags]  NONE\r\n");
    }

    @Test
    void leavesSettingsOutsideSelection() {
        FormattingContext context = FormattingContext.defaults().withSelection(SelectionWindow.of(6, 11));

        String formatted = RuleHarness.format(new RemoveEmptySettings(WorkMode.OVERWRITE_OK, true), SOURCE, context);

        assertThat(formatted).startsWith("""
                *** Settings ***
                Test Setup    Open
                Test Timeout
                Suite Setup
                """);
        assertThat(formatted).contains("[Setup]    NONE").doesNotContain("[Timeout]", "[Tags]");
    }

    @Test
    void isIdempotent() {
        RemoveEmptySettings rule = RemoveEmptySettings.fromParameters(RuleParameters.defaults(RuleKind.REMOVE_EMPTY_SETTINGS));
        String once = RuleHarness.format(rule, SOURCE);

        assertThat(RuleHarness.format(rule, once)).isEqualTo(once);
    }

    @Test
    void readsWorkModeParameter() {
        RuleParameters parameters = new RuleParameters(RuleKind.REMOVE_EMPTY_SETTINGS,
                Map.of(RemoveEmptySettings.WORK_MODE, "always"));

        String formatted = RuleHarness.format(RemoveEmptySettings.fromParameters(parameters), SOURCE);

        assertThat(formatted).doesNotContain("[Setup]");
    }

    @Test
    void emptyTimeoutOverridingSuiteTimeoutBecomesNone() {
        String formatted = RuleHarness.format(new RemoveEmptySettings(WorkMode.OVERWRITE_OK, true), """
                *** Settings ***
                Test Timeout    1 min

                *** Test Cases ***
                Test
                    [Timeout]
                    No Operation
                """);

        assertThat(formatted).isEqualTo("""
                *** Settings ***
                Test Timeout    1 min

                *** Test Cases ***
                Test
                    [Timeout]    NONE
                    No Operation
                """);
    }

    @Test
    void emptyTimeoutWithoutSuiteTimeoutIsRemoved() {
        String formatted = RuleHarness.format(new RemoveEmptySettings(WorkMode.OVERWRITE_OK, true), """
                *** Settings ***
                Documentation    Suite

                *** Test Cases ***
                Test
                    [Timeout]
                    No Operation
                """);

        assertThat(formatted).isEqualTo("""
                *** Settings ***
                Documentation    Suite

                *** Test Cases ***
                Test
                    No Operation
                """);
    }
}
