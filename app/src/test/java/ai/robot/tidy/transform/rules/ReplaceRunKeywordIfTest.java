package ai.robot.tidy.transform.rules;

import static org.assertj.core.api.Assertions.assertThat;

import ai.robot.tidy.config.FormattingContext;
import ai.robot.tidy.config.SelectionWindow;
import ai.robot.tidy.model.Document;
import ai.robot.tidy.model.IfBlock;
import ai.robot.tidy.model.Keyword;
import ai.robot.tidy.model.RobotSource;
import ai.robot.tidy.model.Section;
import ai.robot.tidy.model.TestCase;
import org.junit.jupiter.api.Test;

class ReplaceRunKeywordIfTest {

    private final ReplaceRunKeywordIf rule = new ReplaceRunKeywordIf();

    @Test
    void replacesCallWithIfElseIfElseBlock() {
        String formatted = RuleHarness.format(rule, """
                *** Test Cases ***
                Test
                    Run Keyword If    ${cond}    Log    a    ELSE IF    ${other}    Log    b    ELSE    Log    c
                """);

        assertThat(formatted).isEqualTo("""
                *** Test Cases ***
                Test
                    IF    ${cond}
                        Log    a
                    ELSE IF    ${other}
                        Log    b
                    ELSE
                        Log    c
                    END
                """);
    }

    @Test
    void createsOneBranchPerDelimiter() {
        Document document = RobotSource.parse("""
                *** Keywords ***
                Kw
                    Run Keyword If    ${a}    A    ELSE IF    ${b}    B    ELSE IF    ${c}    C    ELSE    D
                """);

        rule.apply(document, FormattingContext.defaults());

        Section section = document.sections().get(0);
        IfBlock ifBlock = (IfBlock) ((Keyword) section.body().get(0)).body().get(0);
        assertThat(ifBlock.branchCount()).isEqualTo(4);
        assertThat(ifBlock.end()).isPresent();
        assertThat(ifBlock.orElse().orElseThrow().end()).isEmpty();
    }

    @Test
    void copiesAssignmentsToEveryBranch() {
        String formatted = RuleHarness.format(rule, """
                *** Test Cases ***
                Test
                    ${var}    Run Keyword If    ${cond}    Set Variable    1    ELSE    Set Variable    2
                """);

        assertThat(formatted).isEqualTo("""
                *** Test Cases ***
                Test
                    IF    ${cond}
                        ${var}    Set Variable    1
                    ELSE
                        ${var}    Set Variable    2
                    END
                """);
    }

    @Test
    void splitsRunKeywordsOnAnd() {
        String formatted = RuleHarness.format(rule, """
                *** Test Cases ***
                Test
                    run_keyword_if    ${cond}    Run Keywords    First    arg    AND    Second
                """);

        assertThat(formatted).isEqualTo("""
                *** Test Cases ***
                Test
                    IF    ${cond}
                        First    arg
                        Second
                    END
                """);
    }

    @Test
    void rewritesNestedCallsInSamePass() {
        String formatted = RuleHarness.format(rule, """
                *** Test Cases ***
                Test
                    Run Keyword If    ${a}    Run Keyword If    ${b}    Log    x
                """);

        assertThat(formatted).isEqualTo("""
                *** Test Cases ***
                Test
                    IF    ${a}
                        IF    ${b}
                            Log    x
                        END
                    END
                """);
    }

    @Test
    void leavesMalformedCallsUnchanged() {
        String source = """
                *** Test Cases ***
                Test
                    Run Keyword If    ${cond}
                    Run Keyword If    ${cond}    ELSE    Log    a
                    Run Keyword If    ${c}    A    ELSE    B    ELSE IF    ${d}    C
                    Run Keyword If    ${c}    Run Keywords    A    AND
                    Log    unrelated
                """;

        assertThat(RuleHarness.format(rule, source)).isEqualTo(source);
    }

    @Test
    void skipsCallsOutsideSelection() {
        String source = """
                *** Test Cases ***
                Test
                    Run Keyword If    ${a}    Log    a
                    Run Keyword If    ${b}    Log    b
                """;
        FormattingContext context = FormattingContext.defaults().withSelection(SelectionWindow.of(4, 4));

        String formatted = RuleHarness.format(rule, source, context);

        assertThat(formatted).isEqualTo("""
                *** Test Cases ***
                Test
                    Run Keyword If    ${a}    Log    a
                    IF    ${b}
                        Log    b
                    END
                """);
    }

    @Test
    void usesConfiguredSeparatorWidth() {
        String formatted = RuleHarness.format(rule, """
                *** Test Cases ***
                Test
                  Run Keyword If  ${a}  Log  a
                """, FormattingContext.defaults().withSpaceCount(2));

        assertThat(formatted).isEqualTo("""
                *** Test Cases ***
                Test
                  IF  ${a}
                    Log  a
                  END
                """);
    }

    @Test
    void isIdempotent() {
        String once = RuleHarness.format(rule, """
                *** Test Cases ***
                Test
                    Run Keyword If    ${a}    A    ELSE    B
                """);

        assertThat(RuleHarness.format(rule, once)).isEqualTo(once);
        assertThat(((TestCase) RobotSource.parse(once).sections().get(0).body().get(0)).body()).hasSize(1);
    }
}
