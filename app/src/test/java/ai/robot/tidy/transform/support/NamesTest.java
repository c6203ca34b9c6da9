package ai.robot.tidy.transform.support;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class NamesTest {

    @Test
    void normalizesKeywordNames() {
        assertThat(Names.normalize("Run Keyword If")).isEqualTo("runkeywordif");
        assertThat(Names.normalize("run_keyword_IF")).isEqualTo("runkeywordif");
    }

    @Test
    void titleCasesWordsAfterAnyNonLetter() {
        assertThat(Names.titleCase("suite SETUP")).isEqualTo("Suite Setup");
        assertThat(Names.titleCase("test-timeout")).isEqualTo("Test-Timeout");
    }

    @Test
    void canonicalSettingNameCollapsesWhitespace() {
        assertThat(Names.canonicalSettingName("  force \t tags ")).isEqualTo("Force Tags");
    }
}
