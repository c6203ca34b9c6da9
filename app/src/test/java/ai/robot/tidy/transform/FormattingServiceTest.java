package ai.robot.tidy.transform;

import static org.assertj.core.api.Assertions.assertThat;

import ai.robot.tidy.config.FormattingContext;
import ai.robot.tidy.model.Document;
import ai.robot.tidy.model.RobotSource;
import ai.robot.tidy.transform.rules.NormalizeSectionHeaderName;
import java.util.List;
import org.junit.jupiter.api.Test;

class FormattingServiceTest {

    @Test
    void returnsEmptyOutcomeForNoDocuments() {
        FormattingService service = new FormattingService(new FormattingPipeline(List.of()), FormattingContext.defaults());

        FormattingOutcome outcome = service.formatAll(List.of());

        assertThat(outcome.results()).isEmpty();
        assertThat(outcome.failedDocuments()).isEmpty();
        assertThat(outcome.anyChanged()).isFalse();
    }

    @Test
    void recordsChangedDocuments() {
        FormattingPipeline pipeline = new FormattingPipeline(List.of(
                new ConfiguredRule(RuleKind.NORMALIZE_SECTION_HEADER_NAME, new NormalizeSectionHeaderName(false))));
        FormattingService service = new FormattingService(pipeline, FormattingContext.defaults());

        FormattingOutcome outcome = service.formatAll(List.of(
                RobotSource.parse("a.robot", "*** test cases ***\nTest\n    Log    1\n"),
                RobotSource.parse("b.robot", "*** Test Cases ***\nTest\n    Log    1\n")));

        assertThat(outcome.results()).hasSize(2);
        assertThat(outcome.changedDocuments()).containsExactly("a.robot");
        assertThat(outcome.anyChanged()).isTrue();
    }

    @Test
    void continuesAfterFailingDocument() {
        FormattingPipeline pipeline = new FormattingPipeline(List.of(
                new ConfiguredRule(RuleKind.DISCARD_EMPTY_SECTIONS, (document, context) -> {
                    if (document.source().equals("bad.robot")) {
                        throw new IllegalArgumentException("unexpected token");
                    }
                })));
        FormattingService service = new FormattingService(pipeline, FormattingContext.defaults());
        Document good = RobotSource.parse("good.robot", "*** Keywords ***\n");
        Document bad = RobotSource.parse("bad.robot", "*** Keywords ***\n");

        FormattingOutcome outcome = service.formatAll(List.of(bad, good));

        assertThat(outcome.failedDocuments()).containsExactly("bad.robot");
        assertThat(outcome.results()).extracting(FormattingResult::source).containsExactly("good.robot");
    }
}
