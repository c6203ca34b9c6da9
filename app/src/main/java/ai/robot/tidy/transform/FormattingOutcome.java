package ai.robot.tidy.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Aggregate of formatting results for a batch run.
 */
public record FormattingOutcome(List<FormattingResult> results, List<String> failedDocuments) {

    public FormattingOutcome {
        results = List.copyOf(Objects.requireNonNull(results, "results"));
        failedDocuments = List.copyOf(Objects.requireNonNull(failedDocuments, "failedDocuments"));
    }

    public List<String> changedDocuments() {
        List<String> changed = new ArrayList<>();
        for (FormattingResult result : results) {
            if (result.changed()) {
                changed.add(result.source());
            }
        }
        return changed;
    }

    public boolean anyChanged() {
        return results.stream().anyMatch(FormattingResult::changed);
    }
}
