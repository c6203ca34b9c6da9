package ai.robot.tidy.transform;

import java.util.Objects;

/**
 * Result of formatting a single document.
 */
public record FormattingResult(String source, boolean changed, String text) {

    public FormattingResult {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(text, "text");
    }
}
