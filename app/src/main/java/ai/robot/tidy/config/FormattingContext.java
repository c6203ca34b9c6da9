package ai.robot.tidy.config;

import java.util.Objects;
import java.util.Optional;

/**
 * Read-only formatting settings shared by every rule of a run.
 */
public record FormattingContext(int spaceCount, LineEnding lineEnding, Optional<SelectionWindow> selection) {

    public static final int DEFAULT_SPACE_COUNT = 4;

    public FormattingContext {
        if (spaceCount < 1) {
            throw new IllegalArgumentException("spaceCount must be at least 1");
        }
        lineEnding = Objects.requireNonNull(lineEnding, "lineEnding");
        selection = selection == null ? Optional.empty() : selection;
    }

    public static FormattingContext defaults() {
        return new FormattingContext(DEFAULT_SPACE_COUNT, LineEnding.UNIX, Optional.empty());
    }

    public FormattingContext withSelection(SelectionWindow window) {
        return new FormattingContext(spaceCount, lineEnding, Optional.of(window));
    }

    public FormattingContext withSpaceCount(int newSpaceCount) {
        return new FormattingContext(newSpaceCount, lineEnding, selection);
    }

    /**
     * Default separator between two data cells.
     */
    public String separator() {
        return " ".repeat(spaceCount);
    }

    public String eol() {
        return lineEnding.value();
    }
}
