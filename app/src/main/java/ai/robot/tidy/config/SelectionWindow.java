package ai.robot.tidy.config;

import java.util.Optional;

/**
 * Optional line range restricting which nodes a run may modify. Either bound may be open.
 */
public record SelectionWindow(Optional<Integer> startLine, Optional<Integer> endLine) {

    public SelectionWindow {
        startLine = startLine == null ? Optional.empty() : startLine;
        endLine = endLine == null ? Optional.empty() : endLine;
        startLine.ifPresent(value -> requirePositive(value, "startLine"));
        endLine.ifPresent(value -> requirePositive(value, "endLine"));
        if (startLine.isPresent() && endLine.isPresent() && startLine.get() > endLine.get()) {
            throw new IllegalArgumentException("startLine must not be greater than endLine");
        }
    }

    public static SelectionWindow of(int startLine, int endLine) {
        return new SelectionWindow(Optional.of(startLine), Optional.of(endLine));
    }

    public static Optional<SelectionWindow> from(Integer startLine, Integer endLine) {
        if (startLine == null && endLine == null) {
            return Optional.empty();
        }
        return Optional.of(new SelectionWindow(Optional.ofNullable(startLine), Optional.ofNullable(endLine)));
    }

    /**
     * True when the span lies entirely before the start or entirely after the end of the window.
     */
    public boolean excludes(int firstLine, int lastLine) {
        if (startLine.isPresent() && startLine.get() > lastLine) {
            return true;
        }
        return endLine.isPresent() && endLine.get() < firstLine;
    }

    private static void requirePositive(int value, String fieldName) {
        if (value < 1) {
            throw new IllegalArgumentException(fieldName + " must be at least 1");
        }
    }
}
