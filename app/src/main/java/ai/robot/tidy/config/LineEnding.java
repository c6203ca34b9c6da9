package ai.robot.tidy.config;

/**
 * Line terminator used for every end-of-line token created by rules.
 */
public enum LineEnding {
    NATIVE(System.lineSeparator()),
    UNIX("\n"),
    WINDOWS("\r\n");

    private final String value;

    LineEnding(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static LineEnding from(String raw) {
        if (raw == null || raw.isBlank()) {
            return NATIVE;
        }
        for (LineEnding ending : values()) {
            if (ending.name().equalsIgnoreCase(raw.trim())) {
                return ending;
            }
        }
        throw new IllegalArgumentException("Unsupported line separator: " + raw + " (expected native, unix or windows)");
    }
}
