package ai.robot.tidy.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.LayoutBase;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.TreeMap;

/**
 * One JSON object per event. MDC entries ({@code document}, {@code rule}) become top-level fields.
 */
public class SimpleJsonLayout extends LayoutBase<ILoggingEvent> {

    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    @Override
    public String doLayout(ILoggingEvent event) {
        StringBuilder builder = new StringBuilder(256);
        builder.append('{');
        appendField(builder, "timestamp", ISO_FORMATTER.format(Instant.ofEpochMilli(event.getTimeStamp()).atOffset(ZoneOffset.UTC)));
        builder.append(',');
        appendField(builder, "level", event.getLevel().toString());
        builder.append(',');
        appendField(builder, "logger", event.getLoggerName());
        builder.append(',');
        appendField(builder, "message", event.getFormattedMessage());

        for (Map.Entry<String, String> entry : sortedMdc(event).entrySet()) {
            builder.append(',');
            appendField(builder, entry.getKey(), entry.getValue());
        }

        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            builder.append(',');
            appendField(builder, "error", throwable.getClassName() + ": " + throwable.getMessage());
        }

        builder.append('}');
        builder.append(System.lineSeparator());
        return builder.toString();
    }

    private void appendField(StringBuilder builder, String name, String value) {
        builder.append(quote(name)).append(':').append(quote(value));
    }

    private Map<String, String> sortedMdc(ILoggingEvent event) {
        Map<String, String> map = event.getMDCPropertyMap();
        return map == null ? Map.of() : new TreeMap<>(map);
    }

    static String quote(String value) {
        if (value == null) {
            return "null";
        }
        StringBuilder escaped = new StringBuilder(value.length() + 16);
        escaped.append('"');
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '\\' -> escaped.append("\\\\");
                case '"' -> escaped.append("\\\"");
                case '\n' -> escaped.append("\\n");
                case '\r' -> escaped.append("\\r");
                case '\t' -> escaped.append("\\t");
                default -> {
                    if (ch < 0x20) {
                        escaped.append(String.format("\\u%04x", (int) ch));
                    } else {
                        escaped.append(ch);
                    }
                }
            }
        }
        escaped.append('"');
        return escaped.toString();
    }
}
