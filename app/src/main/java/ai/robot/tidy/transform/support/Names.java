package ai.robot.tidy.transform.support;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Name comparison and canonicalization helpers.
 */
public final class Names {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private Names() {
    }

    /**
     * Lower-cases and removes spaces and underscores, the way keyword names are matched.
     */
    public static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT).replace("_", "").replace(" ", "");
    }

    public static String collapseWhitespace(String value) {
        return WHITESPACE.matcher(value).replaceAll(" ");
    }

    /**
     * Upper-cases the first letter of every word and lower-cases the rest; a word starts after any
     * character that is not a letter.
     */
    public static String titleCase(String value) {
        StringBuilder builder = new StringBuilder(value.length());
        boolean previousIsLetter = false;
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (Character.isLetter(ch)) {
                builder.append(previousIsLetter ? Character.toLowerCase(ch) : Character.toUpperCase(ch));
                previousIsLetter = true;
            } else {
                builder.append(ch);
                previousIsLetter = false;
            }
        }
        return builder.toString();
    }

    /**
     * Collapses whitespace, trims and title-cases a setting name.
     */
    public static String canonicalSettingName(String name) {
        return titleCase(collapseWhitespace(name).strip());
    }
}
