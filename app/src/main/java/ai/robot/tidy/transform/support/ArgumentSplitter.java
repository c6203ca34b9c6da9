package ai.robot.tidy.transform.support;

import ai.robot.tidy.model.Token;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Splits flat argument lists at literal delimiter values such as {@code ELSE IF} or {@code AND}.
 */
public final class ArgumentSplitter {

    private ArgumentSplitter() {
    }

    /**
     * Returns the chunks between delimiters. Every chunk after the first starts with the delimiter token that
     * opened it; the first chunk is empty when the list starts with a delimiter.
     */
    public static List<List<Token>> splitOnDelimiters(List<Token> tokens, Set<String> delimiters) {
        List<List<Token>> chunks = new ArrayList<>();
        int start = 0;
        for (int index = 0; index < tokens.size(); index++) {
            if (delimiters.contains(tokens.get(index).value())) {
                chunks.add(List.copyOf(tokens.subList(start, index)));
                start = index;
            }
        }
        chunks.add(List.copyOf(tokens.subList(start, tokens.size())));
        return chunks;
    }
}
