package ai.robot.tidy.transform.support;

import ai.robot.tidy.model.Token;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Column widths for aligned rows: the longest token of each column rounded up to a multiple of four.
 */
public final class AlignmentTable {

    public static final int UNBOUNDED = -1;

    private final Map<Integer, Integer> widths;

    private AlignmentTable(Map<Integer, Integer> widths) {
        this.widths = widths;
    }

    /**
     * Measures the first {@code columns} tokens of every row, or every token when {@code columns} is
     * {@link #UNBOUNDED}.
     */
    public static AlignmentTable build(List<List<Token>> rows, int columns) {
        Map<Integer, Integer> longest = new HashMap<>();
        for (List<Token> row : rows) {
            int upTo = columns == UNBOUNDED ? row.size() : Math.min(columns, row.size());
            for (int index = 0; index < upTo; index++) {
                longest.merge(index, row.get(index).value().length(), Math::max);
            }
        }
        Map<Integer, Integer> rounded = new HashMap<>();
        longest.forEach((column, length) -> rounded.put(column, roundUpToFour(length)));
        return new AlignmentTable(rounded);
    }

    public static int roundUpToFour(int number) {
        int remainder = number % 4;
        return remainder == 0 ? number : number + 4 - remainder;
    }

    public int width(int column) {
        return widths.getOrDefault(column, 0);
    }

    public int columnCount() {
        return widths.size();
    }
}
