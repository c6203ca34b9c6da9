package ai.robot.tidy.transform.rules;

import ai.robot.tidy.config.FormattingContext;
import ai.robot.tidy.model.Node;
import ai.robot.tidy.model.Section;
import ai.robot.tidy.model.SectionKind;
import ai.robot.tidy.model.Statement;
import ai.robot.tidy.model.StatementKind;
import ai.robot.tidy.model.Token;
import ai.robot.tidy.model.TokenKind;
import ai.robot.tidy.transform.ModelTransformer;
import ai.robot.tidy.transform.Rewrite;
import ai.robot.tidy.transform.RuleParameters;
import ai.robot.tidy.transform.SelectionGuard;
import ai.robot.tidy.transform.support.AlignmentTable;
import ai.robot.tidy.transform.support.Tokens;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Aligns the variables section into columns. The width of an aligned column is the longest token in it
 * rounded up to a multiple of four, so the separator after a token is that width minus the token length
 * plus four, never less than the configured space count. Comments and blank lines are moved to the left
 * edge; continuation lines with no value only get their line ending normalized.
 */
public class AlignVariablesSection extends ModelTransformer {

    static final String UP_TO_COLUMN = "up_to_column";
    static final String SKIP_TYPES = "skip_types";
    static final String MIN_WIDTH = "min_width";
    private static final Map<String, Character> VARIABLE_TYPES = Map.of("scalar", '$', "list", '@', "dict", '&');

    private final int alignedColumns;
    private final Set<Character> skippedSigils;
    private final int minWidth;

    /**
     * @param upToColumn number of aligned columns; 0 aligns all of them
     * @param skippedSigils variable sigils ({@code $ @ &}) whose entries are left untouched
     * @param minWidth fixed column width, or 0 to size columns by their content
     */
    public AlignVariablesSection(int upToColumn, Set<Character> skippedSigils, int minWidth) {
        this.alignedColumns = upToColumn == 0 ? AlignmentTable.UNBOUNDED : upToColumn - 1;
        this.skippedSigils = Set.copyOf(skippedSigils);
        this.minWidth = minWidth;
    }

    public static AlignVariablesSection fromParameters(RuleParameters parameters) {
        Set<Character> sigils = new HashSet<>();
        String skipTypes = parameters.getString(SKIP_TYPES, "");
        for (String type : skipTypes.split(",")) {
            String trimmed = type.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            Character sigil = VARIABLE_TYPES.get(trimmed);
            if (sigil == null) {
                throw parameters.invalid(SKIP_TYPES, trimmed, List.of("scalar", "list", "dict"));
            }
            sigils.add(sigil);
        }
        return new AlignVariablesSection(
                parameters.getInt(UP_TO_COLUMN, 2, 0),
                sigils,
                parameters.getInt(MIN_WIDTH, 0, 0));
    }

    @Override
    protected Rewrite visitSection(Section section, FormattingContext context) {
        if (section.sectionKind() != SectionKind.VARIABLES) {
            return Rewrite.keep();
        }
        return SelectionGuard.guard(section, context, () -> {
            align(section, context);
            return Rewrite.keep();
        });
    }

    private void align(Section section, FormattingContext context) {
        List<Entry> entries = new ArrayList<>();
        List<List<Token>> measured = new ArrayList<>();
        for (Node child : section.body()) {
            if (SelectionGuard.outsideSelection(child, context)) {
                continue;
            }
            if (child.isStatement(StatementKind.EMPTY_LINE) || child.isStatement(StatementKind.COMMENT)) {
                leftAlign((Statement) child);
            } else if (child instanceof Statement statement
                    && statement.statementKind() == StatementKind.VARIABLE
                    && shouldAlign(statement)) {
                List<Row> rows = rowsOf(statement, context);
                for (Row row : rows) {
                    if (!row.blank()) {
                        measured.add(row.tokens().subList(0, row.tokens().size() - 1));
                    }
                }
                entries.add(new Entry(statement, rows));
            }
        }
        if (measured.isEmpty()) {
            return;
        }
        AlignmentTable table = AlignmentTable.build(measured, alignedColumns);
        for (Entry entry : entries) {
            entry.statement().replaceTokens(alignRows(entry.rows(), table, context));
        }
    }

    private boolean shouldAlign(Statement statement) {
        String name = statement.firstToken(TokenKind.VARIABLE).map(Token::value).orElse("");
        return name.isEmpty() || !skippedSigils.contains(name.charAt(0));
    }

    private static void leftAlign(Statement statement) {
        List<Token> tokens = statement.tokenList();
        if (tokens.isEmpty()) {
            return;
        }
        Token first = tokens.get(0);
        first.setValue(stripLeadingBlanks(first.value()));
        if (first.kind() == TokenKind.SEPARATOR && first.value().isEmpty()) {
            tokens.remove(0);
        }
    }

    private static String stripLeadingBlanks(String value) {
        int start = 0;
        while (start < value.length() && (value.charAt(start) == ' ' || value.charAt(start) == '\t')) {
            start++;
        }
        return value.substring(start);
    }

    private static List<Row> rowsOf(Statement statement, FormattingContext context) {
        List<Row> rows = new ArrayList<>();
        for (List<Token> line : statement.lines()) {
            List<Token> withEol = new ArrayList<>(line);
            if (withEol.get(withEol.size() - 1).kind() != TokenKind.EOL) {
                withEol.add(Tokens.eol(context, statement.endLineNumber()));
            }
            if (isBlankContinuation(withEol)) {
                rows.add(new Row(withEol, true));
                continue;
            }
            List<Token> data = new ArrayList<>();
            for (Token token : withEol) {
                if (token.kind() != TokenKind.SEPARATOR) {
                    data.add(token);
                }
            }
            rows.add(new Row(data, false));
        }
        return rows;
    }

    private static boolean isBlankContinuation(List<Token> line) {
        boolean continuation = false;
        for (Token token : line) {
            switch (token.kind()) {
                case SEPARATOR, EOL -> {
                    // layout
                }
                case CONTINUATION -> continuation = true;
                case ARGUMENT -> {
                    if (!token.value().isEmpty()) {
                        return false;
                    }
                }
                default -> {
                    return false;
                }
            }
        }
        return continuation;
    }

    private List<Token> alignRows(List<Row> rows, AlignmentTable table, FormattingContext context) {
        List<Token> aligned = new ArrayList<>();
        for (Row row : rows) {
            List<Token> tokens = row.tokens();
            Token eol = tokens.get(tokens.size() - 1);
            if (row.blank()) {
                aligned.addAll(tokens.subList(0, tokens.size() - 1));
                aligned.add(Token.at(TokenKind.EOL, stripLeadingBlanks(eol.value()), eol.lineNumber()));
                continue;
            }
            if (tokens.size() < 2) {
                aligned.addAll(tokens);
                continue;
            }
            int lastValue = tokens.size() - 2;
            int upTo = alignedColumns == AlignmentTable.UNBOUNDED ? lastValue : alignedColumns;
            for (int column = 0; column < lastValue; column++) {
                Token token = tokens.get(column);
                aligned.add(token);
                aligned.add(Tokens.separator(separator(column, upTo, token, table, context), token.lineNumber()));
            }
            Token last = tokens.get(lastValue);
            last.setValue(last.value().stripLeading());
            aligned.add(last);
            aligned.add(eol);
        }
        return aligned;
    }

    private String separator(int column, int upTo, Token token, AlignmentTable table, FormattingContext context) {
        if (column >= upTo) {
            return context.separator();
        }
        int width = minWidth > 0 ? minWidth - token.value().length()
                : table.width(column) - token.value().length() + 4;
        return " ".repeat(Math.max(width, context.spaceCount()));
    }

    private record Row(List<Token> tokens, boolean blank) {
    }

    private record Entry(Statement statement, List<Row> rows) {
    }
}
