package ai.robot.tidy.transform.rules;

import ai.robot.tidy.config.FormattingContext;
import ai.robot.tidy.model.IfBlock;
import ai.robot.tidy.model.Node;
import ai.robot.tidy.model.Statement;
import ai.robot.tidy.model.StatementKind;
import ai.robot.tidy.model.Token;
import ai.robot.tidy.model.TokenKind;
import ai.robot.tidy.transform.ModelTransformer;
import ai.robot.tidy.transform.Rewrite;
import ai.robot.tidy.transform.RuleParameters;
import ai.robot.tidy.transform.SelectionGuard;
import ai.robot.tidy.transform.support.ArgumentSplitter;
import ai.robot.tidy.transform.support.Names;
import ai.robot.tidy.transform.support.Tokens;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces {@code Run Keyword If} calls with native IF blocks:
 *
 * <pre>
 * Run Keyword If    ${cond}    Kw A    ELSE IF    ${other}    Kw B    ELSE    Kw C
 * </pre>
 *
 * becomes an IF / ELSE IF / ELSE / END structure with one branch per delimiter. A branch running
 * {@code Run Keywords} yields one call per {@code AND}-separated chunk. Assigned variables are copied onto
 * every generated call. Calls that cannot be split cleanly are left as they are.
 */
public class ReplaceRunKeywordIf extends ModelTransformer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReplaceRunKeywordIf.class);
    private static final String RUN_KEYWORD_IF = "runkeywordif";
    private static final String RUN_KEYWORDS = "runkeywords";
    private static final String ELSE_IF = "ELSE IF";
    private static final String ELSE = "ELSE";
    private static final Set<String> BRANCH_DELIMITERS = Set.of(ELSE_IF, ELSE);
    private static final Set<String> KEYWORD_DELIMITERS = Set.of("AND");

    public static ReplaceRunKeywordIf fromParameters(RuleParameters parameters) {
        return new ReplaceRunKeywordIf();
    }

    @Override
    protected Rewrite visitStatement(Statement statement, FormattingContext context) {
        if (statement.statementKind() != StatementKind.KEYWORD_CALL) {
            return Rewrite.keep();
        }
        return SelectionGuard.guard(statement, context, () -> {
            Optional<String> keyword = statement.keyword();
            if (keyword.isEmpty() || !RUN_KEYWORD_IF.equals(Names.normalize(keyword.get()))) {
                return Rewrite.keep();
            }
            Optional<IfBlock> block = createBranches(statement, context);
            if (block.isEmpty()) {
                LOGGER.debug("Leaving {} at line {} unchanged", keyword.get(), statement.lineNumber());
                return Rewrite.keep();
            }
            // generated calls may be Run Keyword If themselves
            visitChildren(block.get(), context);
            return Rewrite.replaceWith(block.get());
        });
    }

    private Optional<IfBlock> createBranches(Statement call, FormattingContext context) {
        List<Token> arguments = call.tokensOf(TokenKind.ARGUMENT);
        if (arguments.size() < 2) {
            return Optional.empty();
        }
        int line = call.lineNumber();
        String indent = Tokens.indentOf(call);
        List<Token> assign = call.tokensOf(TokenKind.ASSIGN);
        List<List<Token>> branches = ArgumentSplitter.splitOnDelimiters(arguments, BRANCH_DELIMITERS);

        IfBlock next = null;
        for (int index = branches.size() - 1; index >= 0; index--) {
            List<Token> branch = branches.get(index);
            if (branch.isEmpty()) {
                return Optional.empty();
            }
            Statement header;
            List<Token> runArguments;
            if (index == 0) {
                if (branch.size() < 2) {
                    return Optional.empty();
                }
                header = conditionHeader(StatementKind.IF_HEADER, TokenKind.IF, indent, branch.get(0), context, line);
                runArguments = branch.subList(1, branch.size());
            } else if (ELSE_IF.equals(branch.get(0).value())) {
                if (branch.size() < 3) {
                    return Optional.empty();
                }
                header = conditionHeader(StatementKind.ELSE_IF_HEADER, TokenKind.ELSE_IF, indent, branch.get(1),
                        context, line);
                runArguments = branch.subList(2, branch.size());
            } else {
                if (index != branches.size() - 1 || branch.size() < 2) {
                    return Optional.empty();
                }
                header = new Statement(StatementKind.ELSE_HEADER,
                        Tokens.line(indent, List.of(Token.at(TokenKind.ELSE, ELSE, line)), context, line));
                runArguments = branch.subList(1, branch.size());
            }
            Optional<List<Node>> calls = createCalls(runArguments, assign, indent, context, line);
            if (calls.isEmpty()) {
                return Optional.empty();
            }
            next = new IfBlock(header, calls.get(), next, null);
        }
        next.setEnd(new Statement(StatementKind.END,
                Tokens.line(indent, List.of(Token.at(TokenKind.END, "END", line)), context, line)));
        return Optional.of(next);
    }

    private Statement conditionHeader(StatementKind kind, TokenKind control, String indent, Token condition,
                                      FormattingContext context, int line) {
        List<Token> data = List.of(Token.at(control, control.defaultValue(), line),
                condition.withKind(TokenKind.ARGUMENT));
        return new Statement(kind, Tokens.line(indent, data, context, line));
    }

    private Optional<List<Node>> createCalls(List<Token> runArguments, List<Token> assign, String indent,
                                             FormattingContext context, int line) {
        if (!RUN_KEYWORDS.equals(Names.normalize(runArguments.get(0).value()))) {
            return Optional.of(List.of(keywordCall(runArguments, assign, indent, context, line)));
        }
        List<Node> calls = new ArrayList<>();
        for (List<Token> chunk : ArgumentSplitter.splitOnDelimiters(runArguments, KEYWORD_DELIMITERS)) {
            List<Token> keywordTokens = chunk.subList(1, chunk.size());
            if (keywordTokens.isEmpty()) {
                return Optional.empty();
            }
            calls.add(keywordCall(keywordTokens, assign, indent, context, line));
        }
        return Optional.of(calls);
    }

    private Statement keywordCall(List<Token> tokens, List<Token> assign, String indent, FormattingContext context,
                                  int line) {
        List<Token> data = new ArrayList<>();
        for (Token variable : assign) {
            data.add(variable.copy());
        }
        data.add(Token.at(TokenKind.KEYWORD, tokens.get(0).value(), line));
        for (Token argument : tokens.subList(1, tokens.size())) {
            data.add(argument.withKind(TokenKind.ARGUMENT));
        }
        return new Statement(StatementKind.KEYWORD_CALL,
                Tokens.line(indent + context.separator(), data, context, line));
    }
}
