package ai.robot.tidy.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class StatementTest {

    @Test
    void exposesDataTokensAndSettingKind() {
        Statement setting = Statement.of(StatementKind.SETTING,
                Token.of(TokenKind.SEPARATOR, "    "),
                Token.of(TokenKind.SETUP, "[Setup]"),
                Token.of(TokenKind.SEPARATOR, "    "),
                Token.of(TokenKind.ARGUMENT, "Open"),
                Token.of(TokenKind.EOL, "\n"));

        assertThat(setting.dataTokens()).extracting(Token::value).containsExactly("[Setup]", "Open");
        assertThat(setting.settingKind()).contains(TokenKind.SETUP);
        assertThat(setting.keyword()).isEmpty();
    }

    @Test
    void splitsContinuedStatementIntoLines() {
        Document document = RobotSource.parse("""
                *** Variables ***
                @{list}    a
                ...    b
                """);
        Statement variable = (Statement) document.sections().get(0).body().get(0);

        List<List<Token>> lines = variable.lines();

        assertThat(lines).hasSize(2);
        assertThat(lines.get(1).get(0).kind()).isEqualTo(TokenKind.CONTINUATION);
        assertThat(variable.lineNumber()).isEqualTo(2);
        assertThat(variable.endLineNumber()).isEqualTo(3);
    }

    @Test
    void synthesizedNodesHaveNoSpan() {
        Statement empty = Statement.emptyLine("\n");

        assertThat(empty.lineNumber()).isEqualTo(Token.UNKNOWN_LINE);
        assertThat(empty.isStatement(StatementKind.EMPTY_LINE)).isTrue();
    }

    @Test
    void tokensKeepTheirPositionWhenRetyped() {
        Document document = RobotSource.parse("""
                *** Variables ***
                @{list}    a
                """);
        Statement variable = (Statement) document.sections().get(0).body().get(0);
        Token value = variable.dataTokens().get(1);

        Token argument = value.withKind(TokenKind.ARGUMENT);

        assertThat(value.lineNumber()).isEqualTo(2);
        assertThat(value.column()).isEqualTo(12);
        assertThat(argument.lineNumber()).isEqualTo(2);
        assertThat(argument.column()).isEqualTo(12);
        assertThat(Token.of(TokenKind.EOL, "\n").hasPosition()).isFalse();
    }
}
