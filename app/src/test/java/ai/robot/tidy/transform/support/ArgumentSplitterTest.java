package ai.robot.tidy.transform.support;

import static org.assertj.core.api.Assertions.assertThat;

import ai.robot.tidy.model.Token;
import ai.robot.tidy.model.TokenKind;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ArgumentSplitterTest {

    @Test
    void keepsDelimiterAtStartOfEachLaterChunk() {
        List<List<Token>> chunks = ArgumentSplitter.splitOnDelimiters(
                arguments("${a}", "Kw", "ELSE IF", "${b}", "Kw2", "ELSE", "Kw3"), Set.of("ELSE", "ELSE IF"));

        assertThat(chunks).extracting(ArgumentSplitterTest::values).containsExactly(
                List.of("${a}", "Kw"),
                List.of("ELSE IF", "${b}", "Kw2"),
                List.of("ELSE", "Kw3"));
    }

    @Test
    void yieldsEmptyFirstChunkWhenListStartsWithDelimiter() {
        List<List<Token>> chunks = ArgumentSplitter.splitOnDelimiters(arguments("AND", "Kw"), Set.of("AND"));

        assertThat(chunks).hasSize(2);
        assertThat(chunks.get(0)).isEmpty();
    }

    @Test
    void returnsWholeListWithoutDelimiters() {
        assertThat(ArgumentSplitter.splitOnDelimiters(arguments("a", "b"), Set.of("AND"))).hasSize(1);
    }

    private static List<Token> arguments(String... values) {
        return Arrays.stream(values).map(value -> Token.of(TokenKind.ARGUMENT, value)).toList();
    }

    private static List<String> values(List<Token> tokens) {
        return tokens.stream().map(Token::value).toList();
    }
}
