package ai.robot.tidy.transform.support;

import static org.assertj.core.api.Assertions.assertThat;

import ai.robot.tidy.model.Token;
import ai.robot.tidy.model.TokenKind;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class AlignmentTableTest {

    @Test
    void roundsUpToMultipleOfFour() {
        assertThat(AlignmentTable.roundUpToFour(0)).isZero();
        assertThat(AlignmentTable.roundUpToFour(4)).isEqualTo(4);
        assertThat(AlignmentTable.roundUpToFour(5)).isEqualTo(8);
        assertThat(AlignmentTable.roundUpToFour(14)).isEqualTo(16);
    }

    @Test
    void measuresOnlyRequestedColumns() {
        List<List<Token>> rows = List.of(
                row("${a}", "value", "x"),
                row("${longer_name}", "v", "a much longer trailing value"));

        AlignmentTable bounded = AlignmentTable.build(rows, 1);
        AlignmentTable unbounded = AlignmentTable.build(rows, AlignmentTable.UNBOUNDED);

        assertThat(bounded.columnCount()).isEqualTo(1);
        assertThat(bounded.width(0)).isEqualTo(16);
        assertThat(bounded.width(1)).isZero();
        assertThat(unbounded.columnCount()).isEqualTo(3);
        assertThat(unbounded.width(1)).isEqualTo(8);
        assertThat(unbounded.width(2)).isEqualTo(28);
    }

    private static List<Token> row(String... values) {
        return Arrays.stream(values).map(value -> Token.of(TokenKind.ARGUMENT, value)).toList();
    }
}
