package pooled.treasury.domain.model.money;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import pooled.treasury.error.exception.ArithmeticOverflowException;
import pooled.treasury.error.exception.InvalidInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Amount - uint256 금액 연산")
class AmountTest {

  private static final Amount MAX = Amount.of(Amount.MAX_VALUE);

  @Test
  @DisplayName("음수는 생성할 수 없다")
  void rejectsNegative() {
    assertThatThrownBy(() -> Amount.of(-1)).isInstanceOf(InvalidInputException.class);
  }

  @Test
  @DisplayName("최댓값을 넘는 덧셈은 overflow")
  void additionOverflow() {
    assertThatThrownBy(() -> MAX.plus(Amount.of(1)))
        .isInstanceOf(ArithmeticOverflowException.class);
  }

  @Test
  @DisplayName("0 아래로 내려가는 뺄셈은 underflow")
  void subtractionUnderflow() {
    assertThatThrownBy(() -> Amount.of(1).minus(Amount.of(2)))
        .isInstanceOf(ArithmeticOverflowException.class);
  }

  @Test
  @DisplayName("곱셈도 범위를 검사한다")
  void multiplicationOverflow() {
    assertThatThrownBy(() -> MAX.times(2)).isInstanceOf(ArithmeticOverflowException.class);
    assertThat(Amount.of(7).times(50)).isEqualTo(Amount.of(350));
  }

  @Test
  @DisplayName("나눗셈은 0 방향으로 절사")
  void divisionTruncates() {
    assertThat(Amount.of(3).times(50).dividedBy(100)).isEqualTo(Amount.of(1));
    assertThat(Amount.of(99).dividedBy(100)).isEqualTo(Amount.ZERO);
  }

  @Test
  @DisplayName("10진 문자열 파싱")
  void parsesDecimal() {
    assertThat(Amount.parse("1000000000000000000"))
        .isEqualTo(Amount.of(new BigInteger("1000000000000000000")));
    assertThatThrownBy(() -> Amount.parse("1e18")).isInstanceOf(InvalidInputException.class);
  }

  @Test
  @DisplayName("uint256 범위를 넘는 입력은 overflow가 아니라 InvalidInput")
  void parseRejectsOutOfRangeInput() {
    String tooLarge = Amount.MAX_VALUE.add(BigInteger.ONE).toString();

    assertThatThrownBy(() -> Amount.parse(tooLarge))
        .isInstanceOf(InvalidInputException.class)
        .hasMessageContaining("uint256");
    assertThat(Amount.parse(Amount.MAX_VALUE.toString())).isEqualTo(MAX);
  }
}
