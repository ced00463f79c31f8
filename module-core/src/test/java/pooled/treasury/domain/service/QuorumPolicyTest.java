package pooled.treasury.domain.service;

import static org.assertj.core.api.Assertions.assertThat;

import pooled.treasury.domain.model.money.Amount;
import pooled.treasury.domain.model.quorum.QuorumConfig;
import pooled.treasury.domain.model.quorum.VotingMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("QuorumPolicy")
class QuorumPolicyTest {

  private final QuorumPolicy policy = new QuorumPolicy();

  @ParameterizedTest(name = "count={0}, threshold={1} -> {2}")
  @CsvSource({"1,2,false", "2,2,true", "3,2,true", "0,0,true"})
  @DisplayName("COUNT 모드는 경계 포함")
  void countModeIsInclusive(int count, int threshold, boolean expected) {
    QuorumConfig config = new QuorumConfig(threshold, 50, VotingMode.COUNT);

    assertThat(policy.passes(count, Amount.ZERO, Amount.ZERO, config)).isEqualTo(expected);
  }

  @ParameterizedTest(name = "weight={0}, total={1}, pct={2} -> {3}")
  @CsvSource({
    "1,2,50,false",
    "2,2,50,true",
    "2,3,51,true",
    "1,3,50,false",
    "0,0,50,false",
    "1,0,50,true"
  })
  @DisplayName("WEIGHT 모드는 경계 초과, 절사 나눗셈")
  void weightModeIsStrict(long weight, long total, int percent, boolean expected) {
    QuorumConfig config = new QuorumConfig(99, percent, VotingMode.WEIGHT);

    assertThat(policy.passes(0, Amount.of(weight), Amount.of(total), config))
        .isEqualTo(expected);
  }

  @Test
  @DisplayName("모드가 무시하는 필드는 판정에 쓰이지 않는다")
  void modeIgnoresOtherThreshold() {
    QuorumConfig count = new QuorumConfig(1, 100, VotingMode.COUNT);
    QuorumConfig weight = new QuorumConfig(100, 0, VotingMode.WEIGHT);

    assertThat(policy.passes(1, Amount.ZERO, Amount.of(10), count)).isTrue();
    assertThat(policy.passes(0, Amount.of(1), Amount.of(10), weight)).isTrue();
  }

  @Test
  @DisplayName("가중치 임계값은 total * pct / 100")
  void weightThreshold() {
    QuorumConfig config = new QuorumConfig(0, 51, VotingMode.WEIGHT);

    assertThat(policy.weightThreshold(Amount.of(3), config)).isEqualTo(Amount.of(1));
  }
}
