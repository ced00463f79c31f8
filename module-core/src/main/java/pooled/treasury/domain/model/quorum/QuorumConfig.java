package pooled.treasury.domain.model.quorum;

import java.util.Objects;
import pooled.treasury.error.exception.InvalidConfigException;
import pooled.treasury.error.exception.InvalidInputException;

/**
 * 정족수 설정
 *
 * <p>정규 생성자는 무부호 정수 조건(음수 금지)만 검사합니다. 백분율 상한(100)은 최초 구성 시 {@link #validated}에서만 검사하며, 실행된
 * ChangeParameters 제안은 상한 검사 없이 그대로 덮어씁니다.
 *
 * @param countThreshold 필요한 최소 승인 수
 * @param weightThresholdPercent 총 가중치 대비 초과해야 하는 백분율
 * @param mode 판정 방식
 */
public record QuorumConfig(int countThreshold, int weightThresholdPercent, VotingMode mode) {

  public QuorumConfig {
    Objects.requireNonNull(mode, "mode cannot be null");
    if (countThreshold < 0) {
      throw new InvalidInputException("countThreshold must not be negative: " + countThreshold);
    }
    if (weightThresholdPercent < 0) {
      throw new InvalidInputException(
          "weightThresholdPercent must not be negative: " + weightThresholdPercent);
    }
  }

  /** 최초 구성용 팩토리 (범위 검증 포함) */
  public static QuorumConfig validated(
      int countThreshold, int weightThresholdPercent, VotingMode mode) {
    if (mode == null) {
      throw new InvalidConfigException("mode is required");
    }
    if (countThreshold < 0) {
      throw new InvalidConfigException("countThreshold must be >= 0 but was " + countThreshold);
    }
    if (weightThresholdPercent < 0 || weightThresholdPercent > 100) {
      throw new InvalidConfigException(
          "weightThresholdPercent must be within [0,100] but was " + weightThresholdPercent);
    }
    return new QuorumConfig(countThreshold, weightThresholdPercent, mode);
  }
}
