package pooled.treasury.domain.service;

import pooled.treasury.domain.model.money.Amount;
import pooled.treasury.domain.model.quorum.QuorumConfig;
import pooled.treasury.domain.model.record.ApprovalState;

/**
 * 정족수 판정 (순수 함수)
 *
 * <ul>
 *   <li>COUNT: {@code count >= countThreshold} (포함)
 *   <li>WEIGHT: {@code weight > totalWeight * percent / 100} (초과, 나눗셈은 절사)
 * </ul>
 *
 * <p>두 모드의 경계 처리가 다릅니다. 기존 동작을 그대로 유지합니다.
 */
public final class QuorumPolicy {

  public boolean passes(ApprovalState approvals, Amount totalWeight, QuorumConfig config) {
    return passes(approvals.count(), approvals.weight(), totalWeight, config);
  }

  public boolean passes(int count, Amount weight, Amount totalWeight, QuorumConfig config) {
    return switch (config.mode()) {
      case COUNT -> count >= config.countThreshold();
      case WEIGHT -> weight.isGreaterThan(weightThreshold(totalWeight, config));
    };
  }

  /** 가중치 모드에서 초과해야 하는 값 */
  public Amount weightThreshold(Amount totalWeight, QuorumConfig config) {
    return totalWeight.times(config.weightThresholdPercent()).dividedBy(100);
  }
}
