package pooled.treasury.domain.model.proposal;

import pooled.treasury.domain.model.quorum.QuorumConfig;
import pooled.treasury.domain.model.quorum.VotingMode;
import pooled.treasury.domain.service.TreasuryState;

/**
 * 정족수 설정 교체
 *
 * <p>음수만 거부합니다. 백분율 100 초과 같은 값도 실행 시 그대로 반영됩니다.
 */
public record ChangeParameters(
    int newCountThreshold, int newWeightThresholdPercent, VotingMode newMode)
    implements ProposalChange {

  public ChangeParameters {
    new QuorumConfig(newCountThreshold, newWeightThresholdPercent, newMode);
  }

  public QuorumConfig toQuorumConfig() {
    return new QuorumConfig(newCountThreshold, newWeightThresholdPercent, newMode);
  }

  @Override
  public ProposalKind kind() {
    return ProposalKind.CHANGE_PARAMETERS;
  }

  @Override
  public void applyTo(TreasuryState state) {
    state.reconfigure(toQuorumConfig());
  }
}
