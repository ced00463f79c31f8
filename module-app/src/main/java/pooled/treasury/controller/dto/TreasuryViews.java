package pooled.treasury.controller.dto;

import pooled.treasury.domain.model.quorum.QuorumConfig;
import pooled.treasury.domain.model.quorum.VotingMode;

/** 단순 조회 응답 모음 */
public final class TreasuryViews {

  private TreasuryViews() {}

  public record RecordId(long id) {}

  public record RecordCount(int count) {}

  public record DepositResult(String sender, String amount, String balance) {}

  public record BalanceView(String balance, String totalWeight) {}

  public record ContributionView(String member, boolean registered, String contribution) {}

  public record ApprovalStatus(long id, String member, boolean approved) {}

  public record QuorumView(int countThreshold, int weightThresholdPercent, VotingMode mode) {

    public static QuorumView from(QuorumConfig config) {
      return new QuorumView(
          config.countThreshold(), config.weightThresholdPercent(), config.mode());
    }
  }
}
