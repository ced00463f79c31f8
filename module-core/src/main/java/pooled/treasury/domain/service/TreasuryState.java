package pooled.treasury.domain.service;

import java.util.List;
import java.util.Objects;
import pooled.treasury.domain.model.action.ActionRecord;
import pooled.treasury.domain.model.principal.PrincipalId;
import pooled.treasury.domain.model.proposal.ProposalRecord;
import pooled.treasury.domain.model.quorum.QuorumConfig;
import pooled.treasury.domain.model.quorum.VotingMode;
import pooled.treasury.domain.model.record.RecordKind;
import pooled.treasury.domain.model.record.RecordLog;

/**
 * 금고 거버넌스의 전체 가변 상태 (단일 소유 집합체)
 *
 * <p>멤버 집합, 기여금 장부, 정족수 설정, 두 개의 append-only 로그가 이 객체 하나에 모여 있습니다. 전역 싱글톤이 아니므로 테스트마다 새 상태를 만들 수
 * 있습니다. 스레드 안전하지 않으며, 직렬화는 호스트 책임입니다.
 */
public final class TreasuryState {

  private final MembershipRegistry members;
  private final ContributionLedger ledger;
  private final RecordLog<ActionRecord> actions = new RecordLog<>(RecordKind.ACTION);
  private final RecordLog<ProposalRecord> proposals = new RecordLog<>(RecordKind.PROPOSAL);
  private QuorumConfig quorumConfig;

  private TreasuryState(MembershipRegistry members, QuorumConfig quorumConfig) {
    this.members = members;
    this.ledger = new ContributionLedger(members);
    this.quorumConfig = quorumConfig;
  }

  /**
   * 초기 구성 검증 후 생성
   *
   * @throws pooled.treasury.error.exception.InvalidConfigException 멤버 목록 또는 임계값이 잘못된 경우
   */
  public static TreasuryState bootstrap(
      List<PrincipalId> initialMembers,
      int countThreshold,
      int weightThresholdPercent,
      VotingMode mode) {
    QuorumConfig config = QuorumConfig.validated(countThreshold, weightThresholdPercent, mode);
    return new TreasuryState(MembershipRegistry.of(initialMembers), config);
  }

  public MembershipRegistry members() {
    return members;
  }

  public ContributionLedger ledger() {
    return ledger;
  }

  public RecordLog<ActionRecord> actions() {
    return actions;
  }

  public RecordLog<ProposalRecord> proposals() {
    return proposals;
  }

  public QuorumConfig quorumConfig() {
    return quorumConfig;
  }

  /** ChangeParameters 제안 실행 전용. 범위 재검증 없음 */
  public void reconfigure(QuorumConfig next) {
    this.quorumConfig = Objects.requireNonNull(next, "quorumConfig");
  }
}
