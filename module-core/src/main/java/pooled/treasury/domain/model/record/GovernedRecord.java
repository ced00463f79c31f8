package pooled.treasury.domain.model.record;

import pooled.treasury.domain.model.money.Amount;
import pooled.treasury.domain.model.principal.PrincipalId;

/**
 * 승인 절차를 거치는 레코드의 공통 형태 (Action, Proposal)
 *
 * <p>id와 payload는 제출 시점에 고정됩니다. 이후 변경 가능한 것은 승인 집계와 executed 플래그뿐이며, executed=true는 종단 상태입니다.
 */
public abstract class GovernedRecord {

  private final long id;
  private final ApprovalState approvals = new ApprovalState();
  private boolean executed;

  protected GovernedRecord(long id) {
    this.id = id;
  }

  public abstract RecordKind kind();

  public long id() {
    return id;
  }

  public ApprovalState approvals() {
    return approvals;
  }

  public boolean isExecuted() {
    return executed;
  }

  /** ApprovalLedger 전용 진입점. 가드 검사는 호출 측 책임 */
  public void recordApproval(PrincipalId member, Amount contribution) {
    approvals.add(member, contribution);
  }

  public void recordRevocation(PrincipalId member) {
    approvals.remove(member);
  }

  public void markExecuted() {
    executed = true;
  }

  /** 실행 효과가 실패했을 때만 호출 */
  public void rollbackExecution() {
    executed = false;
  }
}
