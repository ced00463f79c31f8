package pooled.treasury.domain.service;

import java.util.function.LongFunction;
import pooled.treasury.domain.model.principal.PrincipalId;
import pooled.treasury.domain.model.record.GovernedRecord;
import pooled.treasury.domain.model.record.RecordLog;
import pooled.treasury.error.exception.AlreadyExecutedException;
import pooled.treasury.error.exception.QuorumNotMetException;

/**
 * 제출 / 승인 / 철회 / 실행 공통 흐름 (Template Method)
 *
 * <p>하위 클래스는 레코드 종류별 효과({@link #applyEffect})만 구현합니다.
 *
 * <h3>실행 규칙</h3>
 *
 * <ol>
 *   <li>id 범위 확인 (NotFoundException)
 *   <li>이미 실행됐으면 AlreadyExecutedException
 *   <li>현재 정족수 설정으로 판정, 미달이면 QuorumNotMetException
 *   <li>executed=true 후 효과 적용. 효과가 예외로 끝나면 executed=false로 되돌리고 예외 전파
 * </ol>
 *
 * @param <R> 레코드 타입
 */
public abstract class RecordRegistry<R extends GovernedRecord> {

  protected final TreasuryState state;
  private final RecordLog<R> log;
  private final ApprovalLedger<R> approvals;
  private final QuorumPolicy quorumPolicy;

  protected RecordRegistry(TreasuryState state, RecordLog<R> log, QuorumPolicy quorumPolicy) {
    this.state = state;
    this.log = log;
    this.approvals = new ApprovalLedger<>(state.members(), state.ledger());
    this.quorumPolicy = quorumPolicy;
  }

  protected R append(LongFunction<R> factory) {
    return log.append(factory);
  }

  public R get(long id) {
    return log.get(id);
  }

  public int count() {
    return log.size();
  }

  public void approve(long id, PrincipalId voter) {
    approvals.approve(log.get(id), voter);
  }

  public void revoke(long id, PrincipalId voter) {
    approvals.revoke(log.get(id), voter);
  }

  public boolean isApprovedBy(long id, PrincipalId member) {
    return log.get(id).approvals().hasApproved(member);
  }

  public R execute(long id) {
    R record = log.get(id);
    if (record.isExecuted()) {
      throw new AlreadyExecutedException(record.kind().label(), id);
    }
    if (!quorumPolicy.passes(
        record.approvals(), state.ledger().totalWeight(), state.quorumConfig())) {
      throw new QuorumNotMetException(
          record.kind().label(), id, state.quorumConfig().mode().name());
    }
    record.markExecuted();
    try {
      applyEffect(record);
    } catch (RuntimeException e) {
      record.rollbackExecution();
      throw e;
    }
    return record;
  }

  /** 효과는 전부 적용되거나, 아무것도 적용하지 않고 예외를 던져야 합니다. */
  protected abstract void applyEffect(R record);
}
