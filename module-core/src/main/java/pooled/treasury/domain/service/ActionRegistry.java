package pooled.treasury.domain.service;

import pooled.treasury.core.port.out.ActionDispatch;
import pooled.treasury.core.port.out.ActionEffectDispatcher;
import pooled.treasury.core.port.out.EffectOutcome;
import pooled.treasury.domain.model.action.ActionCall;
import pooled.treasury.domain.model.action.ActionRecord;
import pooled.treasury.domain.model.money.Amount;
import pooled.treasury.error.exception.EffectDispatchFailedException;

/**
 * 송금 요청 로그
 *
 * <p>실행 효과는 잔액 출금 후 외부 전달입니다. 잔액 부족, 전달 실패 결과, 전달 중 예외는 모두 {@link
 * EffectDispatchFailedException}이 되며 출금은 환원됩니다.
 */
public final class ActionRegistry extends RecordRegistry<ActionRecord> {

  private final ActionEffectDispatcher dispatcher;

  public ActionRegistry(
      TreasuryState state, QuorumPolicy quorumPolicy, ActionEffectDispatcher dispatcher) {
    super(state, state.actions(), quorumPolicy);
    this.dispatcher = dispatcher;
  }

  public ActionRecord submit(ActionCall call) {
    return append(id -> new ActionRecord(id, call));
  }

  @Override
  protected void applyEffect(ActionRecord record) {
    ContributionLedger ledger = state.ledger();
    Amount value = record.call().value();
    if (!ledger.canDisburse(value)) {
      throw new EffectDispatchFailedException(
          record.id(),
          "insufficient balance (requested " + value + ", available " + ledger.balance() + ")");
    }
    ledger.disburse(value);

    EffectOutcome outcome = dispatchOrRestore(record, value);
    if (outcome == null || !outcome.success()) {
      ledger.restore(value);
      String reason = outcome == null ? "no outcome" : outcome.reason();
      throw new EffectDispatchFailedException(
          record.id(), dispatcher.getDispatcherName() + " rejected: " + reason);
    }
  }

  private EffectOutcome dispatchOrRestore(ActionRecord record, Amount value) {
    try {
      return dispatcher.dispatch(new ActionDispatch(record.id(), record.call()));
    } catch (EffectDispatchFailedException e) {
      state.ledger().restore(value);
      throw e;
    } catch (RuntimeException e) {
      state.ledger().restore(value);
      throw new EffectDispatchFailedException(
          record.id(), dispatcher.getDispatcherName() + " failed: " + e.getMessage(), e);
    }
  }
}
