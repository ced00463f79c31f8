package pooled.treasury.domain.model.action;

import pooled.treasury.domain.model.record.GovernedRecord;
import pooled.treasury.domain.model.record.RecordKind;

public final class ActionRecord extends GovernedRecord {

  private final ActionCall call;

  public ActionRecord(long id, ActionCall call) {
    super(id);
    this.call = call;
  }

  public ActionCall call() {
    return call;
  }

  @Override
  public RecordKind kind() {
    return RecordKind.ACTION;
  }

  public ActionSnapshot snapshot() {
    return new ActionSnapshot(id(), call, approvals().snapshot(), isExecuted());
  }
}
