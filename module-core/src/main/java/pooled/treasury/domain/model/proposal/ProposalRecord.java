package pooled.treasury.domain.model.proposal;

import pooled.treasury.domain.model.record.GovernedRecord;
import pooled.treasury.domain.model.record.RecordKind;

public final class ProposalRecord extends GovernedRecord {

  private final ProposalChange change;

  public ProposalRecord(long id, ProposalChange change) {
    super(id);
    this.change = change;
  }

  public ProposalChange change() {
    return change;
  }

  @Override
  public RecordKind kind() {
    return RecordKind.PROPOSAL;
  }

  public ProposalSnapshot snapshot() {
    return new ProposalSnapshot(id(), change, approvals().snapshot(), isExecuted());
  }
}
