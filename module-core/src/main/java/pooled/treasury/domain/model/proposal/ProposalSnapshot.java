package pooled.treasury.domain.model.proposal;

import pooled.treasury.domain.model.record.ApprovalSnapshot;

/** 조회용 Proposal 스냅샷 */
public record ProposalSnapshot(
    long id, ProposalChange change, ApprovalSnapshot approvals, boolean executed) {

  public ProposalKind kind() {
    return change.kind();
  }
}
