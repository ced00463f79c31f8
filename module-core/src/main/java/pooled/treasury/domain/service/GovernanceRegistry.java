package pooled.treasury.domain.service;

import pooled.treasury.domain.model.proposal.ProposalChange;
import pooled.treasury.domain.model.proposal.ProposalRecord;

/** 자기 수정 제안 로그. 실행 효과는 변형별 {@link ProposalChange#applyTo} */
public final class GovernanceRegistry extends RecordRegistry<ProposalRecord> {

  public GovernanceRegistry(TreasuryState state, QuorumPolicy quorumPolicy) {
    super(state, state.proposals(), quorumPolicy);
  }

  public ProposalRecord submit(ProposalChange change) {
    return append(id -> new ProposalRecord(id, change));
  }

  @Override
  protected void applyEffect(ProposalRecord record) {
    record.change().applyTo(state);
  }
}
