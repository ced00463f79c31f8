package pooled.treasury.domain.event;

import pooled.treasury.domain.model.principal.PrincipalId;
import pooled.treasury.domain.model.proposal.ProposalChange;

public record ProposalExecuted(long proposalId, PrincipalId executor, ProposalChange change)
    implements TreasuryEvent {}
