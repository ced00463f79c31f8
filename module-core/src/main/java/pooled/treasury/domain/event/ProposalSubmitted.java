package pooled.treasury.domain.event;

import pooled.treasury.domain.model.principal.PrincipalId;
import pooled.treasury.domain.model.proposal.ProposalChange;

public record ProposalSubmitted(long proposalId, PrincipalId submitter, ProposalChange change)
    implements TreasuryEvent {}
