package pooled.treasury.domain.event;

import pooled.treasury.domain.model.principal.PrincipalId;

public record ProposalApprovalRevoked(long proposalId, PrincipalId member)
    implements TreasuryEvent {}
