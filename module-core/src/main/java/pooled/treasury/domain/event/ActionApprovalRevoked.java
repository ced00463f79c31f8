package pooled.treasury.domain.event;

import pooled.treasury.domain.model.principal.PrincipalId;

public record ActionApprovalRevoked(long actionId, PrincipalId member) implements TreasuryEvent {}
