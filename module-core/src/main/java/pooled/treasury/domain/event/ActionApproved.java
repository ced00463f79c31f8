package pooled.treasury.domain.event;

import pooled.treasury.domain.model.principal.PrincipalId;

public record ActionApproved(long actionId, PrincipalId member) implements TreasuryEvent {}
