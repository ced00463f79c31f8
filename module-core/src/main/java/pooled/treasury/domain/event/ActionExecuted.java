package pooled.treasury.domain.event;

import pooled.treasury.domain.model.action.ActionCall;
import pooled.treasury.domain.model.principal.PrincipalId;

public record ActionExecuted(long actionId, PrincipalId executor, ActionCall call)
    implements TreasuryEvent {}
