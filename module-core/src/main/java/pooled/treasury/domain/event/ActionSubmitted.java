package pooled.treasury.domain.event;

import pooled.treasury.domain.model.action.ActionCall;
import pooled.treasury.domain.model.principal.PrincipalId;

public record ActionSubmitted(long actionId, PrincipalId submitter, ActionCall call)
    implements TreasuryEvent {}
