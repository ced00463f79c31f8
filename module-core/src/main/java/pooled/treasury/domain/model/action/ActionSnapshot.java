package pooled.treasury.domain.model.action;

import pooled.treasury.domain.model.record.ApprovalSnapshot;

/** 조회용 Action 스냅샷 */
public record ActionSnapshot(long id, ActionCall call, ApprovalSnapshot approvals, boolean executed) {}
