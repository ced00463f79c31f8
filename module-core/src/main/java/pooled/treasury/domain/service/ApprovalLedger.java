package pooled.treasury.domain.service;

import pooled.treasury.domain.model.principal.PrincipalId;
import pooled.treasury.domain.model.record.GovernedRecord;
import pooled.treasury.error.exception.AlreadyApprovedException;
import pooled.treasury.error.exception.AlreadyExecutedException;
import pooled.treasury.error.exception.NotApprovedException;
import pooled.treasury.error.exception.NotMemberException;

/**
 * 승인/철회 공통 메커니즘
 *
 * <p>승인 시점의 기여금을 가중치로 더하고, 철회 시에는 그때 더한 값을 그대로 뺍니다.
 *
 * @param <R> 레코드 종류 (Action / Proposal)
 */
public final class ApprovalLedger<R extends GovernedRecord> {

  private final MembershipRegistry members;
  private final ContributionLedger contributions;

  public ApprovalLedger(MembershipRegistry members, ContributionLedger contributions) {
    this.members = members;
    this.contributions = contributions;
  }

  public void approve(R record, PrincipalId voter) {
    if (!members.isMember(voter)) {
      throw new NotMemberException(voter.value());
    }
    if (record.isExecuted()) {
      throw new AlreadyExecutedException(record.kind().label(), record.id());
    }
    if (record.approvals().hasApproved(voter)) {
      throw new AlreadyApprovedException(record.kind().label(), record.id(), voter.value());
    }
    record.recordApproval(voter, contributions.contributionOf(voter));
  }

  public void revoke(R record, PrincipalId voter) {
    if (record.isExecuted()) {
      throw new AlreadyExecutedException(record.kind().label(), record.id());
    }
    if (!record.approvals().hasApproved(voter)) {
      throw new NotApprovedException(record.kind().label(), record.id(), voter.value());
    }
    record.recordRevocation(voter);
  }
}
