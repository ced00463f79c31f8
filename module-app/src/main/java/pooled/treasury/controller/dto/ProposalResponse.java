package pooled.treasury.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import pooled.treasury.domain.model.proposal.AddMember;
import pooled.treasury.domain.model.proposal.ChangeParameters;
import pooled.treasury.domain.model.proposal.ProposalChange;
import pooled.treasury.domain.model.proposal.ProposalKind;
import pooled.treasury.domain.model.proposal.ProposalSnapshot;
import pooled.treasury.domain.model.proposal.RemoveMember;
import pooled.treasury.domain.model.quorum.VotingMode;

/**
 * Proposal 응답
 *
 * <p>변경 내용은 제출 요청과 같은 평면 형태로 돌려줍니다. kind에 해당하지 않는 필드는 생략됩니다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProposalResponse(
    long id,
    ProposalKind kind,
    String member,
    Integer newCountThreshold,
    Integer newWeightThresholdPercent,
    VotingMode newMode,
    ApprovalView approvals,
    boolean executed) {

  public static ProposalResponse from(ProposalSnapshot snapshot) {
    ProposalChange change = snapshot.change();
    String member = null;
    Integer count = null;
    Integer percent = null;
    VotingMode mode = null;
    if (change instanceof AddMember add) {
      member = add.member().value();
    } else if (change instanceof RemoveMember remove) {
      member = remove.member().value();
    } else if (change instanceof ChangeParameters params) {
      count = params.newCountThreshold();
      percent = params.newWeightThresholdPercent();
      mode = params.newMode();
    }
    return new ProposalResponse(
        snapshot.id(),
        snapshot.kind(),
        member,
        count,
        percent,
        mode,
        ApprovalView.from(snapshot.approvals()),
        snapshot.executed());
  }
}
