package pooled.treasury.controller.dto;

import jakarta.validation.constraints.NotNull;
import pooled.treasury.domain.model.principal.PrincipalId;
import pooled.treasury.domain.model.proposal.ProposalChange;
import pooled.treasury.domain.model.proposal.ProposalKind;
import pooled.treasury.domain.model.quorum.VotingMode;

/**
 * Proposal 제출 요청 DTO
 *
 * <p>kind에 따라 필요한 필드만 사용합니다. ADD_MEMBER / REMOVE_MEMBER는 member, CHANGE_PARAMETERS는 세 개의 new* 필드가
 * 필요합니다.
 */
public record SubmitProposalRequest(
    @NotNull(message = "kind는 필수입니다") ProposalKind kind,
    String member,
    Integer newCountThreshold,
    Integer newWeightThresholdPercent,
    VotingMode newMode) {

  public ProposalChange toChange() {
    PrincipalId principal = member == null || member.isBlank() ? null : PrincipalId.of(member);
    return ProposalChange.of(kind, principal, newCountThreshold, newWeightThresholdPercent, newMode);
  }
}
