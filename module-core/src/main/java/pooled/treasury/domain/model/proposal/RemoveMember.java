package pooled.treasury.domain.model.proposal;

import java.util.Objects;
import pooled.treasury.domain.model.principal.PrincipalId;
import pooled.treasury.domain.service.TreasuryState;

public record RemoveMember(PrincipalId member) implements ProposalChange {

  public RemoveMember {
    Objects.requireNonNull(member, "member cannot be null");
  }

  @Override
  public ProposalKind kind() {
    return ProposalKind.REMOVE_MEMBER;
  }

  /**
   * 멤버십만 제거합니다. 기여금과 이미 집계된 승인은 그대로 둡니다.
   *
   * <p>멤버가 아니면 NotMemberException
   */
  @Override
  public void applyTo(TreasuryState state) {
    state.members().remove(member);
  }
}
