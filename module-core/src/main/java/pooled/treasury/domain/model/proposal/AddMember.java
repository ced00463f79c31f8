package pooled.treasury.domain.model.proposal;

import java.util.Objects;
import pooled.treasury.domain.model.principal.PrincipalId;
import pooled.treasury.domain.service.TreasuryState;

public record AddMember(PrincipalId member) implements ProposalChange {

  public AddMember {
    Objects.requireNonNull(member, "member cannot be null");
  }

  @Override
  public ProposalKind kind() {
    return ProposalKind.ADD_MEMBER;
  }

  /** 이미 멤버면 DuplicateMemberException */
  @Override
  public void applyTo(TreasuryState state) {
    state.members().add(member);
  }
}
