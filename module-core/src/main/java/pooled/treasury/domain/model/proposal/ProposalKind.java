package pooled.treasury.domain.model.proposal;

public enum ProposalKind {
  ADD_MEMBER,
  REMOVE_MEMBER,
  CHANGE_PARAMETERS
}
