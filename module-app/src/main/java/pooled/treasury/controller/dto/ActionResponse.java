package pooled.treasury.controller.dto;

import pooled.treasury.domain.model.action.ActionSnapshot;

public record ActionResponse(
    long id, String target, String value, String data, ApprovalView approvals, boolean executed) {

  public static ActionResponse from(ActionSnapshot snapshot) {
    return new ActionResponse(
        snapshot.id(),
        snapshot.call().target().value(),
        snapshot.call().value().toString(),
        "0x" + snapshot.call().dataHex(),
        ApprovalView.from(snapshot.approvals()),
        snapshot.executed());
  }
}
