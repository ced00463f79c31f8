package pooled.treasury.controller.dto;

import java.util.List;
import pooled.treasury.domain.model.principal.PrincipalId;
import pooled.treasury.domain.model.record.ApprovalSnapshot;

/** 승인 집계 응답 (weight는 10진 문자열) */
public record ApprovalView(int count, String weight, List<String> approvedBy) {

  public static ApprovalView from(ApprovalSnapshot snapshot) {
    return new ApprovalView(
        snapshot.count(),
        snapshot.weight().toString(),
        snapshot.approvedBy().stream().map(PrincipalId::value).toList());
  }
}
