package pooled.treasury.domain.model.record;

import java.util.List;
import pooled.treasury.domain.model.money.Amount;
import pooled.treasury.domain.model.principal.PrincipalId;

/**
 * 승인 집계의 불변 스냅샷
 *
 * @param count 승인 수
 * @param weight 승인 가중치 합
 * @param approvedBy 승인 순서대로 정렬된 승인자 목록
 */
public record ApprovalSnapshot(int count, Amount weight, List<PrincipalId> approvedBy) {

  public ApprovalSnapshot {
    approvedBy = List.copyOf(approvedBy);
  }
}
