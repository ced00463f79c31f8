package pooled.treasury.domain.model.record;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import pooled.treasury.domain.model.money.Amount;
import pooled.treasury.domain.model.principal.PrincipalId;

/**
 * 레코드별 승인 집계
 *
 * <p>승인 시점의 기여금을 승인자별로 보관합니다. 철회 시에는 현재 기여금이 아니라 보관해 둔 값을 빼므로, 승인 이후 입금이 있어도 weight는 승인자별
 * 기여분의 합과 항상 같습니다.
 *
 * <p>불변식: {@code count == approvedBy.size()}, {@code weight == Σ captured}
 */
public final class ApprovalState {

  private final Map<PrincipalId, Amount> captured = new LinkedHashMap<>();
  private int count;
  private Amount weight = Amount.ZERO;

  public int count() {
    return count;
  }

  public Amount weight() {
    return weight;
  }

  public boolean hasApproved(PrincipalId member) {
    return captured.containsKey(member);
  }

  /** 승인 시점에 가산된 가중치 (승인하지 않았으면 ZERO) */
  public Amount capturedWeightOf(PrincipalId member) {
    return captured.getOrDefault(member, Amount.ZERO);
  }

  /**
   * 승인 추가
   *
   * <p>합계를 먼저 계산하므로 overflow가 나면 아무 필드도 바뀌지 않습니다.
   */
  void add(PrincipalId member, Amount contribution) {
    Amount nextWeight = weight.plus(contribution);
    captured.put(member, contribution);
    count++;
    weight = nextWeight;
  }

  void remove(PrincipalId member) {
    Amount contribution = captured.get(member);
    Amount nextWeight = weight.minus(contribution);
    captured.remove(member);
    count--;
    weight = nextWeight;
  }

  public ApprovalSnapshot snapshot() {
    return new ApprovalSnapshot(count, weight, List.copyOf(new ArrayList<>(captured.keySet())));
  }
}
