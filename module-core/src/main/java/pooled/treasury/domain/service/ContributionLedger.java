package pooled.treasury.domain.service;

import java.util.HashMap;
import java.util.Map;
import pooled.treasury.domain.model.money.Amount;
import pooled.treasury.domain.model.principal.PrincipalId;

/**
 * 기여금 장부 + 금고 잔액
 *
 * <p>입금은 누구에게서나 받지만 투표 가중치는 입금 시점에 멤버인 경우에만 늘어납니다.
 *
 * <p>불변식: {@code totalWeight == Σ contributions}
 */
public final class ContributionLedger {

  private final MembershipRegistry members;
  private final Map<PrincipalId, Amount> contributions = new HashMap<>();
  private Amount totalWeight = Amount.ZERO;
  private Amount balance = Amount.ZERO;

  public ContributionLedger(MembershipRegistry members) {
    this.members = members;
  }

  /**
   * 입금 반영
   *
   * <p>새 값을 모두 계산한 뒤에 대입하므로 overflow 시 장부는 바뀌지 않습니다.
   *
   * @return 입금 반영 후 잔액
   */
  public Amount deposit(PrincipalId sender, Amount amount) {
    Amount nextBalance = balance.plus(amount);
    if (members.isMember(sender)) {
      Amount nextContribution = contributionOf(sender).plus(amount);
      Amount nextTotal = totalWeight.plus(amount);
      contributions.put(sender, nextContribution);
      totalWeight = nextTotal;
    }
    balance = nextBalance;
    return balance;
  }

  public Amount contributionOf(PrincipalId principal) {
    return contributions.getOrDefault(principal, Amount.ZERO);
  }

  public Amount totalWeight() {
    return totalWeight;
  }

  public Amount balance() {
    return balance;
  }

  public boolean canDisburse(Amount value) {
    return !value.isGreaterThan(balance);
  }

  /** 출금. 잔액 부족은 호출 전에 {@link #canDisburse}로 확인 */
  public void disburse(Amount value) {
    balance = balance.minus(value);
  }

  /** 실패한 출금 환원 */
  public void restore(Amount value) {
    balance = balance.plus(value);
  }
}
