package pooled.treasury.domain.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static pooled.treasury.support.TreasuryFixtures.*;

import pooled.treasury.domain.model.money.Amount;
import pooled.treasury.error.exception.ArithmeticOverflowException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ContributionLedger")
class ContributionLedgerTest {

  private MembershipRegistry members;
  private ContributionLedger ledger;

  @BeforeEach
  void setUp() {
    members = MembershipRegistry.of(FOUR_MEMBERS);
    ledger = new ContributionLedger(members);
  }

  @Test
  @DisplayName("멤버 입금은 기여금, 총 가중치, 잔액을 모두 늘린다")
  void memberDeposit() {
    Amount balance = ledger.deposit(ALICE, Amount.of(100));

    assertThat(balance).isEqualTo(Amount.of(100));
    assertThat(ledger.contributionOf(ALICE)).isEqualTo(Amount.of(100));
    assertThat(ledger.totalWeight()).isEqualTo(Amount.of(100));
  }

  @Test
  @DisplayName("비멤버 입금은 잔액만 늘린다")
  void outsiderDeposit() {
    ledger.deposit(OUTSIDER, Amount.of(100));

    assertThat(ledger.balance()).isEqualTo(Amount.of(100));
    assertThat(ledger.contributionOf(OUTSIDER)).isEqualTo(Amount.ZERO);
    assertThat(ledger.totalWeight()).isEqualTo(Amount.ZERO);
  }

  @Test
  @DisplayName("기여 이력이 없으면 0")
  void unknownContributionIsZero() {
    assertThat(ledger.contributionOf(BOB)).isEqualTo(Amount.ZERO);
  }

  @Test
  @DisplayName("잔액 overflow면 장부가 바뀌지 않는다")
  void overflowLeavesLedgerUntouched() {
    ledger.deposit(ALICE, Amount.of(Amount.MAX_VALUE));

    assertThatThrownBy(() -> ledger.deposit(BOB, Amount.of(1)))
        .isInstanceOf(ArithmeticOverflowException.class);
    assertThat(ledger.contributionOf(BOB)).isEqualTo(Amount.ZERO);
    assertThat(ledger.totalWeight()).isEqualTo(Amount.of(Amount.MAX_VALUE));
  }

  @Test
  @DisplayName("출금과 환원은 잔액만 움직인다")
  void disburseAndRestore() {
    ledger.deposit(ALICE, Amount.of(50));

    assertThat(ledger.canDisburse(Amount.of(51))).isFalse();
    ledger.disburse(Amount.of(30));
    assertThat(ledger.balance()).isEqualTo(Amount.of(20));
    ledger.restore(Amount.of(30));

    assertThat(ledger.balance()).isEqualTo(Amount.of(50));
    assertThat(ledger.totalWeight()).isEqualTo(Amount.of(50));
  }
}
