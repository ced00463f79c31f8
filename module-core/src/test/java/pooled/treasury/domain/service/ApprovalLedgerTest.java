package pooled.treasury.domain.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static pooled.treasury.support.TreasuryFixtures.*;

import pooled.treasury.domain.model.action.ActionCall;
import pooled.treasury.domain.model.action.ActionRecord;
import pooled.treasury.domain.model.money.Amount;
import pooled.treasury.error.exception.AlreadyApprovedException;
import pooled.treasury.error.exception.AlreadyExecutedException;
import pooled.treasury.error.exception.NotApprovedException;
import pooled.treasury.error.exception.NotMemberException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ApprovalLedger - 승인/철회 가드와 가중치 캡처")
class ApprovalLedgerTest {

  private MembershipRegistry members;
  private ContributionLedger contributions;
  private ApprovalLedger<ActionRecord> ledger;
  private ActionRecord record;

  @BeforeEach
  void setUp() {
    members = MembershipRegistry.of(FOUR_MEMBERS);
    contributions = new ContributionLedger(members);
    ledger = new ApprovalLedger<>(members, contributions);
    record = new ActionRecord(0, new ActionCall(VENDOR, Amount.ZERO, new byte[0]));
  }

  @Test
  @DisplayName("승인 시점 기여금이 가중치로 더해진다")
  void approveCapturesContribution() {
    contributions.deposit(ALICE, Amount.of(10));

    ledger.approve(record, ALICE);

    assertThat(record.approvals().count()).isEqualTo(1);
    assertThat(record.approvals().weight()).isEqualTo(Amount.of(10));
    assertThat(record.approvals().capturedWeightOf(ALICE)).isEqualTo(Amount.of(10));
  }

  @Test
  @DisplayName("승인 후 추가 입금이 있어도 철회는 캡처한 값을 뺀다")
  void revokeSubtractsCapturedWeight() {
    contributions.deposit(ALICE, Amount.of(10));
    contributions.deposit(BOB, Amount.of(5));
    ledger.approve(record, ALICE);
    ledger.approve(record, BOB);
    contributions.deposit(ALICE, Amount.of(90));

    ledger.revoke(record, ALICE);

    assertThat(record.approvals().count()).isEqualTo(1);
    assertThat(record.approvals().weight()).isEqualTo(Amount.of(5));
    assertThat(record.approvals().hasApproved(ALICE)).isFalse();
  }

  @Test
  @DisplayName("기여금이 0인 멤버의 승인은 count만 올린다")
  void zeroContributionApproval() {
    ledger.approve(record, CAROL);

    assertThat(record.approvals().count()).isEqualTo(1);
    assertThat(record.approvals().weight()).isEqualTo(Amount.ZERO);
  }

  @Test
  @DisplayName("중복 승인은 AlreadyApprovedException")
  void duplicateApproval() {
    ledger.approve(record, ALICE);

    assertThatThrownBy(() -> ledger.approve(record, ALICE))
        .isInstanceOf(AlreadyApprovedException.class);
    assertThat(record.approvals().count()).isEqualTo(1);
  }

  @Test
  @DisplayName("비멤버 승인은 NotMemberException")
  void outsiderApproval() {
    assertThatThrownBy(() -> ledger.approve(record, OUTSIDER))
        .isInstanceOf(NotMemberException.class);
  }

  @Test
  @DisplayName("승인하지 않은 멤버의 철회는 NotApprovedException")
  void revokeWithoutApproval() {
    assertThatThrownBy(() -> ledger.revoke(record, BOB))
        .isInstanceOf(NotApprovedException.class);
  }

  @Test
  @DisplayName("실행된 레코드는 승인/철회 모두 AlreadyExecutedException")
  void executedRecordIsFrozen() {
    ledger.approve(record, ALICE);
    record.markExecuted();

    assertThatThrownBy(() -> ledger.approve(record, BOB))
        .isInstanceOf(AlreadyExecutedException.class);
    assertThatThrownBy(() -> ledger.revoke(record, ALICE))
        .isInstanceOf(AlreadyExecutedException.class);
  }
}
