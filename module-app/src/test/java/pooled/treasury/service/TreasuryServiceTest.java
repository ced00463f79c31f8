package pooled.treasury.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import pooled.treasury.core.port.out.TreasuryEventPublisher;
import pooled.treasury.domain.model.action.ActionSnapshot;
import pooled.treasury.domain.model.money.Amount;
import pooled.treasury.domain.model.principal.PrincipalId;
import pooled.treasury.domain.model.proposal.AddMember;
import pooled.treasury.domain.model.proposal.ProposalSnapshot;
import pooled.treasury.domain.model.quorum.VotingMode;
import pooled.treasury.domain.service.TreasuryGovernance;
import pooled.treasury.domain.service.TreasuryState;
import pooled.treasury.effect.JournalActionEffectDispatcher;
import pooled.treasury.error.exception.AlreadyExecutedException;
import pooled.treasury.error.exception.AuthorizationException;
import pooled.treasury.global.executor.DefaultLogicExecutor;
import pooled.treasury.support.TestLogicExecutors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("TreasuryService")
class TreasuryServiceTest {

  private static final PrincipalId ALICE = PrincipalId.of("alice");
  private static final PrincipalId BOB = PrincipalId.of("bob");
  private static final PrincipalId CAROL = PrincipalId.of("carol");
  private static final PrincipalId VENDOR = PrincipalId.of("vendor");

  private JournalActionEffectDispatcher journal;

  private TreasuryGovernance governance(int countThreshold) {
    journal = new JournalActionEffectDispatcher();
    TreasuryState state =
        TreasuryState.bootstrap(List.of(ALICE, BOB, CAROL), countThreshold, 50, VotingMode.COUNT);
    return new TreasuryGovernance(state, journal, TreasuryEventPublisher.noop());
  }

  @Nested
  @DisplayName("명령 위임")
  class Delegation {

    private TreasuryService service;

    @BeforeEach
    void setUp() {
      service = new TreasuryService(governance(2), TestLogicExecutors.passThrough());
    }

    @Test
    @DisplayName("입금, 제출, 승인, 실행이 순서대로 반영된다")
    void fullActionLifecycle() {
      service.deposit(ALICE, Amount.of(100));
      long id = service.submitAction(ALICE, VENDOR, Amount.of(25), new byte[] {0x01});
      service.approveAction(ALICE, id);
      service.approveAction(BOB, id);

      service.executeAction(CAROL, id);

      assertThat(service.getAction(id).executed()).isTrue();
      assertThat(service.getBalance()).isEqualTo(Amount.of(75));
      assertThat(service.totalWeight()).isEqualTo(Amount.of(100));
      assertThat(journal.entries())
          .singleElement()
          .satisfies(
              entry -> {
                assertThat(entry.actionId()).isEqualTo(id);
                assertThat(entry.data()).isEqualTo("01");
              });
    }

    @Test
    @DisplayName("거절은 도메인 예외 그대로 전파된다")
    void rejectionsPropagate() {
      assertThatThrownBy(() -> service.submitProposal(null, new AddMember(VENDOR)))
          .isInstanceOf(AuthorizationException.class);
      assertThat(service.getProposalCount()).isZero();
    }

    @Test
    @DisplayName("Proposal 승인 철회와 승인 여부 조회")
    void proposalApprovalLookup() {
      long id = service.submitProposal(ALICE, new AddMember(VENDOR));
      service.approveProposal(BOB, id);
      assertThat(service.isProposalApprovedBy(id, BOB)).isTrue();

      ProposalSnapshot revoked = service.revokeProposalApproval(BOB, id);

      assertThat(service.isProposalApprovedBy(id, BOB)).isFalse();
      assertThat(revoked.approvals().count()).isZero();
      assertThat(revoked.approvals().approvedBy()).isEmpty();
    }
  }

  @Nested
  @DisplayName("직렬화")
  class Serialization {

    @Test
    @DisplayName("동시 입금은 하나도 유실되지 않는다")
    void concurrentDepositsAreSerialized() throws Exception {
      TreasuryService service = new TreasuryService(governance(1), new DefaultLogicExecutor());
      int threads = 8;
      int perThread = 250;
      ExecutorService pool = Executors.newFixedThreadPool(threads);
      CountDownLatch start = new CountDownLatch(1);
      List<Future<?>> futures = new ArrayList<>();

      try {
        for (int t = 0; t < threads; t++) {
          PrincipalId sender = t % 2 == 0 ? ALICE : BOB;
          futures.add(
              pool.submit(
                  () -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                      service.deposit(sender, Amount.of(1));
                      service.getBalance();
                    }
                    return null;
                  }));
        }
        start.countDown();
        for (Future<?> future : futures) {
          future.get(10, TimeUnit.SECONDS);
        }
      } finally {
        pool.shutdownNow();
      }

      assertThat(service.getBalance()).isEqualTo(Amount.of((long) threads * perThread));
      assertThat(service.contributionOf(ALICE).plus(service.contributionOf(BOB)))
          .isEqualTo(service.totalWeight());
    }

    @Test
    @DisplayName("동시 실행 경쟁에서 효과는 한 번만 발생")
    void concurrentExecuteHappensOnce() throws Exception {
      TreasuryService service = new TreasuryService(governance(1), new DefaultLogicExecutor());
      service.deposit(ALICE, Amount.of(10));
      long id = service.submitAction(ALICE, VENDOR, Amount.of(10), new byte[0]);
      service.approveAction(ALICE, id);

      ExecutorService pool = Executors.newFixedThreadPool(4);
      List<Future<Boolean>> attempts = new ArrayList<>();
      try {
        for (int i = 0; i < 4; i++) {
          attempts.add(
              pool.submit(
                  () -> {
                    try {
                      service.executeAction(ALICE, id);
                      return true;
                    } catch (AlreadyExecutedException e) {
                      return false;
                    }
                  }));
        }
        int successes = 0;
        for (Future<Boolean> attempt : attempts) {
          if (attempt.get(10, TimeUnit.SECONDS)) {
            successes++;
          }
        }
        assertThat(successes).isEqualTo(1);
      } finally {
        pool.shutdownNow();
      }

      assertThat(journal.entries()).hasSize(1);
      assertThat(service.getBalance()).isEqualTo(Amount.ZERO);
    }

    @Test
    @DisplayName("동시 승인 응답은 각자 자기 승인 직후의 집계를 본다")
    void concurrentApprovalsReturnOwnSnapshot() throws Exception {
      TreasuryService service = new TreasuryService(governance(3), new DefaultLogicExecutor());
      long id = service.submitAction(ALICE, VENDOR, Amount.ZERO, new byte[0]);
      List<PrincipalId> voters = List.of(ALICE, BOB, CAROL);

      ExecutorService pool = Executors.newFixedThreadPool(voters.size());
      CountDownLatch start = new CountDownLatch(1);
      List<Future<ActionSnapshot>> approvals = new ArrayList<>();
      List<ActionSnapshot> snapshots = new ArrayList<>();
      try {
        for (PrincipalId voter : voters) {
          approvals.add(
              pool.submit(
                  () -> {
                    start.await();
                    return service.approveAction(voter, id);
                  }));
        }
        start.countDown();
        for (Future<ActionSnapshot> approval : approvals) {
          snapshots.add(approval.get(10, TimeUnit.SECONDS));
        }
      } finally {
        pool.shutdownNow();
      }

      // 같은 write 구간의 스냅샷이므로 count는 1, 2, 3 이 한 번씩
      assertThat(snapshots)
          .extracting(snapshot -> snapshot.approvals().count())
          .containsExactlyInAnyOrder(1, 2, 3);
      for (int i = 0; i < voters.size(); i++) {
        ActionSnapshot snapshot = snapshots.get(i);
        assertThat(snapshot.approvals().approvedBy())
            .hasSize(snapshot.approvals().count())
            .endsWith(voters.get(i));
      }
    }
  }
}
