package pooled.treasury.service;

import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.extern.slf4j.Slf4j;
import pooled.treasury.domain.model.action.ActionSnapshot;
import pooled.treasury.domain.model.money.Amount;
import pooled.treasury.domain.model.principal.PrincipalId;
import pooled.treasury.domain.model.proposal.ProposalChange;
import pooled.treasury.domain.model.proposal.ProposalSnapshot;
import pooled.treasury.domain.model.quorum.QuorumConfig;
import pooled.treasury.domain.service.TreasuryGovernance;
import pooled.treasury.global.executor.LogicExecutor;
import pooled.treasury.global.executor.TaskContext;
import pooled.treasury.global.executor.function.ThrowingSupplier;
import org.springframework.stereotype.Service;

/**
 * 거버넌스 엔진 호스트
 *
 * <p>엔진은 스레드 안전하지 않으므로 단일 인스턴스를 공정(fair) ReadWriteLock으로 감쌉니다.
 *
 * <ul>
 *   <li>명령: write lock. 한 번에 하나씩 끝까지 실행되어 전체 순서가 정해집니다.
 *   <li>조회: read lock. 불변 스냅샷을 반환하므로 반쯤 적용된 상태는 보이지 않습니다.
 * </ul>
 *
 * <p>caller가 null이면 익명 호출로 취급되어 멤버 검사에서 거절됩니다.
 */
@Slf4j
@Service
public class TreasuryService {

  private static final String COMPONENT = "Treasury";

  private final TreasuryGovernance governance;
  private final LogicExecutor executor;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

  public TreasuryService(TreasuryGovernance governance, LogicExecutor executor) {
    this.governance = governance;
    this.executor = executor;
  }

  // ==================== Commands ====================

  public Amount deposit(PrincipalId sender, Amount amount) {
    Amount balance =
        write("deposit", sender.value(), () -> governance.deposit(sender, amount));
    log.info("[Treasury] Deposit: sender={}, amount={}, balance={}", sender, amount, balance);
    return balance;
  }

  public long submitAction(PrincipalId caller, PrincipalId target, Amount value, byte[] data) {
    long id =
        write(
            "submitAction",
            target.value(),
            () -> governance.submitAction(caller, target, value, data));
    log.info("[Treasury] Action submitted: id={}, caller={}, target={}", id, caller, target);
    return id;
  }

  /** 승인 집계 변경과 같은 write 구간에서 만든 스냅샷을 반환 */
  public ActionSnapshot approveAction(PrincipalId caller, long id) {
    return write("approveAction", String.valueOf(id), () -> governance.approveAction(caller, id));
  }

  public ActionSnapshot revokeActionApproval(PrincipalId caller, long id) {
    return write("revokeApproval", String.valueOf(id), () -> governance.revokeApproval(caller, id));
  }

  public ActionSnapshot executeAction(PrincipalId caller, long id) {
    ActionSnapshot snapshot =
        write("executeAction", String.valueOf(id), () -> governance.executeAction(caller, id));
    log.info("[Treasury] Action executed: id={}, caller={}", id, caller);
    return snapshot;
  }

  public long submitProposal(PrincipalId caller, ProposalChange change) {
    long id =
        write(
            "submitProposal",
            change.kind().name(),
            () -> governance.submitProposal(caller, change));
    log.info("[Treasury] Proposal submitted: id={}, caller={}, change={}", id, caller, change);
    return id;
  }

  public ProposalSnapshot approveProposal(PrincipalId caller, long id) {
    return write("approveProposal", String.valueOf(id), () -> governance.approveProposal(caller, id));
  }

  public ProposalSnapshot revokeProposalApproval(PrincipalId caller, long id) {
    return write("revokeProposalApproval", String.valueOf(id), () -> governance.revokeProposalApproval(caller, id));
  }

  public ProposalSnapshot executeProposal(PrincipalId caller, long id) {
    ProposalSnapshot snapshot =
        write(
            "executeProposal", String.valueOf(id), () -> governance.executeProposal(caller, id));
    log.info("[Treasury] Proposal executed: id={}, caller={}", id, caller);
    return snapshot;
  }

  // ==================== Queries ====================

  public ActionSnapshot getAction(long id) {
    return read("getAction", String.valueOf(id), () -> governance.getAction(id));
  }

  public int getActionCount() {
    return read("getActionCount", null, governance::getActionCount);
  }

  public boolean isActionApprovedBy(long id, PrincipalId member) {
    return read(
        "isActionApprovedBy", String.valueOf(id), () -> governance.isActionApprovedBy(id, member));
  }

  public ProposalSnapshot getProposal(long id) {
    return read("getProposal", String.valueOf(id), () -> governance.getProposal(id));
  }

  public int getProposalCount() {
    return read("getProposalCount", null, governance::getProposalCount);
  }

  public boolean isProposalApprovedBy(long id, PrincipalId member) {
    return read(
        "isProposalApprovedBy",
        String.valueOf(id),
        () -> governance.isProposalApprovedBy(id, member));
  }

  public List<PrincipalId> getMembers() {
    return read("getMembers", null, governance::getMembers);
  }

  public boolean isMember(PrincipalId principal) {
    return read("isMember", principal.value(), () -> governance.isMember(principal));
  }

  public Amount getBalance() {
    return read("getBalance", null, governance::getBalance);
  }

  public Amount totalWeight() {
    return read("totalWeight", null, governance::totalWeight);
  }

  public Amount contributionOf(PrincipalId member) {
    return read("contributionOf", member.value(), () -> governance.contributionOf(member));
  }

  public QuorumConfig getQuorumConfig() {
    return read("getQuorumConfig", null, governance::getQuorumConfig);
  }

  private <T> T write(String operation, String dynamicValue, ThrowingSupplier<T> task) {
    return guarded(lock.writeLock(), operation, dynamicValue, task);
  }

  private <T> T read(String operation, String dynamicValue, ThrowingSupplier<T> task) {
    return guarded(lock.readLock(), operation, dynamicValue, task);
  }

  private <T> T guarded(
      Lock guard, String operation, String dynamicValue, ThrowingSupplier<T> task) {
    guard.lock();
    return executor.executeWithFinally(
        task, guard::unlock, TaskContext.of(COMPONENT, operation, dynamicValue));
  }
}
