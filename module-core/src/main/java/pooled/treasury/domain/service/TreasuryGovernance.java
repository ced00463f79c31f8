package pooled.treasury.domain.service;

import java.util.List;
import java.util.Objects;
import pooled.treasury.core.port.out.ActionEffectDispatcher;
import pooled.treasury.core.port.out.TreasuryEventPublisher;
import pooled.treasury.domain.event.ActionApprovalRevoked;
import pooled.treasury.domain.event.ActionApproved;
import pooled.treasury.domain.event.ActionExecuted;
import pooled.treasury.domain.event.ActionSubmitted;
import pooled.treasury.domain.event.DepositReceived;
import pooled.treasury.domain.event.ProposalApprovalRevoked;
import pooled.treasury.domain.event.ProposalApproved;
import pooled.treasury.domain.event.ProposalExecuted;
import pooled.treasury.domain.event.ProposalSubmitted;
import pooled.treasury.domain.model.action.ActionCall;
import pooled.treasury.domain.model.action.ActionRecord;
import pooled.treasury.domain.model.action.ActionSnapshot;
import pooled.treasury.domain.model.money.Amount;
import pooled.treasury.domain.model.principal.PrincipalId;
import pooled.treasury.domain.model.proposal.ProposalChange;
import pooled.treasury.domain.model.proposal.ProposalRecord;
import pooled.treasury.domain.model.proposal.ProposalSnapshot;
import pooled.treasury.domain.model.quorum.QuorumConfig;
import pooled.treasury.error.exception.AuthorizationException;

/**
 * 금고 거버넌스 명령/조회 진입점
 *
 * <p>각 메서드는 하나의 원자적 연산입니다. 실패하면 상태는 호출 전과 같고 알림도 발행되지 않습니다. 동시 호출 직렬화는 호출 측(호스트)이 보장해야 합니다.
 *
 * <h3>검사 순서 (변경 명령)</h3>
 *
 * <ol>
 *   <li>호출자 멤버 여부 (AuthorizationException)
 *   <li>레코드 존재 (NotFoundException)
 *   <li>실행 여부 (AlreadyExecutedException)
 *   <li>명령별 가드
 * </ol>
 */
public final class TreasuryGovernance {

  private final TreasuryState state;
  private final ActionRegistry actions;
  private final GovernanceRegistry proposals;
  private final TreasuryEventPublisher events;

  public TreasuryGovernance(
      TreasuryState state, ActionEffectDispatcher dispatcher, TreasuryEventPublisher events) {
    QuorumPolicy quorumPolicy = new QuorumPolicy();
    this.state = Objects.requireNonNull(state, "state");
    this.actions = new ActionRegistry(state, quorumPolicy, dispatcher);
    this.proposals = new GovernanceRegistry(state, quorumPolicy);
    this.events = Objects.requireNonNull(events, "events");
  }

  // ==================== Deposit ====================

  /** 누구나 입금 가능. 멤버 입금만 가중치에 반영 */
  public Amount deposit(PrincipalId sender, Amount amount) {
    Amount balance = state.ledger().deposit(sender, amount);
    events.publish(new DepositReceived(sender, amount, balance));
    return balance;
  }

  // ==================== Actions ====================

  public long submitAction(PrincipalId caller, PrincipalId target, Amount value, byte[] data) {
    requireMember(caller);
    ActionRecord record = actions.submit(new ActionCall(target, value, data));
    events.publish(new ActionSubmitted(record.id(), caller, record.call()));
    return record.id();
  }

  public ActionSnapshot approveAction(PrincipalId caller, long id) {
    requireMember(caller);
    actions.approve(id, caller);
    events.publish(new ActionApproved(id, caller));
    return actions.get(id).snapshot();
  }

  public ActionSnapshot revokeApproval(PrincipalId caller, long id) {
    requireMember(caller);
    actions.revoke(id, caller);
    events.publish(new ActionApprovalRevoked(id, caller));
    return actions.get(id).snapshot();
  }

  public ActionSnapshot executeAction(PrincipalId caller, long id) {
    requireMember(caller);
    ActionRecord record = actions.execute(id);
    events.publish(new ActionExecuted(id, caller, record.call()));
    return record.snapshot();
  }

  // ==================== Proposals ====================

  public long submitProposal(PrincipalId caller, ProposalChange change) {
    requireMember(caller);
    ProposalRecord record = proposals.submit(Objects.requireNonNull(change, "change"));
    events.publish(new ProposalSubmitted(record.id(), caller, change));
    return record.id();
  }

  public ProposalSnapshot approveProposal(PrincipalId caller, long id) {
    requireMember(caller);
    proposals.approve(id, caller);
    events.publish(new ProposalApproved(id, caller));
    return proposals.get(id).snapshot();
  }

  public ProposalSnapshot revokeProposalApproval(PrincipalId caller, long id) {
    requireMember(caller);
    proposals.revoke(id, caller);
    events.publish(new ProposalApprovalRevoked(id, caller));
    return proposals.get(id).snapshot();
  }

  public ProposalSnapshot executeProposal(PrincipalId caller, long id) {
    requireMember(caller);
    ProposalRecord record = proposals.execute(id);
    events.publish(new ProposalExecuted(id, caller, record.change()));
    return record.snapshot();
  }

  // ==================== Queries ====================

  public List<PrincipalId> getMembers() {
    return state.members().list();
  }

  public boolean isMember(PrincipalId principal) {
    return state.members().isMember(principal);
  }

  public ActionSnapshot getAction(long id) {
    return actions.get(id).snapshot();
  }

  public int getActionCount() {
    return actions.count();
  }

  public boolean isActionApprovedBy(long id, PrincipalId member) {
    return actions.isApprovedBy(id, member);
  }

  public ProposalSnapshot getProposal(long id) {
    return proposals.get(id).snapshot();
  }

  public int getProposalCount() {
    return proposals.count();
  }

  public boolean isProposalApprovedBy(long id, PrincipalId member) {
    return proposals.isApprovedBy(id, member);
  }

  public Amount getBalance() {
    return state.ledger().balance();
  }

  public Amount contributionOf(PrincipalId member) {
    return state.ledger().contributionOf(member);
  }

  public Amount totalWeight() {
    return state.ledger().totalWeight();
  }

  public QuorumConfig getQuorumConfig() {
    return state.quorumConfig();
  }

  private void requireMember(PrincipalId caller) {
    if (caller == null || !state.members().isMember(caller)) {
      throw new AuthorizationException(caller == null ? "anonymous" : caller.value());
    }
  }
}
