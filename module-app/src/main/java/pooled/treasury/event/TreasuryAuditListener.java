package pooled.treasury.event;

import lombok.extern.slf4j.Slf4j;
import pooled.treasury.domain.event.ActionExecuted;
import pooled.treasury.domain.event.DepositReceived;
import pooled.treasury.domain.event.ProposalExecuted;
import pooled.treasury.domain.event.TreasuryEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** 모든 거버넌스 알림을 INFO로 기록 */
@Slf4j
@Component
public class TreasuryAuditListener {

  @EventListener
  public void onEvent(TreasuryEvent event) {
    if (event instanceof DepositReceived deposit) {
      log.info(
          "[Audit] {} sender={}, amount={}, balance={}",
          event.eventName(),
          deposit.sender(),
          deposit.amount(),
          deposit.balance());
    } else if (event instanceof ActionExecuted executed) {
      log.info(
          "[Audit] {} id={}, executor={}, target={}, value={}",
          event.eventName(),
          executed.actionId(),
          executed.executor(),
          executed.call().target(),
          executed.call().value());
    } else if (event instanceof ProposalExecuted executed) {
      log.info(
          "[Audit] {} id={}, executor={}, change={}",
          event.eventName(),
          executed.proposalId(),
          executed.executor(),
          executed.change());
    } else {
      log.info("[Audit] {}", event);
    }
  }
}
