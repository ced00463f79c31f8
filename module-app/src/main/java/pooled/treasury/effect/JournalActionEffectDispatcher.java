package pooled.treasury.effect;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.slf4j.Slf4j;
import pooled.treasury.core.port.out.ActionDispatch;
import pooled.treasury.core.port.out.ActionEffectDispatcher;
import pooled.treasury.core.port.out.EffectOutcome;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 내부 지급 장부 전달 (기본값)
 *
 * <p>외부 연동 없이 실행된 지급을 메모리 장부에 순서대로 기록합니다. 기록은 실패하지 않습니다.
 */
@Slf4j
@Component
@ConditionalOnProperty(
    name = "treasury.effect.type",
    havingValue = "journal",
    matchIfMissing = true)
public class JournalActionEffectDispatcher implements ActionEffectDispatcher {

  private final List<PayoutEntry> journal = new CopyOnWriteArrayList<>();
  private final Clock clock;

  public JournalActionEffectDispatcher() {
    this(Clock.systemUTC());
  }

  JournalActionEffectDispatcher(Clock clock) {
    this.clock = clock;
  }

  @Override
  public EffectOutcome dispatch(ActionDispatch dispatch) {
    PayoutEntry entry = PayoutEntry.from(dispatch, clock.instant());
    journal.add(entry);
    log.info(
        "[Effect] Payout journaled: actionId={}, target={}, value={}",
        entry.actionId(),
        entry.target(),
        entry.value());
    return EffectOutcome.delivered();
  }

  @Override
  public String getDispatcherName() {
    return "JOURNAL";
  }

  /** 기록 순서대로 정렬된 불변 사본 */
  public List<PayoutEntry> entries() {
    return List.copyOf(journal);
  }
}
