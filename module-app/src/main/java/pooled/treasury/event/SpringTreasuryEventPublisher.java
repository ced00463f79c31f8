package pooled.treasury.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import pooled.treasury.core.port.out.TreasuryEventPublisher;
import pooled.treasury.domain.event.TreasuryEvent;
import pooled.treasury.global.executor.LogicExecutor;
import pooled.treasury.global.executor.TaskContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * 거버넌스 알림을 Spring ApplicationEvent로 전달하는 어댑터
 *
 * <p>엔진은 상태 변경이 끝난 뒤에만 발행합니다. 리스너가 실패해도 이미 반영된 상태는 되돌리지 않고 ERROR 로그만 남깁니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpringTreasuryEventPublisher implements TreasuryEventPublisher {

  private final ApplicationEventPublisher applicationEventPublisher;
  private final LogicExecutor executor;

  @Override
  public void publish(TreasuryEvent event) {
    executor.executeOrCatch(
        () -> {
          applicationEventPublisher.publishEvent(event);
          return Boolean.TRUE;
        },
        e -> {
          log.error("[Treasury] Listener failed after commit: event={}", event, e);
          return Boolean.FALSE;
        },
        TaskContext.of("Treasury", "publish", event.eventName()));
  }
}
