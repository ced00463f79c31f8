package pooled.treasury.core.port.out;

import pooled.treasury.domain.event.TreasuryEvent;

/**
 * 거버넌스 알림 발행 포트
 *
 * <p>엔진은 상태 변경이 끝난 뒤에만 호출합니다. 구현체는 동기 방식이어야 하며 알림 순서는 명령 순서와 같습니다.
 */
public interface TreasuryEventPublisher {

  void publish(TreasuryEvent event);

  static TreasuryEventPublisher noop() {
    return event -> {};
  }
}
