package pooled.treasury.core.port.out;

/**
 * Action 실행 효과 전달 전략 (Strategy Pattern)
 *
 * <p>엔진은 이 포트를 동기 호출하고 결과를 해석합니다. 실패 결과를 반환하거나 예외를 던지면 Action 실행 전체가 롤백됩니다(출금 환원, executed=false).
 *
 * <h3>구현체 목록:</h3>
 *
 * <ul>
 *   <li>JournalActionEffectDispatcher - 내부 지급 장부 기록 (기본값)
 *   <li>WebhookActionEffectDispatcher - 외부 지급 엔드포인트 HTTP 호출
 * </ul>
 */
public interface ActionEffectDispatcher {

  /**
   * 송금 지시 전달
   *
   * @param dispatch 실행할 Action의 id와 payload
   * @return 전달 결과
   */
  EffectOutcome dispatch(ActionDispatch dispatch);

  /**
   * 전달 방식 이름 (로깅용)
   *
   * @return 전달 방식 이름 (예: "JOURNAL", "WEBHOOK")
   */
  default String getDispatcherName() {
    return this.getClass().getSimpleName();
  }
}
