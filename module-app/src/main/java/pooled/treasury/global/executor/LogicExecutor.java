package pooled.treasury.global.executor;

import java.util.function.Function;
import pooled.treasury.global.executor.function.ThrowingSupplier;
import pooled.treasury.global.executor.strategy.ExceptionTranslator;

/**
 * 예외 처리 패턴을 추상화한 실행기
 *
 * <p>비즈니스 로직은 별도 메서드로 분리하고 메서드 참조({@code this::method})로 넘기세요. 도메인 예외({@code
 * BaseException})는 그대로 전파되고, 그 외 예외는 {@link ExceptionTranslator}로 변환됩니다.
 *
 * <h3>지원 패턴</h3>
 *
 * <ol>
 *   <li><b>try-catch-recover</b> - {@link #executeOrCatch}
 *   <li><b>try-finally</b> - {@link #executeWithFinally}
 *   <li><b>다중 catch</b> - {@link #executeWithTranslation}
 * </ol>
 *
 * <pre>{@code
 * return executor.executeWithFinally(
 *     this::loadSnapshot, lock::unlock, TaskContext.of("Treasury", "getAction", id));
 * }</pre>
 */
public interface LogicExecutor {

  /**
   * 예외 발생 시 복구 함수 실행
   *
   * <p>recovery는 변환된 예외를 받습니다.
   */
  <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context);

  /**
   * 작업 후 반드시 실행할 정리 작업 지정
   *
   * <p>예외는 기본 변환기로 변환해 전파합니다. 정리 작업에서 난 예외는 원래 예외를 덮지 않고 suppressed로 합류합니다.
   *
   * @param task 실행할 작업
   * @param finallyBlock 성공/실패와 무관하게 한 번 실행할 정리 작업
   * @param context 작업 컨텍스트
   * @return 작업 결과
   */
  <T> T executeWithFinally(ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context);

  /** 기본 변환기 대신 지정한 변환기로 예외 변환 */
  <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context);
}
