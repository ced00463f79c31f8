package pooled.treasury.global.executor.strategy;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import pooled.treasury.error.exception.InternalSystemException;
import pooled.treasury.error.exception.base.BaseException;
import pooled.treasury.global.executor.TaskContext;

/** 특정 예외를 도메인 예외로 변환하는 전략 */
@FunctionalInterface
public interface ExceptionTranslator {

  /**
   * 예외를 변환하여 반환
   *
   * @param e 원본 예외
   * @param context 작업 컨텍스트
   * @return 변환된 RuntimeException
   */
  RuntimeException translate(Throwable e, TaskContext context);

  /**
   * Error guard + async unwrap을 선행 적용하는 Decorator
   *
   * <ol>
   *   <li>Error → 즉시 rethrow
   *   <li>CompletionException/ExecutionException → 원본으로 unwrap
   *   <li>BaseException → 그대로 반환
   *   <li>나머지는 내부 translator에 위임
   * </ol>
   */
  static ExceptionTranslator withErrorGuardAndUnwrap(ExceptionTranslator inner) {
    return (e, context) -> {
      if (e instanceof Error err) {
        throw err;
      }
      Throwable unwrapped = unwrap(e);
      if (unwrapped instanceof BaseException be) {
        return be;
      }
      return inner.translate(unwrapped, context);
    };
  }

  /** 기본 예외 변환기 */
  static ExceptionTranslator defaultTranslator() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) ->
            new InternalSystemException("default-task:" + context.toTaskName(), unwrapped));
  }

  /**
   * 애플리케이션 시작 시 초기화 작업용 예외 변환기
   *
   * @param componentName 초기화 중인 컴포넌트 이름
   */
  static ExceptionTranslator forStartup(String componentName) {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) ->
            new InternalSystemException(
                "startup:" + componentName + ":" + context.operation(), unwrapped));
  }

  private static Throwable unwrap(Throwable e) {
    Throwable current = e;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
