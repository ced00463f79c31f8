package pooled.treasury.support;

import java.util.function.Function;
import pooled.treasury.global.executor.LogicExecutor;
import pooled.treasury.global.executor.TaskContext;
import pooled.treasury.global.executor.function.ThrowingSupplier;
import pooled.treasury.global.executor.strategy.ExceptionTranslator;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;

/**
 * 작업을 그대로 실행하는 LogicExecutor mock
 *
 * <p>모든 메서드는 lenient()로 stub 되며, 예외 변환 없이 task를 직접 실행합니다. 예외 변환 자체를 검증할 때는 {@code
 * DefaultLogicExecutor}를 쓰세요.
 */
public final class TestLogicExecutors {

  private TestLogicExecutors() {}

  public static LogicExecutor passThrough() {
    LogicExecutor mock = Mockito.mock(LogicExecutor.class);

    Mockito.lenient()
        .when(
            mock.executeOrCatch(
                ArgumentMatchers.<ThrowingSupplier<Object>>any(),
                ArgumentMatchers.<Function<Throwable, Object>>any(),
                ArgumentMatchers.<TaskContext>any()))
        .thenAnswer(
            invocation -> {
              ThrowingSupplier<Object> task = invocation.getArgument(0);
              Function<Throwable, Object> recovery = invocation.getArgument(1);
              try {
                return task.get();
              } catch (Throwable t) {
                return recovery.apply(t);
              }
            });

    Mockito.lenient()
        .when(
            mock.executeWithFinally(
                ArgumentMatchers.<ThrowingSupplier<Object>>any(),
                ArgumentMatchers.<Runnable>any(),
                ArgumentMatchers.<TaskContext>any()))
        .thenAnswer(
            invocation -> {
              ThrowingSupplier<Object> task = invocation.getArgument(0);
              Runnable finallyBlock = invocation.getArgument(1);
              try {
                return task.get();
              } finally {
                finallyBlock.run();
              }
            });

    Mockito.lenient()
        .when(
            mock.executeWithTranslation(
                ArgumentMatchers.<ThrowingSupplier<Object>>any(),
                ArgumentMatchers.<ExceptionTranslator>any(),
                ArgumentMatchers.<TaskContext>any()))
        .thenAnswer(
            invocation -> {
              ThrowingSupplier<Object> task = invocation.getArgument(0);
              ExceptionTranslator translator = invocation.getArgument(1);
              try {
                return task.get();
              } catch (Throwable t) {
                throw translator.translate(t, invocation.getArgument(2));
              }
            });

    return mock;
  }
}
