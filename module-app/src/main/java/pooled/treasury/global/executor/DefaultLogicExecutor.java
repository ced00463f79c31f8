package pooled.treasury.global.executor;

import java.util.Objects;
import java.util.function.Function;
import pooled.treasury.global.executor.function.ThrowingSupplier;
import pooled.treasury.global.executor.strategy.ExceptionTranslator;
import org.springframework.stereotype.Component;

/**
 * LogicExecutor 기본 구현체
 *
 * <ul>
 *   <li><b>Error 즉시 rethrow</b>: VirtualMachineError 등은 번역 없이 전파
 *   <li><b>BaseException pass-through</b>: 도메인 예외는 그대로 전파
 *   <li><b>나머지 예외</b>: {@link ExceptionTranslator#defaultTranslator()}로 InternalSystemException 변환
 * </ul>
 */
@Component
public class DefaultLogicExecutor implements LogicExecutor {

  private static final String UNEXPECTED_TRANSLATOR_FAILURE =
      "Translator failed with unexpected Throwable";

  private final ExceptionTranslator translator;

  public DefaultLogicExecutor() {
    this(ExceptionTranslator.defaultTranslator());
  }

  DefaultLogicExecutor(ExceptionTranslator translator) {
    this.translator = translator;
  }

  @Override
  public <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(recovery, "recovery");
    Objects.requireNonNull(context, "context");

    try {
      return task.get();
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      return recovery.apply(translateSafe(translator, t, context));
    }
  }

  @Override
  public <T> T executeWithFinally(
      ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(finallyBlock, "finallyBlock");
    Objects.requireNonNull(context, "context");

    T result;
    try {
      result = task.get();
    } catch (Error e) {
      runCleanupSuppressing(e, finallyBlock);
      throw e;
    } catch (Throwable t) {
      RuntimeException primary = translateSafe(translator, t, context);
      runCleanupSuppressing(primary, finallyBlock);
      throw primary;
    }
    finallyBlock.run();
    return result;
  }

  @Override
  public <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator customTranslator, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(customTranslator, "customTranslator");
    Objects.requireNonNull(context, "context");

    try {
      return task.get();
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      throw translateSafe(customTranslator, t, context);
    }
  }

  /** translator 자체가 RuntimeException으로 실패하면 그 예외를 primary로 삼는다. */
  private static RuntimeException translateSafe(
      ExceptionTranslator translator, Throwable t, TaskContext context) {
    try {
      RuntimeException translated = translator.translate(t, context);
      return translated != null
          ? translated
          : new IllegalStateException(UNEXPECTED_TRANSLATOR_FAILURE, t);
    } catch (RuntimeException ex) {
      return ex;
    }
  }

  /** 정리 중 예외가 나와도 primary를 덮지 않고 suppressed로만 합류시킨다. */
  private static void runCleanupSuppressing(Throwable primary, Runnable finallyBlock) {
    try {
      finallyBlock.run();
    } catch (RuntimeException cleanupEx) {
      if (primary != cleanupEx) {
        primary.addSuppressed(cleanupEx);
      }
    }
  }
}
