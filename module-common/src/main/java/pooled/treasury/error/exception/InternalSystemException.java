package pooled.treasury.error.exception;

import pooled.treasury.error.CommonErrorCode;
import pooled.treasury.error.exception.base.ServerBaseException;

/** 도메인 예외가 아닌 기술적 실패를 감싸는 예외 (ExceptionTranslator 기본 변환 대상) */
public class InternalSystemException extends ServerBaseException {

  public InternalSystemException(String taskName, Throwable cause) {
    super(CommonErrorCode.INTERNAL_TASK_FAILURE, cause, taskName);
  }
}
