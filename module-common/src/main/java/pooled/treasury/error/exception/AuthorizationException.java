package pooled.treasury.error.exception;

import pooled.treasury.error.CommonErrorCode;
import pooled.treasury.error.exception.base.ClientBaseException;

/** 멤버가 아닌 호출자가 변경 명령을 시도 */
public class AuthorizationException extends ClientBaseException {

  public AuthorizationException(String caller) {
    super(CommonErrorCode.CALLER_NOT_MEMBER, caller);
  }
}
