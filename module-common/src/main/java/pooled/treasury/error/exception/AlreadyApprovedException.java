package pooled.treasury.error.exception;

import pooled.treasury.error.CommonErrorCode;
import pooled.treasury.error.exception.base.ClientBaseException;

/** 같은 멤버의 중복 승인 */
public class AlreadyApprovedException extends ClientBaseException {

  public AlreadyApprovedException(String recordKind, long id, String member) {
    super(CommonErrorCode.ALREADY_APPROVED, recordKind, id, member);
  }
}
