package pooled.treasury.error.exception;

import pooled.treasury.error.CommonErrorCode;
import pooled.treasury.error.exception.base.ClientBaseException;

/** 승인 이력 없이 철회 시도 */
public class NotApprovedException extends ClientBaseException {

  public NotApprovedException(String recordKind, long id, String member) {
    super(CommonErrorCode.NOT_APPROVED, recordKind, id, member);
  }
}
