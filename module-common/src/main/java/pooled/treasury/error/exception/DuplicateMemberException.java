package pooled.treasury.error.exception;

import pooled.treasury.error.CommonErrorCode;
import pooled.treasury.error.exception.base.ClientBaseException;

public class DuplicateMemberException extends ClientBaseException {

  public DuplicateMemberException(String member) {
    super(CommonErrorCode.DUPLICATE_MEMBER, member);
  }
}
