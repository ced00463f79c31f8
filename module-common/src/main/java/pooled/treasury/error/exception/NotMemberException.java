package pooled.treasury.error.exception;

import pooled.treasury.error.CommonErrorCode;
import pooled.treasury.error.exception.base.ClientBaseException;

public class NotMemberException extends ClientBaseException {

  public NotMemberException(String member) {
    super(CommonErrorCode.NOT_MEMBER, member);
  }
}
