package pooled.treasury.error.exception;

import pooled.treasury.error.CommonErrorCode;
import pooled.treasury.error.exception.base.ClientBaseException;

public class AlreadyExecutedException extends ClientBaseException {

  public AlreadyExecutedException(String recordKind, long id) {
    super(CommonErrorCode.ALREADY_EXECUTED, recordKind, id);
  }
}
