package pooled.treasury.error.exception;

import pooled.treasury.error.CommonErrorCode;
import pooled.treasury.error.exception.base.ClientBaseException;

public class InvalidInputException extends ClientBaseException {

  public InvalidInputException(String detail) {
    super(CommonErrorCode.INVALID_INPUT_VALUE, detail);
  }
}
