package pooled.treasury.error.exception;

import pooled.treasury.error.CommonErrorCode;
import pooled.treasury.error.exception.base.ServerBaseException;

/** 256비트 무부호 금액 연산의 overflow / underflow */
public class ArithmeticOverflowException extends ServerBaseException {

  public ArithmeticOverflowException(String operation) {
    super(CommonErrorCode.ARITHMETIC_OVERFLOW, operation);
  }
}
