package pooled.treasury.error.exception;

import pooled.treasury.error.CommonErrorCode;
import pooled.treasury.error.exception.base.ClientBaseException;

/** 초기 구성 검증 실패 (빈 멤버 목록, 중복 멤버, 범위 밖 임계값) */
public class InvalidConfigException extends ClientBaseException {

  public InvalidConfigException(String reason) {
    super(CommonErrorCode.INVALID_CONFIG, reason);
  }
}
