package pooled.treasury.error.exception;

import pooled.treasury.error.CommonErrorCode;
import pooled.treasury.error.exception.base.ClientBaseException;

/**
 * 레코드 인덱스 범위 초과
 *
 * <p>CommonErrorCode.RECORD_NOT_FOUND 메시지 형식: "존재하지 않는 %s 입니다 (id: %s)"
 */
public class NotFoundException extends ClientBaseException {

  /**
   * @param recordKind 레코드 종류 (action / proposal)
   * @param id 요청한 인덱스
   */
  public NotFoundException(String recordKind, long id) {
    super(CommonErrorCode.RECORD_NOT_FOUND, recordKind, id);
  }
}
