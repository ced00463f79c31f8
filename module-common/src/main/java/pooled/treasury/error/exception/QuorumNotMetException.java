package pooled.treasury.error.exception;

import pooled.treasury.error.CommonErrorCode;
import pooled.treasury.error.exception.base.ClientBaseException;

/**
 * 정족수 미달 실행 시도
 *
 * <p>재시도는 호출자 몫입니다. 승인이 더 모이거나 설정이 바뀐 뒤 다시 실행할 수 있습니다.
 */
public class QuorumNotMetException extends ClientBaseException {

  public QuorumNotMetException(String recordKind, long id, String mode) {
    super(CommonErrorCode.QUORUM_NOT_MET, recordKind, id, mode);
  }
}
