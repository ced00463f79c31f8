package pooled.treasury.error.exception.base;

import pooled.treasury.error.ErrorCode;

/**
 * ClientBaseException: 호출자의 요청이 현재 거버넌스 상태와 맞지 않을 때 발생하는 '비즈니스 예외' 4xx 계열의 에러를 처리하며, 호출자에게 구체적인
 * 거절 사유를 전달하는 것이 목적입니다.
 */
public abstract class ClientBaseException extends BaseException {

  // 기본 생성자: 고정된 에러 메시지를 사용할 때
  public ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  // 동적 인자를 받는 생성자: "이미 승인한 action 입니다 (id: %s, member: %s)" 같은 메시지 완성
  public ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
