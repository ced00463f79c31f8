package pooled.treasury.error.exception;

import pooled.treasury.error.CommonErrorCode;
import pooled.treasury.error.exception.base.ServerBaseException;

/**
 * 액션 실행 효과(외부 호출, 잔액 출금) 실패
 *
 * <p>이 예외가 전파되면 해당 액션은 executed=false 상태로 남아 있어 재실행할 수 있습니다.
 */
public class EffectDispatchFailedException extends ServerBaseException {

  public EffectDispatchFailedException(long actionId, String reason) {
    super(CommonErrorCode.EFFECT_DISPATCH_FAILED, actionId, reason);
  }

  // cause를 포함하여 예외 체이닝 지원
  public EffectDispatchFailedException(long actionId, String reason, Throwable cause) {
    super(CommonErrorCode.EFFECT_DISPATCH_FAILED, cause, actionId, reason);
  }
}
