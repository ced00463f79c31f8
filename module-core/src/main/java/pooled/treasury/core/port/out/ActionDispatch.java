package pooled.treasury.core.port.out;

import pooled.treasury.domain.model.action.ActionCall;

/**
 * 외부로 전달되는 송금 지시
 *
 * @param actionId 실행 중인 Action id
 * @param call 대상, 금액, 불투명 데이터
 */
public record ActionDispatch(long actionId, ActionCall call) {}
