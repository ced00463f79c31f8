package pooled.treasury.effect;

import java.time.Instant;
import pooled.treasury.core.port.out.ActionDispatch;

/**
 * 지급 장부 한 줄
 *
 * @param actionId 실행된 Action id
 * @param target 지급 대상
 * @param value 지급액 (10진 문자열)
 * @param data 전달 바이트 (hex)
 * @param recordedAt 기록 시각
 */
public record PayoutEntry(
    long actionId, String target, String value, String data, Instant recordedAt) {

  static PayoutEntry from(ActionDispatch dispatch, Instant recordedAt) {
    return new PayoutEntry(
        dispatch.actionId(),
        dispatch.call().target().value(),
        dispatch.call().value().toString(),
        dispatch.call().dataHex(),
        recordedAt);
  }
}
