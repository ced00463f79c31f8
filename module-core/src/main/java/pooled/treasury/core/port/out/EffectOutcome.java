package pooled.treasury.core.port.out;

/**
 * 외부 효과 전달 결과
 *
 * @param success 성공 여부
 * @param reason 실패 사유 (성공이면 null)
 */
public record EffectOutcome(boolean success, String reason) {

  public static EffectOutcome delivered() {
    return new EffectOutcome(true, null);
  }

  public static EffectOutcome failed(String reason) {
    return new EffectOutcome(false, reason);
  }
}
