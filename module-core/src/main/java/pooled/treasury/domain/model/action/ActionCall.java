package pooled.treasury.domain.model.action;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;
import pooled.treasury.domain.model.money.Amount;
import pooled.treasury.domain.model.principal.PrincipalId;

/**
 * 송금 요청 payload (제출 후 불변)
 *
 * @param target 송금/호출 대상
 * @param value 출금액
 * @param data 대상에게 그대로 전달되는 불투명 바이트
 */
public record ActionCall(PrincipalId target, Amount value, byte[] data) {

  public ActionCall {
    Objects.requireNonNull(target, "target cannot be null");
    Objects.requireNonNull(value, "value cannot be null");
    data = data == null ? new byte[0] : data.clone();
  }

  @Override
  public byte[] data() {
    return data.clone();
  }

  public String dataHex() {
    return HexFormat.of().formatHex(data);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ActionCall other)) return false;
    return target.equals(other.target) && value.equals(other.value) && Arrays.equals(data, other.data);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(target, value) + Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    return "ActionCall[target=" + target + ", value=" + value + ", data=0x" + dataHex() + "]";
  }
}
