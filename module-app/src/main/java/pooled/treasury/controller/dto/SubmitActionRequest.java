package pooled.treasury.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import java.util.HexFormat;
import pooled.treasury.domain.model.money.Amount;
import pooled.treasury.domain.model.principal.PrincipalId;

/**
 * Action 제출 요청 DTO
 *
 * @param target 송금 대상 id
 * @param value 출금액 (10진 문자열)
 * @param data 전달 바이트 (hex, 0x 접두어 허용, 생략 시 빈 값)
 */
public record SubmitActionRequest(
    @NotBlank(message = "target은 필수입니다") String target,
    @NotBlank(message = "value는 필수입니다")
        @Pattern(regexp = "^[0-9]+$", message = "value는 10진 정수만 허용됩니다")
        String value,
    @Pattern(
            regexp = "^(0x)?([0-9a-fA-F]{2})*$",
            message = "data는 짝수 길이의 16진수만 허용됩니다")
        String data) {

  public PrincipalId toTarget() {
    return PrincipalId.of(target);
  }

  public Amount toValue() {
    return Amount.parse(value);
  }

  public byte[] toData() {
    if (data == null || data.isEmpty()) {
      return new byte[0];
    }
    String hex = data.startsWith("0x") ? data.substring(2) : data;
    return HexFormat.of().parseHex(hex);
  }
}
