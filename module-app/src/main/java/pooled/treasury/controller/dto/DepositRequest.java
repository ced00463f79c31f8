package pooled.treasury.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import pooled.treasury.domain.model.money.Amount;

/**
 * 입금 요청 DTO
 *
 * <p>금액은 uint256 범위를 넘을 수 있으므로 10진 문자열로 받습니다.
 */
public record DepositRequest(
    @NotBlank(message = "amount는 필수입니다")
        @Pattern(regexp = "^[0-9]+$", message = "amount는 10진 정수만 허용됩니다")
        String amount) {

  public Amount toAmount() {
    return Amount.parse(amount);
  }
}
