package pooled.treasury.domain.model.principal;

import pooled.treasury.error.exception.InvalidInputException;

/**
 * 주체 식별자 (Value Object)
 *
 * <p>멤버와 외부 송금 대상 모두 이 타입으로 표현합니다. 값 자체는 불투명한 문자열이며 정규화하지 않습니다.
 */
public record PrincipalId(String value) {

  public PrincipalId {
    if (value == null || value.isBlank()) {
      throw new InvalidInputException("principal id must not be blank");
    }
  }

  public static PrincipalId of(String value) {
    return new PrincipalId(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
