package pooled.treasury.domain.model.money;

import java.math.BigInteger;
import java.util.Objects;
import pooled.treasury.error.exception.ArithmeticOverflowException;
import pooled.treasury.error.exception.InvalidInputException;

/**
 * 256비트 무부호 금액 (Value Object)
 *
 * <p>기여금, 투표 가중치, 금고 잔액이 모두 이 단위를 씁니다. 모든 연산은 [0, 2^256-1] 범위를 검사하며, 범위를 벗어나면 {@link
 * ArithmeticOverflowException}을 던집니다.
 */
public record Amount(BigInteger value) implements Comparable<Amount> {

  public static final BigInteger MAX_VALUE = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);
  public static final Amount ZERO = new Amount(BigInteger.ZERO);

  public Amount {
    Objects.requireNonNull(value, "Amount value cannot be null");
    if (value.signum() < 0) {
      throw new InvalidInputException("amount must not be negative: " + value);
    }
    if (value.compareTo(MAX_VALUE) > 0) {
      throw new ArithmeticOverflowException("amount exceeds uint256: " + value);
    }
  }

  public static Amount of(long value) {
    return new Amount(BigInteger.valueOf(value));
  }

  public static Amount of(BigInteger value) {
    return new Amount(value);
  }

  /**
   * 10진 문자열 파싱 (외부 입력용)
   *
   * <p>숫자가 아니거나 uint256 범위를 벗어나면 InvalidInputException. 연산 overflow와 구분합니다.
   */
  public static Amount parse(String decimal) {
    if (decimal == null) {
      throw new InvalidInputException("amount is required");
    }
    BigInteger parsed;
    try {
      parsed = new BigInteger(decimal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidInputException("amount is not a decimal integer: " + decimal);
    }
    if (parsed.compareTo(MAX_VALUE) > 0) {
      throw new InvalidInputException("amount exceeds uint256: " + decimal);
    }
    return new Amount(parsed);
  }

  public Amount plus(Amount other) {
    BigInteger sum = value.add(other.value);
    if (sum.compareTo(MAX_VALUE) > 0) {
      throw new ArithmeticOverflowException(value + " + " + other.value);
    }
    return new Amount(sum);
  }

  public Amount minus(Amount other) {
    if (value.compareTo(other.value) < 0) {
      throw new ArithmeticOverflowException(value + " - " + other.value);
    }
    return new Amount(value.subtract(other.value));
  }

  public Amount times(long factor) {
    if (factor < 0) {
      throw new InvalidInputException("factor must not be negative: " + factor);
    }
    BigInteger product = value.multiply(BigInteger.valueOf(factor));
    if (product.compareTo(MAX_VALUE) > 0) {
      throw new ArithmeticOverflowException(value + " * " + factor);
    }
    return new Amount(product);
  }

  /** 0 방향 절사 나눗셈 */
  public Amount dividedBy(long divisor) {
    if (divisor <= 0) {
      throw new InvalidInputException("divisor must be positive: " + divisor);
    }
    return new Amount(value.divide(BigInteger.valueOf(divisor)));
  }

  public boolean isGreaterThan(Amount other) {
    return compareTo(other) > 0;
  }

  @Override
  public int compareTo(Amount other) {
    return value.compareTo(other.value);
  }

  @Override
  public String toString() {
    return value.toString();
  }
}
