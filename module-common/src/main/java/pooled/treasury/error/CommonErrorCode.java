package pooled.treasury.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 금고 거버넌스 공통 에러 코드
 *
 * <p>C 계열은 호출자가 원인을 해소할 수 있는 거절(4xx), S 계열은 서버 측 장애(5xx)입니다. 메시지는 {@link String#format} 인자를 받습니다.
 */
@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Client Errors (4xx) ===
  INVALID_INPUT_VALUE("C001", "잘못된 입력값입니다: %s", HttpStatus.BAD_REQUEST),
  CALLER_NOT_MEMBER("C002", "멤버만 호출할 수 있습니다 (caller: %s)", HttpStatus.FORBIDDEN),
  RECORD_NOT_FOUND("C003", "존재하지 않는 %s 입니다 (id: %s)", HttpStatus.NOT_FOUND),
  ALREADY_EXECUTED("C004", "이미 실행된 %s 입니다 (id: %s)", HttpStatus.CONFLICT),
  ALREADY_APPROVED("C005", "이미 승인한 %s 입니다 (id: %s, member: %s)", HttpStatus.CONFLICT),
  NOT_APPROVED("C006", "승인하지 않은 %s 입니다 (id: %s, member: %s)", HttpStatus.CONFLICT),
  DUPLICATE_MEMBER("C007", "이미 등록된 멤버입니다 (member: %s)", HttpStatus.CONFLICT),
  NOT_MEMBER("C008", "멤버가 아닙니다 (member: %s)", HttpStatus.NOT_FOUND),
  QUORUM_NOT_MET("C009", "정족수 미달로 실행할 수 없습니다 (%s id: %s, mode: %s)", HttpStatus.CONFLICT),
  INVALID_CONFIG("C010", "잘못된 거버넌스 설정입니다: %s", HttpStatus.BAD_REQUEST),

  // === Server Errors (5xx) ===
  INTERNAL_SERVER_ERROR("S001", "서버 내부 오류가 발생했습니다.", HttpStatus.INTERNAL_SERVER_ERROR),
  ARITHMETIC_OVERFLOW("S002", "금액 연산 범위를 벗어났습니다 (%s)", HttpStatus.INTERNAL_SERVER_ERROR),
  EFFECT_DISPATCH_FAILED("S003", "실행 효과 전달에 실패했습니다 (action id: %s, 사유: %s)", HttpStatus.BAD_GATEWAY),
  INTERNAL_TASK_FAILURE("S004", "작업 처리 중 오류 발생 (%s)", HttpStatus.INTERNAL_SERVER_ERROR);

  private final String code;
  private final String message;
  private final HttpStatus status;
}
