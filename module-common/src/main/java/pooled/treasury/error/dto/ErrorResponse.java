package pooled.treasury.error.dto;

import java.time.LocalDateTime;
import lombok.Builder;
import org.springframework.http.ResponseEntity;
import pooled.treasury.error.ErrorCode;
import pooled.treasury.error.exception.base.BaseException;

public record ErrorResponse(int status, String code, String message, LocalDateTime timestamp) {

  @Builder
  public ErrorResponse {}

  /**
   * [방법 1] BaseException을 받는 경우 (비즈니스 예외)
   *
   * <p>e.getMessage()를 통해 동적으로 가공된 메시지(예: 어떤 레코드, 어떤 멤버인지)를 전달합니다.
   */
  public static ResponseEntity<ErrorResponse> toResponseEntity(BaseException e) {
    return ResponseEntity.status(e.getErrorCode().getStatus())
        .body(
            ErrorResponse.builder()
                .status(e.getErrorCode().getStatusCode())
                .code(e.getErrorCode().getCode())
                .message(e.getMessage())
                .timestamp(LocalDateTime.now())
                .build());
  }

  /**
   * [방법 2] ErrorCode를 직접 받는 경우 (예상치 못한 서버 예외)
   *
   * <p>Enum에 정의된 기본 메시지를 사용하며, 상세한 에러 내용은 보안을 위해 숨깁니다.
   */
  public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode) {
    return ResponseEntity.status(errorCode.getStatus())
        .body(
            ErrorResponse.builder()
                .status(errorCode.getStatusCode())
                .code(errorCode.getCode())
                .message(errorCode.getMessage())
                .timestamp(LocalDateTime.now())
                .build());
  }

  /** 검증 실패처럼 코드는 고정이고 상세 메시지만 다른 경우 */
  public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode, String detail) {
    return ResponseEntity.status(errorCode.getStatus())
        .body(
            ErrorResponse.builder()
                .status(errorCode.getStatusCode())
                .code(errorCode.getCode())
                .message(String.format(errorCode.getMessage(), detail))
                .timestamp(LocalDateTime.now())
                .build());
  }
}
