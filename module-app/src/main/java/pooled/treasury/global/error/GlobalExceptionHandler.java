package pooled.treasury.global.error;

import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import pooled.treasury.error.CommonErrorCode;
import pooled.treasury.error.dto.ErrorResponse;
import pooled.treasury.error.exception.base.BaseException;
import pooled.treasury.error.exception.base.ServerBaseException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  /**
   * 거버넌스 거절 및 도메인 예외
   *
   * <p>BaseException 자체를 넘겨 어떤 레코드, 어떤 멤버인지 담긴 메시지를 그대로 응답합니다.
   */
  @ExceptionHandler(BaseException.class)
  protected ResponseEntity<ErrorResponse> handleBaseException(BaseException e) {
    if (e instanceof ServerBaseException) {
      log.error(
          "[Treasury] Server Exception: {} | Message: {}",
          e.getErrorCode().getCode(),
          e.getMessage(),
          e);
    } else {
      log.warn("[Treasury] Rejected: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage());
    }
    return ErrorResponse.toResponseEntity(e);
  }

  /** @Valid 검증 실패 → C001 */
  @ExceptionHandler(MethodArgumentNotValidException.class)
  protected ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
    String detail =
        e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    log.warn("[Treasury] Invalid request: {}", detail);
    return ErrorResponse.toResponseEntity(CommonErrorCode.INVALID_INPUT_VALUE, detail);
  }

  /** 본문 파싱 실패, 경로 변수 타입 불일치 → C001 */
  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MethodArgumentTypeMismatchException.class
  })
  protected ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
    log.warn("[Treasury] Unreadable request: {}", e.getMessage());
    return ErrorResponse.toResponseEntity(CommonErrorCode.INVALID_INPUT_VALUE, "malformed request");
  }

  /** 예측하지 못한 시스템 예외. 상세 메시지는 숨기고 공통 코드만 응답합니다. */
  @ExceptionHandler(Exception.class)
  protected ResponseEntity<ErrorResponse> handleException(Exception e) {
    log.error("[Treasury] Unexpected System Failure: ", e);
    return ErrorResponse.toResponseEntity(CommonErrorCode.INTERNAL_SERVER_ERROR);
  }
}
