package pooled.treasury.global.response;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 금고 API 성공 응답 포맷
 *
 * <p>거절/실패 응답은 {@link pooled.treasury.error.dto.ErrorResponse}로 나갑니다.
 *
 * @param success 항상 true
 * @param data 조회 스냅샷 또는 명령 결과
 * @param <T> 응답 데이터 타입
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, T data) {

  public static <T> ApiResponse<T> success(T data) {
    return new ApiResponse<>(true, data);
  }
}
