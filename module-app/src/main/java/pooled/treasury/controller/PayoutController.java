package pooled.treasury.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import lombok.RequiredArgsConstructor;
import pooled.treasury.effect.JournalActionEffectDispatcher;
import pooled.treasury.effect.PayoutEntry;
import pooled.treasury.global.response.ApiResponse;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** 내부 지급 장부 조회. webhook 모드에서는 항상 빈 목록 */
@RestController
@RequestMapping("/api/v1/treasury")
@RequiredArgsConstructor
@Tag(name = "Treasury", description = "공동 금고 거버넌스 API")
public class PayoutController {

  private final ObjectProvider<JournalActionEffectDispatcher> journal;

  @GetMapping("/payouts")
  @Operation(summary = "지급 장부", description = "실행된 Action의 지급 기록을 실행 순서대로 반환합니다.")
  public ResponseEntity<ApiResponse<List<PayoutEntry>>> getPayouts() {
    JournalActionEffectDispatcher dispatcher = journal.getIfAvailable();
    List<PayoutEntry> entries = dispatcher == null ? List.of() : dispatcher.entries();
    return ResponseEntity.ok(ApiResponse.success(entries));
  }
}
