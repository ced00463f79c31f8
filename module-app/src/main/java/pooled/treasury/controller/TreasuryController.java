package pooled.treasury.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import pooled.treasury.controller.dto.ActionResponse;
import pooled.treasury.controller.dto.DepositRequest;
import pooled.treasury.controller.dto.ProposalResponse;
import pooled.treasury.controller.dto.SubmitActionRequest;
import pooled.treasury.controller.dto.SubmitProposalRequest;
import pooled.treasury.controller.dto.TreasuryViews.ApprovalStatus;
import pooled.treasury.controller.dto.TreasuryViews.BalanceView;
import pooled.treasury.controller.dto.TreasuryViews.ContributionView;
import pooled.treasury.controller.dto.TreasuryViews.DepositResult;
import pooled.treasury.controller.dto.TreasuryViews.QuorumView;
import pooled.treasury.controller.dto.TreasuryViews.RecordCount;
import pooled.treasury.controller.dto.TreasuryViews.RecordId;
import pooled.treasury.domain.model.money.Amount;
import pooled.treasury.domain.model.principal.PrincipalId;
import pooled.treasury.error.exception.InvalidInputException;
import pooled.treasury.global.response.ApiResponse;
import pooled.treasury.service.TreasuryService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 공동 금고 거버넌스 API
 *
 * <p>호출자는 {@code X-Member-Id} 헤더로 식별합니다. 헤더가 없으면 익명 호출로 처리되어 멤버 전용 명령은 403(C002)으로 거절됩니다.
 *
 * <p>API 목록:
 *
 * <ul>
 *   <li>POST /deposits - 입금 (누구나)
 *   <li>POST /actions, POST|DELETE /actions/{id}/approvals, POST /actions/{id}/execution
 *   <li>POST /proposals, POST|DELETE /proposals/{id}/approvals, POST /proposals/{id}/execution
 *   <li>GET /actions/{id}, /proposals/{id}, /members, /balance, /contributions/{member}, /quorum
 * </ul>
 */
@RestController
@RequestMapping("/api/v1/treasury")
@RequiredArgsConstructor
@Tag(name = "Treasury", description = "공동 금고 거버넌스 API")
public class TreasuryController {

  static final String MEMBER_HEADER = "X-Member-Id";

  private final TreasuryService treasuryService;

  // ==================== Deposit ====================

  @PostMapping("/deposits")
  @Operation(summary = "입금", description = "누구나 입금할 수 있으며, 멤버 입금만 투표 가중치가 됩니다.")
  public ResponseEntity<ApiResponse<DepositResult>> deposit(
      @RequestHeader(value = MEMBER_HEADER, required = false) String sender,
      @Valid @RequestBody DepositRequest request) {
    if (sender == null || sender.isBlank()) {
      throw new InvalidInputException(MEMBER_HEADER + " header is required for deposits");
    }
    Amount amount = request.toAmount();
    Amount balance = treasuryService.deposit(PrincipalId.of(sender), amount);
    return ResponseEntity.ok(
        ApiResponse.success(new DepositResult(sender, amount.toString(), balance.toString())));
  }

  // ==================== Actions ====================

  @PostMapping("/actions")
  @Operation(summary = "Action 제출", description = "금고 출금 요청을 제출합니다. 멤버 전용")
  public ResponseEntity<ApiResponse<RecordId>> submitAction(
      @RequestHeader(value = MEMBER_HEADER, required = false) String caller,
      @Valid @RequestBody SubmitActionRequest request) {
    long id =
        treasuryService.submitAction(
            principal(caller), request.toTarget(), request.toValue(), request.toData());
    return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(new RecordId(id)));
  }

  @PostMapping("/actions/{id}/approvals")
  @Operation(summary = "Action 승인")
  public ResponseEntity<ApiResponse<ActionResponse>> approveAction(
      @RequestHeader(value = MEMBER_HEADER, required = false) String caller,
      @PathVariable long id) {
    ActionResponse updated =
        ActionResponse.from(treasuryService.approveAction(principal(caller), id));
    return ResponseEntity.ok(ApiResponse.success(updated));
  }

  @DeleteMapping("/actions/{id}/approvals")
  @Operation(summary = "Action 승인 철회")
  public ResponseEntity<ApiResponse<ActionResponse>> revokeActionApproval(
      @RequestHeader(value = MEMBER_HEADER, required = false) String caller,
      @PathVariable long id) {
    ActionResponse updated =
        ActionResponse.from(treasuryService.revokeActionApproval(principal(caller), id));
    return ResponseEntity.ok(ApiResponse.success(updated));
  }

  @PostMapping("/actions/{id}/execution")
  @Operation(summary = "Action 실행", description = "정족수를 충족하면 출금 후 외부로 전달합니다. 한 번만 실행됩니다.")
  public ResponseEntity<ApiResponse<ActionResponse>> executeAction(
      @RequestHeader(value = MEMBER_HEADER, required = false) String caller,
      @PathVariable long id) {
    ActionResponse executed =
        ActionResponse.from(treasuryService.executeAction(principal(caller), id));
    return ResponseEntity.ok(ApiResponse.success(executed));
  }

  @GetMapping("/actions/{id}")
  @Operation(summary = "Action 조회")
  public ResponseEntity<ApiResponse<ActionResponse>> getAction(@PathVariable long id) {
    return ResponseEntity.ok(action(id));
  }

  @GetMapping("/actions/count")
  @Operation(summary = "Action 개수")
  public ResponseEntity<ApiResponse<RecordCount>> getActionCount() {
    return ResponseEntity.ok(
        ApiResponse.success(new RecordCount(treasuryService.getActionCount())));
  }

  @GetMapping("/actions/{id}/approvals/{member}")
  @Operation(summary = "멤버의 Action 승인 여부")
  public ResponseEntity<ApiResponse<ApprovalStatus>> isActionApprovedBy(
      @PathVariable long id, @PathVariable String member) {
    boolean approved = treasuryService.isActionApprovedBy(id, PrincipalId.of(member));
    return ResponseEntity.ok(ApiResponse.success(new ApprovalStatus(id, member, approved)));
  }

  // ==================== Proposals ====================

  @PostMapping("/proposals")
  @Operation(summary = "Proposal 제출", description = "멤버 추가/제거 또는 정족수 설정 변경을 제안합니다. 멤버 전용")
  public ResponseEntity<ApiResponse<RecordId>> submitProposal(
      @RequestHeader(value = MEMBER_HEADER, required = false) String caller,
      @Valid @RequestBody SubmitProposalRequest request) {
    long id = treasuryService.submitProposal(principal(caller), request.toChange());
    return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(new RecordId(id)));
  }

  @PostMapping("/proposals/{id}/approvals")
  @Operation(summary = "Proposal 승인")
  public ResponseEntity<ApiResponse<ProposalResponse>> approveProposal(
      @RequestHeader(value = MEMBER_HEADER, required = false) String caller,
      @PathVariable long id) {
    ProposalResponse updated =
        ProposalResponse.from(treasuryService.approveProposal(principal(caller), id));
    return ResponseEntity.ok(ApiResponse.success(updated));
  }

  @DeleteMapping("/proposals/{id}/approvals")
  @Operation(summary = "Proposal 승인 철회")
  public ResponseEntity<ApiResponse<ProposalResponse>> revokeProposalApproval(
      @RequestHeader(value = MEMBER_HEADER, required = false) String caller,
      @PathVariable long id) {
    ProposalResponse updated =
        ProposalResponse.from(treasuryService.revokeProposalApproval(principal(caller), id));
    return ResponseEntity.ok(ApiResponse.success(updated));
  }

  @PostMapping("/proposals/{id}/execution")
  @Operation(summary = "Proposal 실행")
  public ResponseEntity<ApiResponse<ProposalResponse>> executeProposal(
      @RequestHeader(value = MEMBER_HEADER, required = false) String caller,
      @PathVariable long id) {
    return ResponseEntity.ok(
        ApiResponse.success(
            ProposalResponse.from(treasuryService.executeProposal(principal(caller), id))));
  }

  @GetMapping("/proposals/{id}")
  @Operation(summary = "Proposal 조회")
  public ResponseEntity<ApiResponse<ProposalResponse>> getProposal(@PathVariable long id) {
    return ResponseEntity.ok(proposal(id));
  }

  @GetMapping("/proposals/count")
  @Operation(summary = "Proposal 개수")
  public ResponseEntity<ApiResponse<RecordCount>> getProposalCount() {
    return ResponseEntity.ok(
        ApiResponse.success(new RecordCount(treasuryService.getProposalCount())));
  }

  @GetMapping("/proposals/{id}/approvals/{member}")
  @Operation(summary = "멤버의 Proposal 승인 여부")
  public ResponseEntity<ApiResponse<ApprovalStatus>> isProposalApprovedBy(
      @PathVariable long id, @PathVariable String member) {
    boolean approved = treasuryService.isProposalApprovedBy(id, PrincipalId.of(member));
    return ResponseEntity.ok(ApiResponse.success(new ApprovalStatus(id, member, approved)));
  }

  // ==================== Treasury state ====================

  @GetMapping("/members")
  @Operation(summary = "멤버 목록", description = "등록 순서대로 반환합니다.")
  public ResponseEntity<ApiResponse<List<String>>> getMembers() {
    List<String> members =
        treasuryService.getMembers().stream().map(PrincipalId::value).toList();
    return ResponseEntity.ok(ApiResponse.success(members));
  }

  @GetMapping("/balance")
  @Operation(summary = "금고 잔액과 총 투표 가중치")
  public ResponseEntity<ApiResponse<BalanceView>> getBalance() {
    return ResponseEntity.ok(
        ApiResponse.success(
            new BalanceView(
                treasuryService.getBalance().toString(),
                treasuryService.totalWeight().toString())));
  }

  @GetMapping("/contributions/{member}")
  @Operation(summary = "멤버 기여금")
  public ResponseEntity<ApiResponse<ContributionView>> contributionOf(
      @PathVariable String member) {
    PrincipalId principal = PrincipalId.of(member);
    return ResponseEntity.ok(
        ApiResponse.success(
            new ContributionView(
                member,
                treasuryService.isMember(principal),
                treasuryService.contributionOf(principal).toString())));
  }

  @GetMapping("/quorum")
  @Operation(summary = "현재 정족수 설정")
  public ResponseEntity<ApiResponse<QuorumView>> getQuorumConfig() {
    return ResponseEntity.ok(
        ApiResponse.success(QuorumView.from(treasuryService.getQuorumConfig())));
  }

  private ApiResponse<ActionResponse> action(long id) {
    return ApiResponse.success(ActionResponse.from(treasuryService.getAction(id)));
  }

  private ApiResponse<ProposalResponse> proposal(long id) {
    return ApiResponse.success(ProposalResponse.from(treasuryService.getProposal(id)));
  }

  private static PrincipalId principal(String caller) {
    return caller == null || caller.isBlank() ? null : PrincipalId.of(caller);
  }
}
