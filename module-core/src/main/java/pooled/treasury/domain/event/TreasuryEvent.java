package pooled.treasury.domain.event;

/**
 * 금고 거버넌스 알림
 *
 * <p>상태 변경이 성공적으로 끝난 명령만 알림을 발행합니다. 실패한 명령은 아무것도 발행하지 않습니다.
 */
public sealed interface TreasuryEvent
    permits DepositReceived,
        ActionSubmitted,
        ActionApproved,
        ActionApprovalRevoked,
        ActionExecuted,
        ProposalSubmitted,
        ProposalApproved,
        ProposalApprovalRevoked,
        ProposalExecuted {

  /** 로그/메트릭 태그용 이벤트 이름 */
  default String eventName() {
    return getClass().getSimpleName();
  }
}
