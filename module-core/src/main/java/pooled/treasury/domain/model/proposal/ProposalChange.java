package pooled.treasury.domain.model.proposal;

import pooled.treasury.domain.model.principal.PrincipalId;
import pooled.treasury.domain.model.quorum.VotingMode;
import pooled.treasury.domain.service.TreasuryState;
import pooled.treasury.error.exception.InvalidInputException;

/**
 * 거버넌스 제안의 변경 내용 (닫힌 변형 타입)
 *
 * <p>변형마다 자기 효과를 {@link #applyTo}로 직접 적용합니다. 효과는 전부 적용되거나 예외와 함께 아무것도 적용되지 않아야 합니다.
 */
public sealed interface ProposalChange permits AddMember, RemoveMember, ChangeParameters {

  ProposalKind kind();

  void applyTo(TreasuryState state);

  /**
   * 종류 + 선택 필드 형태의 제출 요청을 변형으로 변환
   *
   * <p>종류에 필요한 필드만 검사합니다. 사용하지 않는 필드는 무시합니다.
   */
  static ProposalChange of(
      ProposalKind kind,
      PrincipalId member,
      Integer newCountThreshold,
      Integer newWeightThresholdPercent,
      VotingMode newMode) {
    if (kind == null) {
      throw new InvalidInputException("proposal kind is required");
    }
    return switch (kind) {
      case ADD_MEMBER -> new AddMember(require(member, "member"));
      case REMOVE_MEMBER -> new RemoveMember(require(member, "member"));
      case CHANGE_PARAMETERS -> new ChangeParameters(
          require(newCountThreshold, "newCountThreshold"),
          require(newWeightThresholdPercent, "newWeightThresholdPercent"),
          require(newMode, "newMode"));
    };
  }

  private static <T> T require(T value, String field) {
    if (value == null) {
      throw new InvalidInputException(field + " is required for this proposal kind");
    }
    return value;
  }
}
