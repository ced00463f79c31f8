package pooled.treasury.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import pooled.treasury.domain.model.principal.PrincipalId;
import pooled.treasury.domain.model.quorum.VotingMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * 금고 초기 구성
 *
 * <h3>application.yml 설정 예시</h3>
 *
 * <pre>
 * treasury:
 *   initial-members: [alice, bob, carol, dave]
 *   count-threshold: 2
 *   weight-threshold-percent: 50
 *   mode: COUNT
 *   effect:
 *     type: journal
 * </pre>
 *
 * <p>멤버 목록과 임계값 범위는 엔진이 생성 시점에 검사합니다 (InvalidConfigException).
 *
 * @param initialMembers 초기 멤버 id 목록 (순서 유지)
 * @param countThreshold COUNT 모드 최소 승인 수
 * @param weightThresholdPercent WEIGHT 모드 비율 (0~100)
 * @param mode 판정 모드
 * @param effect Action 실행 효과 전달 방식
 */
@Validated
@ConfigurationProperties(prefix = "treasury")
public record TreasuryProperties(
    @DefaultValue List<String> initialMembers,
    @DefaultValue("1") int countThreshold,
    @DefaultValue("50") int weightThresholdPercent,
    @DefaultValue("COUNT") @NotNull VotingMode mode,
    @DefaultValue @Valid Effect effect) {

  public List<PrincipalId> initialPrincipals() {
    return initialMembers.stream().map(PrincipalId::of).toList();
  }

  /**
   * @param type journal | webhook
   * @param webhookUrl webhook 모드 전달 주소
   */
  public record Effect(@DefaultValue("journal") String type, String webhookUrl) {}
}
