package pooled.treasury.domain.model.quorum;

/** 정족수 판정 방식 */
public enum VotingMode {
  /** 승인 인원 수 기준 (count >= countThreshold) */
  COUNT,
  /** 승인 가중치 기준 (weight > totalWeight * percent / 100) */
  WEIGHT
}
