package pooled.treasury.config;

import lombok.extern.slf4j.Slf4j;
import pooled.treasury.core.port.out.ActionEffectDispatcher;
import pooled.treasury.core.port.out.TreasuryEventPublisher;
import pooled.treasury.domain.service.TreasuryGovernance;
import pooled.treasury.domain.service.TreasuryState;
import pooled.treasury.global.executor.LogicExecutor;
import pooled.treasury.global.executor.TaskContext;
import pooled.treasury.global.executor.strategy.ExceptionTranslator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** 거버넌스 엔진 조립 */
@Slf4j
@Configuration
public class TreasuryConfig {

  @Bean
  public TreasuryState treasuryState(TreasuryProperties properties, LogicExecutor executor) {
    return executor.executeWithTranslation(
        () -> bootstrap(properties),
        ExceptionTranslator.forStartup("TreasuryState"),
        TaskContext.of("Treasury", "bootstrap"));
  }

  @Bean
  public TreasuryGovernance treasuryGovernance(
      TreasuryState treasuryState,
      ActionEffectDispatcher actionEffectDispatcher,
      TreasuryEventPublisher treasuryEventPublisher) {
    log.info("[Treasury] Effect dispatcher: {}", actionEffectDispatcher.getDispatcherName());
    return new TreasuryGovernance(treasuryState, actionEffectDispatcher, treasuryEventPublisher);
  }

  private TreasuryState bootstrap(TreasuryProperties properties) {
    TreasuryState state =
        TreasuryState.bootstrap(
            properties.initialPrincipals(),
            properties.countThreshold(),
            properties.weightThresholdPercent(),
            properties.mode());
    log.info(
        "[Treasury] Bootstrapped: members={}, quorum={}",
        state.members().list(),
        state.quorumConfig());
    return state;
  }
}
