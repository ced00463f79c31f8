package pooled.treasury.effect;

import lombok.extern.slf4j.Slf4j;
import pooled.treasury.config.TreasuryProperties;
import pooled.treasury.core.port.out.ActionDispatch;
import pooled.treasury.core.port.out.ActionEffectDispatcher;
import pooled.treasury.core.port.out.EffectOutcome;
import pooled.treasury.error.exception.InvalidConfigException;
import pooled.treasury.global.executor.LogicExecutor;
import pooled.treasury.global.executor.TaskContext;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * 외부 지급 엔드포인트 HTTP 전달
 *
 * <p>지급 지시를 JSON으로 POST 합니다. 2xx 이외의 응답이나 I/O 오류는 실패 결과로 돌려주며, 엔진이 출금을 환원하고 실행을 롤백합니다.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "treasury.effect.type", havingValue = "webhook")
public class WebhookActionEffectDispatcher implements ActionEffectDispatcher {

  private final RestClient restClient;
  private final String webhookUrl;
  private final LogicExecutor executor;

  public WebhookActionEffectDispatcher(
      RestClient.Builder restClientBuilder,
      TreasuryProperties properties,
      LogicExecutor executor) {
    String url = properties.effect().webhookUrl();
    if (url == null || url.isBlank()) {
      throw new InvalidConfigException("treasury.effect.webhook-url is required for webhook mode");
    }
    this.restClient = restClientBuilder.build();
    this.webhookUrl = url;
    this.executor = executor;
  }

  @Override
  public EffectOutcome dispatch(ActionDispatch dispatch) {
    return executor.executeOrCatch(
        () -> post(dispatch),
        e -> {
          log.warn(
              "[Effect] Webhook delivery failed: actionId={}, cause={}",
              dispatch.actionId(),
              e.getMessage());
          return EffectOutcome.failed(rootMessage(e));
        },
        TaskContext.of("Effect", "webhook", String.valueOf(dispatch.actionId())));
  }

  @Override
  public String getDispatcherName() {
    return "WEBHOOK";
  }

  private EffectOutcome post(ActionDispatch dispatch) {
    ResponseEntity<Void> response =
        restClient
            .post()
            .uri(webhookUrl)
            .contentType(MediaType.APPLICATION_JSON)
            .body(WebhookPayload.from(dispatch))
            .retrieve()
            .toBodilessEntity();

    HttpStatusCode status = response.getStatusCode();
    if (!status.is2xxSuccessful()) {
      return EffectOutcome.failed("webhook answered " + status.value());
    }
    log.info("[Effect] Webhook delivered: actionId={}, status={}", dispatch.actionId(), status);
    return EffectOutcome.delivered();
  }

  private static String rootMessage(Throwable e) {
    Throwable root = e;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }
    return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
  }

  /** webhook 본문 */
  public record WebhookPayload(long actionId, String target, String value, String data) {

    static WebhookPayload from(ActionDispatch dispatch) {
      return new WebhookPayload(
          dispatch.actionId(),
          dispatch.call().target().value(),
          dispatch.call().value().toString(),
          dispatch.call().dataHex());
    }
  }
}
