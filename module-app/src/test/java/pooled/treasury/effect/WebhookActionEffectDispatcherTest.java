package pooled.treasury.effect;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.io.IOException;
import java.util.List;
import pooled.treasury.config.TreasuryProperties;
import pooled.treasury.core.port.out.ActionDispatch;
import pooled.treasury.core.port.out.EffectOutcome;
import pooled.treasury.domain.model.action.ActionCall;
import pooled.treasury.domain.model.money.Amount;
import pooled.treasury.domain.model.principal.PrincipalId;
import pooled.treasury.domain.model.quorum.VotingMode;
import pooled.treasury.error.exception.InvalidConfigException;
import pooled.treasury.global.executor.DefaultLogicExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

@Tag("unit")
@DisplayName("WebhookActionEffectDispatcher")
class WebhookActionEffectDispatcherTest {

  private static final String URL = "http://payouts.local/hook";

  private MockRestServiceServer server;
  private WebhookActionEffectDispatcher dispatcher;

  private static TreasuryProperties properties(String url) {
    return new TreasuryProperties(
        List.of("alice"), 1, 50, VotingMode.COUNT, new TreasuryProperties.Effect("webhook", url));
  }

  private static ActionDispatch dispatch() {
    return new ActionDispatch(
        4, new ActionCall(PrincipalId.of("vendor"), Amount.of(1500), new byte[] {(byte) 0xbe}));
  }

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    dispatcher =
        new WebhookActionEffectDispatcher(builder, properties(URL), new DefaultLogicExecutor());
  }

  @Test
  @DisplayName("2xx 응답이면 전달 성공, 본문은 지급 지시 JSON")
  void deliversPayload() {
    server
        .expect(requestTo(URL))
        .andExpect(method(HttpMethod.POST))
        .andExpect(jsonPath("$.actionId").value(4))
        .andExpect(jsonPath("$.target").value("vendor"))
        .andExpect(jsonPath("$.value").value("1500"))
        .andExpect(jsonPath("$.data").value("be"))
        .andRespond(withSuccess());

    EffectOutcome outcome = dispatcher.dispatch(dispatch());

    assertThat(outcome.success()).isTrue();
    server.verify();
  }

  @Test
  @DisplayName("5xx 응답은 실패 결과")
  void serverErrorIsFailure() {
    server.expect(requestTo(URL)).andRespond(withServerError());

    EffectOutcome outcome = dispatcher.dispatch(dispatch());

    assertThat(outcome.success()).isFalse();
    assertThat(outcome.reason()).contains("500");
  }

  @Test
  @DisplayName("3xx 같은 2xx 이외 응답도 실패 결과")
  void nonSuccessStatusIsFailure() {
    server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.MULTIPLE_CHOICES));

    EffectOutcome outcome = dispatcher.dispatch(dispatch());

    assertThat(outcome.success()).isFalse();
    assertThat(outcome.reason()).contains("300");
  }

  @Test
  @DisplayName("I/O 오류는 예외 대신 실패 결과")
  void ioErrorIsFailure() {
    server.expect(requestTo(URL)).andRespond(withException(new IOException("connection reset")));

    EffectOutcome outcome = dispatcher.dispatch(dispatch());

    assertThat(outcome.success()).isFalse();
    assertThat(outcome.reason()).contains("connection reset");
  }

  @Test
  @DisplayName("webhook-url 없이 생성하면 InvalidConfigException")
  void requiresUrl() {
    assertThatThrownBy(
            () ->
                new WebhookActionEffectDispatcher(
                    RestClient.builder(), properties(" "), new DefaultLogicExecutor()))
        .isInstanceOf(InvalidConfigException.class);
  }
}
