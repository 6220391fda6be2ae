package com.breachwatch.monitor.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.breachwatch.monitor.config.RemediationProperties;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class AnthropicRemediationTextGeneratorTest {

  private static final String URL = "http://remediation.test/v1/messages";

  @Test
  void generatePostsPromptAndReturnsFirstTextBlock() {
    final GeneratorFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(URL))
        .andExpect(method(POST))
        .andExpect(header("x-api-key", "test-key"))
        .andExpect(header("anthropic-version", "2023-06-01"))
        .andExpect(jsonPath("$.model").value("test-model"))
        .andExpect(jsonPath("$.max_tokens").value(600))
        .andExpect(jsonPath("$.messages[0].role").value("user"))
        .andRespond(
            withSuccess(
                """
                {"id":"msg_1","content":[{"type":"text","text":"  IMMEDIATE ACTIONS\\n1. Change it  "}]}
                """,
                MediaType.APPLICATION_JSON));

    final String text = fixture.generator.generate("Adobe", List.of("Passwords"));

    assertThat(text).isEqualTo("IMMEDIATE ACTIONS\n1. Change it");
    fixture.server.verify();
  }

  @Test
  void promptNamesBreachAndExposedData() {
    final String prompt =
        AnthropicRemediationTextGenerator.buildPrompt(
            "Adobe", List.of("Passwords", "Email addresses"));

    assertThat(prompt).contains("'Adobe' breach");
    assertThat(prompt).contains("Exposed data: Passwords, Email addresses");
    assertThat(prompt).contains("IMMEDIATE ACTIONS");
  }

  @Test
  void emptyContentIsInvalidResponse() {
    final GeneratorFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(URL))
        .andRespond(withSuccess("{\"content\":[]}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fixture.generator.generate("Adobe", List.of("Passwords")))
        .isInstanceOf(RemediationGenerationException.class)
        .extracting(ex -> ((RemediationGenerationException) ex).reason())
        .isEqualTo(RemediationGenerationException.Reason.INVALID_RESPONSE);
  }

  @Test
  void httpFailuresAreMapped() {
    final GeneratorFixture fixture = newFixture();
    fixture.server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));
    fixture.server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

    assertThatThrownBy(() -> fixture.generator.generate("Adobe", List.of("Passwords")))
        .extracting(ex -> ((RemediationGenerationException) ex).reason())
        .isEqualTo(RemediationGenerationException.Reason.UNAUTHORIZED);
    assertThatThrownBy(() -> fixture.generator.generate("Adobe", List.of("Passwords")))
        .extracting(ex -> ((RemediationGenerationException) ex).reason())
        .isEqualTo(RemediationGenerationException.Reason.RATE_LIMITED);
  }

  @Test
  void timeoutIsMapped() {
    final GeneratorFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(URL))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    assertThatThrownBy(() -> fixture.generator.generate("Adobe", List.of("Passwords")))
        .extracting(ex -> ((RemediationGenerationException) ex).reason())
        .isEqualTo(RemediationGenerationException.Reason.TIMEOUT);
  }

  private GeneratorFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RemediationProperties properties =
        new RemediationProperties(
            "test-key",
            "http://remediation.test",
            "test-model",
            600,
            "2023-06-01",
            Duration.ofSeconds(2),
            Duration.ofSeconds(10),
            "fallback");
    final AnthropicRemediationTextGenerator generator =
        new AnthropicRemediationTextGenerator(
            builder.baseUrl("http://remediation.test").build(), properties);
    return new GeneratorFixture(generator, server);
  }

  private record GeneratorFixture(
      AnthropicRemediationTextGenerator generator, MockRestServiceServer server) {}
}
