/*
 * Where: Remediation client
 * What: Generates remediation checklists through the Anthropic Messages API
 * Why: Advice is tailored to the breached service and the exposed data
 */
package com.breachwatch.monitor.client;

import com.breachwatch.monitor.config.RemediationProperties;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Service
public class AnthropicRemediationTextGenerator implements RemediationTextGenerator {

  private static final Logger logger =
      LoggerFactory.getLogger(AnthropicRemediationTextGenerator.class);
  private static final String MESSAGES_PATH = "/v1/messages";

  private static final String PROMPT_TEMPLATE =
      """
      You are a security advisor explaining to a non-technical person what to do
      after their account data showed up in a breach.

      Their email address was found in the '%1$s' breach.
      Exposed data: %2$s

      Write a step-by-step remediation checklist using exactly this layout:

      IMMEDIATE ACTIONS (within the next hour):
      1. [action]
      2. [action]

      SHORT-TERM ACTIONS (within 24 hours):
      3. [action]
      4. [action]

      LONG-TERM PROTECTION (this week):
      5. [action]

      Guidelines:
      - Refer to %1$s and to the exposed data specifically
      - Plain language, no jargon
      - Start every step with a verb such as Change, Enable or Review
      - At most two sentences per step and under 400 words overall
      - Output only the checklist, with no introduction
      """;

  private final RestClient remediationRestClient;
  private final RemediationProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component")
  public AnthropicRemediationTextGenerator(
      @Qualifier("remediationRestClient") RestClient remediationRestClient,
      RemediationProperties properties) {
    this.remediationRestClient = remediationRestClient;
    this.properties = properties;
  }

  @Override
  public String generate(String breachName, List<String> dataClasses) {
    final Map<String, Object> request =
        Map.of(
            "model", properties.model(),
            "max_tokens", properties.maxTokens(),
            "messages",
                List.of(Map.of("role", "user", "content", buildPrompt(breachName, dataClasses))));
    final MessagesResponse response;
    try {
      response =
          remediationRestClient
              .post()
              .uri(MESSAGES_PATH)
              .header("x-api-key", properties.apiKey())
              .header("anthropic-version", properties.apiVersion())
              .contentType(MediaType.APPLICATION_JSON)
              .body(request)
              .retrieve()
              .body(MessagesResponse.class);
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex);
    } catch (RestClientException ex) {
      throw new RemediationGenerationException(
          RemediationGenerationException.Reason.INVALID_RESPONSE,
          "remediation response parse failed",
          ex);
    }
    return extractText(response);
  }

  static String buildPrompt(String breachName, List<String> dataClasses) {
    return PROMPT_TEMPLATE.formatted(breachName, String.join(", ", dataClasses)).strip();
  }

  private String extractText(MessagesResponse response) {
    if (response == null || response.content() == null || response.content().isEmpty()) {
      throw new RemediationGenerationException(
          RemediationGenerationException.Reason.INVALID_RESPONSE, "remediation response is empty");
    }
    final String text = response.content().get(0).text();
    if (text == null || text.isBlank()) {
      throw new RemediationGenerationException(
          RemediationGenerationException.Reason.INVALID_RESPONSE,
          "remediation response has no text");
    }
    return text.strip();
  }

  private RemediationGenerationException mapResponseException(RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    logger.warn("remediation generation failed with http status={}", status);
    if (status == 401 || status == 403) {
      return new RemediationGenerationException(
          RemediationGenerationException.Reason.UNAUTHORIZED,
          "remediation API rejected the key",
          ex);
    }
    if (status == 429) {
      return new RemediationGenerationException(
          RemediationGenerationException.Reason.RATE_LIMITED, "remediation API rate limited", ex);
    }
    return new RemediationGenerationException(
        RemediationGenerationException.Reason.BAD_GATEWAY,
        "remediation request failed status=" + status,
        ex);
  }

  private RemediationGenerationException mapResourceException(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return new RemediationGenerationException(
            RemediationGenerationException.Reason.TIMEOUT, "remediation request timeout", ex);
      }
      current = current.getCause();
    }
    return new RemediationGenerationException(
        RemediationGenerationException.Reason.BAD_GATEWAY, "remediation connection failed", ex);
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record MessagesResponse(@JsonProperty("content") List<ContentBlock> content) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ContentBlock(@JsonProperty("type") String type, @JsonProperty("text") String text) {}
}
