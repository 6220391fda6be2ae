/*
 * Where: Channel provider
 * What: Sends alert emails through SendGrid
 * Why: Classifies SendGrid failures so only retryable ones are retried
 */
package com.breachwatch.monitor.client;

import com.breachwatch.monitor.config.ChannelProperties;
import com.sendgrid.Method;
import com.sendgrid.Request;
import com.sendgrid.Response;
import com.sendgrid.SendGrid;
import com.sendgrid.helpers.mail.Mail;
import com.sendgrid.helpers.mail.objects.Content;
import com.sendgrid.helpers.mail.objects.Email;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "monitor.channels.provider",
    havingValue = ChannelProperties.PROVIDER_VENDOR)
public class SendGridEmailChannelProvider implements EmailChannelProvider {

  private static final Logger logger = LoggerFactory.getLogger(SendGridEmailChannelProvider.class);
  private static final String MESSAGE_ID_HEADER = "X-Message-Id";
  // SendGrid's HTTP client reports non-2xx responses as IOExceptions carrying the status code
  private static final Pattern STATUS_IN_MESSAGE = Pattern.compile("status Code (\\d{3})");

  private final SendGrid sendGrid;
  private final ChannelProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "SendGrid is a shared Spring-managed SDK client")
  public SendGridEmailChannelProvider(SendGrid sendGrid, ChannelProperties properties) {
    this.sendGrid = sendGrid;
    this.properties = properties;
  }

  @Override
  public ChannelSendResult sendEmail(String to, String subject, String htmlBody) {
    final Email from =
        new Email(properties.sendgrid().fromEmail(), properties.sendgrid().fromName());
    final Mail mail = new Mail(from, subject, new Email(to), new Content("text/html", htmlBody));
    final Request request = new Request();
    try {
      request.setMethod(Method.POST);
      request.setEndpoint("mail/send");
      request.setBody(mail.build());
      final Response response = sendGrid.api(request);
      return classify(response.getStatusCode(), response.getBody(), response.getHeaders());
    } catch (IOException ex) {
      final Integer status = statusFrom(ex.getMessage());
      logger.warn("sendgrid send failed status={}", status, ex);
      if (status != null) {
        return classify(status, ex.getMessage(), Map.of());
      }
      return ChannelSendResult.transientFailure("sendgrid io error: " + ex.getMessage());
    }
  }

  private ChannelSendResult classify(int status, String body, Map<String, String> headers) {
    if (status >= 200 && status < 300) {
      return ChannelSendResult.sent(headers == null ? null : headers.get(MESSAGE_ID_HEADER));
    }
    final String error = "sendgrid status=" + status + " body=" + body;
    if (status == 429 || status >= 500) {
      return ChannelSendResult.transientFailure(error);
    }
    return ChannelSendResult.permanentFailure(error);
  }

  private Integer statusFrom(String message) {
    if (message == null) {
      return null;
    }
    final Matcher matcher = STATUS_IN_MESSAGE.matcher(message);
    return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
  }
}
