/*
 * Where: Channel provider
 * What: Sends alert SMS through Twilio
 * Why: Twilio errors are split into retryable and permanent ones for dispatch
 */
package com.breachwatch.monitor.client;

import com.breachwatch.monitor.config.ChannelProperties;
import com.twilio.exception.ApiConnectionException;
import com.twilio.exception.ApiException;
import com.twilio.exception.TwilioException;
import com.twilio.http.TwilioRestClient;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "monitor.channels.provider",
    havingValue = ChannelProperties.PROVIDER_VENDOR)
public class TwilioSmsChannelProvider implements SmsChannelProvider {

  private static final Logger logger = LoggerFactory.getLogger(TwilioSmsChannelProvider.class);

  private final TwilioRestClient twilioRestClient;
  private final ChannelProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "TwilioRestClient is a shared Spring-managed SDK client")
  public TwilioSmsChannelProvider(TwilioRestClient twilioRestClient, ChannelProperties properties) {
    this.twilioRestClient = twilioRestClient;
    this.properties = properties;
  }

  @Override
  public ChannelSendResult sendSms(String to, String body) {
    try {
      final Message message =
          Message.creator(
                  new PhoneNumber(to), new PhoneNumber(properties.twilio().fromNumber()), body)
              .create(twilioRestClient);
      return ChannelSendResult.sent(message.getSid());
    } catch (ApiConnectionException ex) {
      logger.warn("twilio connection failed", ex);
      return ChannelSendResult.transientFailure("twilio connection error: " + ex.getMessage());
    } catch (ApiException ex) {
      final Integer status = ex.getStatusCode();
      logger.warn("twilio send failed status={} code={}", status, ex.getCode());
      final String error = "twilio status=" + status + " code=" + ex.getCode() + ": " + ex.getMessage();
      if (status == null || status == 429 || status >= 500) {
        return ChannelSendResult.transientFailure(error);
      }
      return ChannelSendResult.permanentFailure(error);
    } catch (TwilioException ex) {
      logger.warn("twilio send failed", ex);
      return ChannelSendResult.transientFailure("twilio error: " + ex.getMessage());
    }
  }
}
