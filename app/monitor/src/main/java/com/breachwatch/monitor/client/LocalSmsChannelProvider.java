/*
 * Where: Channel provider
 * What: Logs alert SMS instead of sending them
 * Why: Local runs and tests exercise dispatch without vendor credentials
 */
package com.breachwatch.monitor.client;

import com.breachwatch.monitor.config.ChannelProperties;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "monitor.channels.provider",
    havingValue = ChannelProperties.PROVIDER_LOCAL)
public class LocalSmsChannelProvider implements SmsChannelProvider {

  private static final Logger logger = LoggerFactory.getLogger(LocalSmsChannelProvider.class);

  @Override
  public ChannelSendResult sendSms(String to, String body) {
    final String messageId = "local-" + UUID.randomUUID();
    logger.info("sms simulated send messageId={} body={}", messageId, body);
    return ChannelSendResult.sent(messageId);
  }
}
