/*
 * Where: Channel provider
 * What: Logs alert emails instead of sending them
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
public class LocalEmailChannelProvider implements EmailChannelProvider {

  private static final Logger logger = LoggerFactory.getLogger(LocalEmailChannelProvider.class);

  @Override
  public ChannelSendResult sendEmail(String to, String subject, String htmlBody) {
    final String messageId = "local-" + UUID.randomUUID();
    logger.info(
        "email simulated send messageId={} subject={} bodyLength={}",
        messageId,
        subject,
        htmlBody.length());
    return ChannelSendResult.sent(messageId);
  }
}
