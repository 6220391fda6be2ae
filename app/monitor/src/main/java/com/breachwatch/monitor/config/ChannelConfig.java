/*
 * Where: Monitor configuration
 * What: Builds the SendGrid and Twilio SDK clients for vendor delivery
 * Why: SDK clients carry credentials and timeouts and are shared by every dispatch
 */
package com.breachwatch.monitor.config;

import com.sendgrid.Client;
import com.sendgrid.SendGrid;
import com.twilio.http.TwilioRestClient;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ChannelProperties.class)
@ConditionalOnProperty(
    name = "monitor.channels.provider",
    havingValue = ChannelProperties.PROVIDER_VENDOR)
public class ChannelConfig {

  @Bean
  SendGrid sendGrid(ChannelProperties properties) {
    final ChannelProperties.SendGrid sendgrid = properties.sendgrid();
    final RequestConfig requestConfig =
        RequestConfig.custom()
            .setConnectTimeout(Math.toIntExact(sendgrid.connectTimeout().toMillis()))
            .setSocketTimeout(Math.toIntExact(sendgrid.readTimeout().toMillis()))
            .build();
    final CloseableHttpClient httpClient =
        HttpClients.custom().setDefaultRequestConfig(requestConfig).build();
    return new SendGrid(sendgrid.apiKey(), new Client(httpClient));
  }

  @Bean
  TwilioRestClient twilioRestClient(ChannelProperties properties) {
    final ChannelProperties.Twilio twilio = properties.twilio();
    return new TwilioRestClient.Builder(twilio.accountSid(), twilio.authToken()).build();
  }
}
