package com.breachwatch.monitor.client;

public interface SmsChannelProvider {

  /** The body must already fit in a single SMS segment. */
  ChannelSendResult sendSms(String to, String body);
}
