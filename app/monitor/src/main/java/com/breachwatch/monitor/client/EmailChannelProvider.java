package com.breachwatch.monitor.client;

public interface EmailChannelProvider {

  ChannelSendResult sendEmail(String to, String subject, String htmlBody);
}
