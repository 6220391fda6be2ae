/*
 * Where: Channel provider abstraction
 * What: Result of one provider send call
 * Why: Dispatch decides between retrying and recording from this alone
 */
package com.breachwatch.monitor.client;

public record ChannelSendResult(
    boolean sent, String providerMessageId, String error, boolean transientFailure) {

  public static ChannelSendResult sent(String providerMessageId) {
    return new ChannelSendResult(true, providerMessageId, null, false);
  }

  public static ChannelSendResult transientFailure(String error) {
    return new ChannelSendResult(false, null, error, true);
  }

  public static ChannelSendResult permanentFailure(String error) {
    return new ChannelSendResult(false, null, error, false);
  }
}
