/*
 * Where: Monitor configuration binding
 * What: Alert channel provider selection and vendor credentials
 * Why: Local runs log alerts while vendor mode requires SendGrid and Twilio credentials up front
 */
package com.breachwatch.monitor.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "monitor.channels")
@Validated
public record ChannelProperties(
    @NotBlank String provider, @NotNull @Valid SendGrid sendgrid, @NotNull @Valid Twilio twilio) {

  public static final String PROVIDER_VENDOR = "vendor";
  public static final String PROVIDER_LOCAL = "local";

  @AssertTrue(message = "monitor.channels.provider must be 'vendor' or 'local'")
  public boolean isProviderKnown() {
    return PROVIDER_VENDOR.equals(provider) || PROVIDER_LOCAL.equals(provider);
  }

  @AssertTrue(message = "monitor.channels vendor mode requires sendgrid and twilio credentials")
  public boolean isVendorCredentialsPresent() {
    if (!PROVIDER_VENDOR.equals(provider)) {
      return true;
    }
    return sendgrid != null
        && twilio != null
        && notBlank(sendgrid.apiKey())
        && notBlank(twilio.accountSid())
        && notBlank(twilio.authToken())
        && notBlank(twilio.fromNumber());
  }

  private static boolean notBlank(String value) {
    return value != null && !value.isBlank();
  }

  public record SendGrid(
      String apiKey,
      @NotBlank String fromEmail,
      @NotBlank String fromName,
      @NotNull Duration connectTimeout,
      @NotNull Duration readTimeout) {}

  public record Twilio(String accountSid, String authToken, String fromNumber) {}
}
