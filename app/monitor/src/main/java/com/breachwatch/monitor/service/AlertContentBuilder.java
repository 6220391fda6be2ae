/*
 * Where: Monitor service layer
 * What: Builds alert email, alert SMS and weekly digest content
 * Why: Channel formatting rules such as the SMS length cap live apart from dispatch control flow
 */
package com.breachwatch.monitor.service;

import com.breachwatch.monitor.model.BreachEventRecord;
import com.breachwatch.monitor.model.DigestSummary;
import com.breachwatch.monitor.model.SeverityLabel;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

@Component
public class AlertContentBuilder {

  public static final int SMS_MAX_LENGTH = 160;
  static final String ELLIPSIS = "...";
  static final String SMS_SUFFIX =
      " breach. Change your password NOW. Reply STOP to unsubscribe.";
  static final String DIGEST_SUBJECT = "BreachWatch: Your Weekly Security Digest";

  public String emailSubject(BreachEventRecord event) {
    final String name = event.breachName();
    if (event.severity().isUrgent()) {
      return "URGENT: Your credentials found in the " + name + " breach";
    }
    if (event.severity() == SeverityLabel.MEDIUM) {
      return "Alert: Your data found in the " + name + " breach";
    }
    return "Notice: Your email found in the " + name + " breach";
  }

  public String emailBody(BreachEventRecord event, String identityPreview) {
    final String categories =
        event.dataClasses().stream()
            .map(category -> "<li>" + escape(category) + "</li>")
            .collect(Collectors.joining());
    final String breachDate = event.breachDate() == null ? "unknown" : event.breachDate().toString();
    final String remediation = event.remediationText() == null ? "" : event.remediationText();
    return """
        <html>
        <body style="margin:0;padding:0;font-family:Arial,sans-serif;background-color:#f4f4f4;">
        <table width="600" align="center" style="background-color:#ffffff;border-radius:8px;">
        <tr><td align="center" style="padding:20px 0;background-color:#1a1a1a;color:#ffffff;">
        <h2 style="margin:0;">BreachWatch Alert</h2></td></tr>
        <tr><td align="center" style="padding:10px 0;background-color:%s;color:#ffffff;">
        <h3 style="margin:0;">SEVERITY: %s</h3></td></tr>
        <tr><td style="padding:30px 40px;">
        <h1 style="color:#333333;margin-top:0;">%s</h1>
        <p>Your monitored email <strong>%s</strong> was found in this breach.</p>
        <p style="color:#777777;">Breach date: %s</p>
        <h3>What was exposed:</h3>
        <ul>%s</ul>
        <h3>Action Plan:</h3>
        <pre style="white-space:pre-wrap;font-family:Arial,sans-serif;">%s</pre>
        </td></tr>
        <tr><td align="center" style="padding:20px;color:#888888;font-size:12px;">
        <p style="margin:0;">BreachWatch: protecting your digital identity</p>
        <p style="margin:5px 0 0 0;">This is an automated security alert.</p>
        </td></tr>
        </table>
        </body>
        </html>
        """
        .formatted(
            bannerColor(event.severity()),
            event.severity().name(),
            escape(event.breachName()),
            escape(identityPreview),
            breachDate,
            categories,
            escape(remediation));
  }

  /**
   * Builds the SMS body, truncating the breach name and, when the name alone is not enough, the
   * identity preview with an ellipsis so the body fits in {@value #SMS_MAX_LENGTH} characters.
   *
   * @throws SmsBodyTooLongException when the fixed text alone leaves no room for either part
   */
  public String smsBody(BreachEventRecord event, String identityPreview) {
    final String head = "[BreachWatch] " + event.severity().name() + " ALERT: ";
    final String middle = " found in ";
    final int available =
        SMS_MAX_LENGTH - head.length() - middle.length() - SMS_SUFFIX.length();
    // both variable parts must keep room for at least an ellipsis
    if (available < 2 * ELLIPSIS.length()) {
      throw new SmsBodyTooLongException(
          head.length() + middle.length() + SMS_SUFFIX.length() + 2 * ELLIPSIS.length());
    }
    String preview = identityPreview == null ? "" : identityPreview;
    String name = event.breachName();
    if (preview.length() + name.length() > available) {
      final int previewBudget = Math.max(available - name.length(), available / 2);
      preview = truncate(preview, previewBudget);
      name = truncate(name, available - preview.length());
    }
    final String body = head + preview + middle + name + SMS_SUFFIX;
    if (body.length() > SMS_MAX_LENGTH) {
      throw new SmsBodyTooLongException(body.length());
    }
    return body;
  }

  private static String truncate(String value, int maxLength) {
    if (value.length() <= maxLength) {
      return value;
    }
    return value.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
  }


  public String digestSubject() {
    return DIGEST_SUBJECT;
  }

  public String digestBody(DigestSummary summary) {
    final String newColor = summary.newThisWeek() > 0 ? "#D32F2F" : "#2E7D32";
    return """
        <html>
        <body style="font-family:Arial,sans-serif;color:#333;line-height:1.6;">
        <h2>Your Weekly BreachWatch Digest</h2>
        <p>Here is a summary of your digital security profile for the past week:</p>
        <ul>
        <li><strong>Monitored Emails:</strong> %d</li>
        <li><strong>Total Known Breaches:</strong> %d</li>
        <li><strong>New Breaches This Week:</strong> <span style="color:%s">%d</span></li>
        <li><strong>Overall Risk Score:</strong> %d/100</li>
        </ul>
        <p>Log in to your BreachWatch dashboard for complete remediation details.</p>
        </body>
        </html>
        """
        .formatted(
            summary.monitoredIdentities(),
            summary.totalBreaches(),
            newColor,
            summary.newThisWeek(),
            summary.maxSeverityScore());
  }

  static String bannerColor(SeverityLabel severity) {
    return switch (severity) {
      case CRITICAL -> "#D32F2F";
      case HIGH, MEDIUM -> "#ED6C02";
      case LOW -> "#2E7D32";
    };
  }

  private static String escape(String value) {
    return value == null ? "" : HtmlUtils.htmlEscape(value);
  }

  public static class SmsBodyTooLongException extends RuntimeException {
    public SmsBodyTooLongException(int length) {
      super("sms body length " + length + " exceeds " + SMS_MAX_LENGTH);
    }
  }
}
