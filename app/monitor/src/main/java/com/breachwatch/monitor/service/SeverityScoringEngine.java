/*
 * Where: Monitor service layer
 * What: Scores the exposed data categories of a breach into a severity label and score
 * Why: Severity drives SMS escalation, email wording and the digest risk score
 */
package com.breachwatch.monitor.service;

import com.breachwatch.monitor.model.SeverityLabel;
import com.breachwatch.monitor.model.SeverityResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class SeverityScoringEngine {

  static final int UNKNOWN_CATEGORY_WEIGHT = 2;
  static final int MAX_SCORE = 100;

  private static final Map<String, Integer> WEIGHTS =
      Map.ofEntries(
          Map.entry("Passwords", 25),
          Map.entry("Password hints", 20),
          Map.entry("Auth tokens", 20),
          Map.entry("Credit cards", 25),
          Map.entry("Bank account numbers", 25),
          Map.entry("Social security numbers", 25),
          Map.entry("Passport numbers", 20),
          Map.entry("Government issued IDs", 20),
          Map.entry("Private messages", 15),
          Map.entry("Security questions and answers", 18),
          Map.entry("Biometric data", 22),
          Map.entry("Health insurance information", 18),
          Map.entry("Medical records", 20),
          Map.entry("Financial transactions", 18),
          Map.entry("Purchases", 10),
          Map.entry("Phone numbers", 8),
          Map.entry("Physical addresses", 8),
          Map.entry("Dates of birth", 7),
          Map.entry("Genders", 3),
          Map.entry("Geographic locations", 5),
          Map.entry("Ethnicities", 5),
          Map.entry("Email addresses", 5),
          Map.entry("Usernames", 4),
          Map.entry("Names", 3),
          Map.entry("IP addresses", 4),
          Map.entry("Device information", 2),
          Map.entry("Browser user agent details", 2),
          Map.entry("Avatars", 1),
          Map.entry("Website activity", 3));

  // Any of these forces CRITICAL regardless of the summed weight.
  private static final Set<String> CRITICAL_CATEGORIES =
      Set.of(
          "Passwords",
          "Auth tokens",
          "Credit cards",
          "Bank account numbers",
          "Social security numbers",
          "Passport numbers",
          "Government issued IDs",
          "Biometric data");

  public SeverityResult score(List<String> dataClasses) {
    if (dataClasses == null || dataClasses.isEmpty()) {
      return new SeverityResult(SeverityLabel.LOW, 0, List.of(), "None", "No data classes reported");
    }
    int rawScore = 0;
    int highestWeight = -1;
    String topRisk = "None";
    final List<String> matched = new ArrayList<>();
    boolean critical = false;
    for (String category : dataClasses) {
      final Integer known = WEIGHTS.get(category);
      final int weight = known == null ? UNKNOWN_CATEGORY_WEIGHT : known;
      rawScore += weight;
      if (known != null) {
        matched.add(category);
      }
      // strict comparison keeps the first category on ties
      if (weight > highestWeight) {
        highestWeight = weight;
        topRisk = category;
      }
      critical |= CRITICAL_CATEGORIES.contains(category);
    }
    int score = Math.min(rawScore, MAX_SCORE);
    SeverityLabel label = SeverityLabel.forScore(score);
    if (critical) {
      label = SeverityLabel.CRITICAL;
      score = Math.max(score, SeverityLabel.CRITICAL.threshold());
    }
    return new SeverityResult(label, score, matched, topRisk, describe(dataClasses));
  }

  private String describe(List<String> dataClasses) {
    if (dataClasses.contains("Passwords")) {
      return "Your login credentials were directly exposed.";
    }
    if (dataClasses.contains("Credit cards") || dataClasses.contains("Bank account numbers")) {
      return "Your financial data was exposed.";
    }
    return dataClasses.size()
        + " types of personal data were exposed including "
        + dataClasses.get(0)
        + ".";
  }
}
