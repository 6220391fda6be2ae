/*
 * Where: Remediation client abstraction
 * What: Produces advisory text for a breach shape
 * Why: The advisor treats generation as a replaceable collaborator
 */
package com.breachwatch.monitor.client;

import java.util.List;

public interface RemediationTextGenerator {

  /**
   * @throws RemediationGenerationException when no text could be produced
   */
  String generate(String breachName, List<String> dataClasses);
}
