/*
 * Where: Monitor metrics tests
 * What: Verifies scan, breach, alert, cache, job and backlog meters are registered and counted
 * Why: Dashboards and alerts depend on these names and tags
 */
package com.breachwatch.monitor.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

class MonitorMetricsTest {

  @Test
  void recordsPipelineMetrics() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final MonitorMetrics metrics = new MonitorMetrics(registry);

    metrics.recordScan("completed");
    metrics.recordScan("completed");
    metrics.recordNewBreaches(3);
    metrics.recordNewBreaches(0);
    metrics.recordAlertDelivery("email", "sent");
    metrics.recordRemediationCache("hit");
    metrics.recordJob("IDENTITY_SCAN", "succeeded");
    metrics.updateBacklogCurrent(7);

    assertThat(registry.get("monitor.scan.total").tag("result", "completed").counter().count())
        .isEqualTo(2.0d);
    assertThat(registry.get("monitor.breach.new.total").counter().count()).isEqualTo(3.0d);
    assertThat(
            registry
                .get("monitor.alert.delivery.total")
                .tags("channel", "email", "status", "sent")
                .counter()
                .count())
        .isEqualTo(1.0d);
    assertThat(
            registry.get("monitor.remediation.cache.total").tag("result", "hit").counter().count())
        .isEqualTo(1.0d);
    assertThat(
            registry
                .get("monitor.job.total")
                .tags("type", "IDENTITY_SCAN", "outcome", "succeeded")
                .counter()
                .count())
        .isEqualTo(1.0d);
    assertThat(registry.get("monitor.job.backlog.current").gauge().value()).isEqualTo(7.0d);
  }

  @Test
  void backlogNeverGoesNegative() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final MonitorMetrics metrics = new MonitorMetrics(registry);

    metrics.updateBacklogCurrent(-4);

    assertThat(registry.get("monitor.job.backlog.current").gauge().value()).isZero();
  }
}
