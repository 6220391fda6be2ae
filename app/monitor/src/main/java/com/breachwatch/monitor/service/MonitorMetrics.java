/*
 * Where: Monitor service layer
 * What: Records scan, alert, cache and job metrics
 * Why: Pipeline health is watched from Prometheus
 */
package com.breachwatch.monitor.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component")
public class MonitorMetrics {

  private static final String METRIC_SCAN_TOTAL = "monitor.scan.total";
  private static final String METRIC_BREACH_NEW_TOTAL = "monitor.breach.new.total";
  private static final String METRIC_ALERT_DELIVERY_TOTAL = "monitor.alert.delivery.total";
  private static final String METRIC_REMEDIATION_CACHE_TOTAL = "monitor.remediation.cache.total";
  private static final String METRIC_JOB_TOTAL = "monitor.job.total";
  private static final String METRIC_JOB_BACKLOG_CURRENT = "monitor.job.backlog.current";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger backlogCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Counter newBreachCounter;

  public MonitorMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_JOB_BACKLOG_CURRENT, backlogCurrent, AtomicInteger::get)
        .description("Jobs currently due and waiting for a worker")
        .register(meterRegistry);
    this.newBreachCounter =
        Counter.builder(METRIC_BREACH_NEW_TOTAL)
            .description("Breach events created by ingestion")
            .register(meterRegistry);
  }

  public void recordScan(String result) {
    counter(METRIC_SCAN_TOTAL, "Identity scan outcomes", Tags.of("result", result)).increment();
  }

  public void recordNewBreaches(int count) {
    if (count > 0) {
      newBreachCounter.increment(count);
    }
  }

  public void recordAlertDelivery(String channel, String status) {
    counter(
            METRIC_ALERT_DELIVERY_TOTAL,
            "Alert delivery outcomes per channel",
            Tags.of("channel", channel, "status", status))
        .increment();
  }

  public void recordRemediationCache(String result) {
    counter(
            METRIC_REMEDIATION_CACHE_TOTAL,
            "Remediation cache lookups",
            Tags.of("result", result))
        .increment();
  }

  public void recordJob(String type, String outcome) {
    counter(METRIC_JOB_TOTAL, "Job outcomes", Tags.of("type", type, "outcome", outcome))
        .increment();
  }

  public void updateBacklogCurrent(int backlogCount) {
    backlogCurrent.set(Math.max(backlogCount, 0));
  }

  private Counter counter(String name, String description, Tags tags) {
    return counters.computeIfAbsent(
        name + tags,
        ignored ->
            Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }
}
