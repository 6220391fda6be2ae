/*
 * Where: Monitor API
 * What: Administrative endpoints for manual scans, sweeps, resends and lookups
 * Why: Operators and the account layer trigger pipeline work without touching the queue directly
 */
package com.breachwatch.monitor.api;

import com.breachwatch.monitor.api.request.SecretCheckRequest;
import com.breachwatch.monitor.api.response.CatalogEntryResponse;
import com.breachwatch.monitor.api.response.FanOutResponse;
import com.breachwatch.monitor.api.response.JobAcceptedResponse;
import com.breachwatch.monitor.api.response.JobStatusResponse;
import com.breachwatch.monitor.api.response.RemediationResponse;
import com.breachwatch.monitor.api.response.SecretExposureResponse;
import com.breachwatch.monitor.service.BreachMonitorOperations;
import com.breachwatch.monitor.service.JobQueue;
import com.breachwatch.monitor.service.SweepService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
public class AdminController {

  private final BreachMonitorOperations operations;

  @PostMapping("/identities/{identityId}/scan")
  public ResponseEntity<JobAcceptedResponse> triggerScan(
      @PathVariable("identityId") UUID identityId) {
    return accepted(operations.triggerScan(identityId));
  }

  @PostMapping("/sweeps")
  public ResponseEntity<FanOutResponse> triggerFullSweep() {
    return fanOut(operations.triggerFullSweep());
  }

  @PostMapping("/digests")
  public ResponseEntity<FanOutResponse> triggerWeeklyDigest() {
    return fanOut(operations.triggerWeeklyDigest());
  }

  @PostMapping("/breach-events/{breachEventId}/resend")
  public ResponseEntity<JobAcceptedResponse> resendAlert(
      @PathVariable("breachEventId") UUID breachEventId) {
    return accepted(operations.resendAlert(breachEventId));
  }

  @PostMapping("/breach-events/{breachEventId}/remediation")
  public ResponseEntity<RemediationResponse> regenerateRemediation(
      @PathVariable("breachEventId") UUID breachEventId) {
    return ResponseEntity.ok(
        new RemediationResponse(breachEventId, operations.regenerateRemediation(breachEventId)));
  }

  @PostMapping("/secrets/exposure")
  public ResponseEntity<SecretExposureResponse> checkLeakedSecret(
      @Valid @RequestBody SecretCheckRequest request) {
    final long occurrences = operations.checkLeakedSecret(request.secret());
    return ResponseEntity.ok(new SecretExposureResponse(occurrences > 0, occurrences));
  }

  @GetMapping("/breaches/catalog")
  public ResponseEntity<List<CatalogEntryResponse>> breachCatalog() {
    return ResponseEntity.ok(
        operations.breachCatalog().stream().map(CatalogEntryResponse::from).toList());
  }

  @GetMapping("/jobs/{jobId}")
  public ResponseEntity<JobStatusResponse> jobStatus(@PathVariable("jobId") UUID jobId) {
    return ResponseEntity.ok(JobStatusResponse.from(operations.jobStatus(jobId)));
  }

  private ResponseEntity<JobAcceptedResponse> accepted(JobQueue.EnqueueResult result) {
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(new JobAcceptedResponse(result.jobId(), result.dedupKey(), result.created()));
  }

  private ResponseEntity<FanOutResponse> fanOut(SweepService.FanOutResult result) {
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(new FanOutResponse(result.subjects(), result.enqueued()));
  }
}
