package io.intellixity.vellum.worker.web;

import io.intellixity.vellum.jobs.EnqueueRequest;
import io.intellixity.vellum.jobs.EnqueueResult;
import io.intellixity.vellum.jobs.broker.BrokerConnection;
import io.intellixity.vellum.jobs.broker.JobStatus;
import io.intellixity.vellum.worker.site.SiteDispatchers;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/jobs")
public final class JobsController {
  private final SiteDispatchers dispatchers;
  private final BrokerConnection broker;

  public JobsController(SiteDispatchers dispatchers, BrokerConnection broker) {
    this.dispatchers = dispatchers;
    this.broker = broker;
  }

  public record EnqueueJobRequest(String method,
                                  String queue,
                                  Integer timeout,
                                  String event,
                                  String jobName,
                                  boolean now,
                                  boolean atFront,
                                  boolean deferUntilCommit,
                                  Map<String, Object> kwargs) {}

  public record EnqueueJobResponse(String outcome, String jobId, String jobName, String queue, Object result) {}

  public record DocumentJobRequest(String entityType, String name, String docMethod, Map<String, Object> kwargs) {}

  @PostMapping
  public EnqueueJobResponse enqueue(@RequestBody EnqueueJobRequest req) {
    if (req.method() == null || req.method().isBlank()) throw new IllegalArgumentException("method is required");
    EnqueueRequest r = EnqueueRequest.of(req.method())
        .withTimeoutSeconds(req.timeout())
        .withEvent(req.event())
        .withJobName(req.jobName())
        .withNow(req.now())
        .withAtFront(req.atFront())
        .withDeferUntilCommit(req.deferUntilCommit())
        .withKwargs(req.kwargs());
    if (req.queue() != null && !req.queue().isBlank()) r.withQueue(req.queue());
    return response(dispatchers.current().enqueue(r));
  }

  @PostMapping("/document")
  public EnqueueJobResponse enqueueForDocument(@RequestBody DocumentJobRequest req) {
    if (req.entityType() == null || req.docMethod() == null) {
      throw new IllegalArgumentException("entityType and docMethod are required");
    }
    return response(dispatchers.current().enqueueForDocument(req.entityType(), req.name(), req.docMethod(), req.kwargs()));
  }

  @GetMapping
  public Map<String, List<Object>> list(@RequestParam(value = "site", required = false) String site,
                                        @RequestParam(value = "queue", required = false) String queue,
                                        @RequestParam(value = "key", required = false) String key) {
    return dispatchers.current().listJobs(site, queue, key);
  }

  @GetMapping("/queued/{jobName}")
  public boolean isQueued(@PathVariable("jobName") String jobName) {
    return dispatchers.current().isJobQueued(jobName);
  }

  @GetMapping("/{id}/status")
  public ResponseEntity<JobStatus> status(@PathVariable("id") String id) {
    return broker.get().status(id).map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.notFound().build());
  }

  @PostMapping("/{id}/stop")
  public ResponseEntity<Void> stop(@PathVariable("id") String id) {
    broker.get().requestStop(id);
    return ResponseEntity.accepted().build();
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
    return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
  }

  private static EnqueueJobResponse response(EnqueueResult r) {
    if (r.job() == null) return new EnqueueJobResponse(r.outcome().name(), null, null, null, r.result());
    return new EnqueueJobResponse(r.outcome().name(), r.job().id(), r.job().jobName(), r.job().queue(), null);
  }
}
