package io.intellixity.vellum.jobs.broker;

import io.intellixity.vellum.jobs.JobDescriptor;

import java.util.List;
import java.util.Optional;

/**
 * Message broker holding physical queues of job descriptors.\n
 *
 * Within one queue jobs are handed out FIFO (jobs pushed {@code atFront} first). Nothing is
 * promised across queues. Every operation may throw {@link BrokerUnavailableException}.
 */
public interface QueueBroker extends AutoCloseable {

  void push(String qname, JobDescriptor job, boolean atFront);

  /** Claims the oldest job of the first non-empty queue, in the given order, and marks it running. */
  Optional<JobDescriptor> poll(List<String> qnames);

  /** Waiting jobs, oldest first. */
  List<JobDescriptor> queued(String qname);

  /** Claimed but not yet finished or failed. */
  List<JobDescriptor> running(String qname);

  Optional<JobStatus> status(String jobId);

  void markFinished(String jobId);

  void markFailed(String jobId, String error);

  /** Asks the worker running {@code jobId} to terminate it. No-op for unknown ids. */
  void requestStop(String jobId);

  boolean isStopRequested(String jobId);

  @Override
  void close();
}
