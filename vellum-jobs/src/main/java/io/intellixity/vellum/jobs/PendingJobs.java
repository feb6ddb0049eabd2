package io.intellixity.vellum.jobs;

import io.intellixity.vellum.jobs.broker.BrokerConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Jobs held back until the caller's transaction commits.\n
 *
 * The buffer is per thread: the host's commit hook calls {@link #flush()}, its rollback hook
 * {@link #discard()}.
 */
public final class PendingJobs {
  private static final Logger log = LoggerFactory.getLogger(PendingJobs.class);

  public record Entry(String qname, JobDescriptor job, boolean atFront) {}

  private final BrokerConnection broker;
  private final ThreadLocal<List<Entry>> buffer = ThreadLocal.withInitial(ArrayList::new);

  public PendingJobs(BrokerConnection broker) {
    this.broker = Objects.requireNonNull(broker, "broker");
  }

  void add(Entry entry) {
    buffer.get().add(Objects.requireNonNull(entry, "entry"));
  }

  /** Buffered entries of the current thread, oldest first. */
  public List<Entry> entries() {
    return List.copyOf(buffer.get());
  }

  /** Pushes every buffered job in order and empties the buffer. Returns the number pushed. */
  public int flush() {
    List<Entry> entries = buffer.get();
    try {
      for (Entry e : entries) {
        broker.get().push(e.qname(), e.job(), e.atFront());
      }
      if (!entries.isEmpty()) log.debug("vellum.jobs.pending flushed={}", entries.size());
      return entries.size();
    } finally {
      buffer.remove();
    }
  }

  public int discard() {
    int n = buffer.get().size();
    buffer.remove();
    if (n > 0) log.debug("vellum.jobs.pending discarded={}", n);
    return n;
  }
}
