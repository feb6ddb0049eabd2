package io.intellixity.vellum.worker.site;

import io.intellixity.vellum.jobs.JobDispatcher;
import io.intellixity.vellum.jobs.JobTargetRegistry;
import io.intellixity.vellum.jobs.PendingJobs;
import io.intellixity.vellum.jobs.broker.BrokerConnection;
import io.intellixity.vellum.jobs.queue.QueueRegistry;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link JobDispatcher} per known site, created on first use.\n
 *
 * The acting user comes from {@link SiteContext}, else the configured default user.
 */
public final class SiteDispatchers {
  private final QueueRegistry queues;
  private final BrokerConnection broker;
  private final JobTargetRegistry targets;
  private final PendingJobs pending;
  private final Set<String> sites;
  private final String defaultSite;
  private final String defaultUser;
  private final Map<String, JobDispatcher> dispatchers = new ConcurrentHashMap<>();

  public SiteDispatchers(QueueRegistry queues,
                         BrokerConnection broker,
                         JobTargetRegistry targets,
                         PendingJobs pending,
                         Set<String> sites,
                         String defaultSite,
                         String defaultUser) {
    this.queues = Objects.requireNonNull(queues, "queues");
    this.broker = Objects.requireNonNull(broker, "broker");
    this.targets = Objects.requireNonNull(targets, "targets");
    this.pending = Objects.requireNonNull(pending, "pending");
    this.defaultSite = Objects.requireNonNull(defaultSite, "defaultSite");
    this.sites = Set.copyOf(sites);
    this.defaultUser = defaultUser;
  }

  public String defaultSite() { return defaultSite; }
  public PendingJobs pending() { return pending; }

  public boolean isKnown(String site) {
    return defaultSite.equals(site) || sites.contains(site);
  }

  public JobDispatcher forSite(String site) {
    if (!isKnown(site)) throw new IllegalArgumentException("Unknown site: " + site);
    return dispatchers.computeIfAbsent(site, s -> new JobDispatcher(queues, broker, targets, pending, s, this::currentUser));
  }

  /** Dispatcher of the bound site, or of the default site outside a request. */
  public JobDispatcher current() {
    SiteContext.Current c = SiteContext.currentOrNull();
    return forSite(c == null ? defaultSite : c.site());
  }

  private String currentUser() {
    SiteContext.Current c = SiteContext.currentOrNull();
    return c == null || c.user() == null ? defaultUser : c.user();
  }
}
