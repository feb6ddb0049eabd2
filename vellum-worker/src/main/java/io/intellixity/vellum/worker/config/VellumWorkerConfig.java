package io.intellixity.vellum.worker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.vellum.jobs.DocumentMethodInvoker;
import io.intellixity.vellum.jobs.JobTargetRegistry;
import io.intellixity.vellum.jobs.PendingJobs;
import io.intellixity.vellum.jobs.Sleeper;
import io.intellixity.vellum.jobs.broker.BrokerConnection;
import io.intellixity.vellum.jobs.broker.BrokerSettings;
import io.intellixity.vellum.jobs.exec.JobExecutor;
import io.intellixity.vellum.jobs.exec.JobSessionFactory;
import io.intellixity.vellum.jobs.exec.RetryPolicy;
import io.intellixity.vellum.jobs.jdbc.JdbcBrokerFactory;
import io.intellixity.vellum.jobs.jdbc.JdbcDatabase;
import io.intellixity.vellum.jobs.jdbc.JdbcJobSessionFactory;
import io.intellixity.vellum.jobs.queue.QueueRegistry;
import io.intellixity.vellum.jobs.worker.JobWorker;
import io.intellixity.vellum.worker.runner.WorkerRunner;
import io.intellixity.vellum.worker.site.SiteDispatchers;
import io.intellixity.vellum.worker.web.SiteFilter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Configuration
@EnableConfigurationProperties(JobsProperties.class)
public class VellumWorkerConfig {
  /** Sleeps {@code s} seconds; handy for checking a worker end to end. */
  public static final String TEST_JOB = "vellum.jobs.test_job";

  @Bean
  public QueueRegistry queueRegistry(JobsProperties props) {
    return new QueueRegistry(props.getNamespace(), props.getQueues());
  }

  @Bean(destroyMethod = "close")
  public BrokerConnection brokerConnection(JobsProperties props, ObjectProvider<ObjectMapper> mapper) {
    JobsProperties.Broker b = props.getBroker();
    if (b.getJdbcUrl() == null || b.getJdbcUrl().isBlank()) {
      throw new IllegalStateException("vellum.jobs.broker.jdbc-url is required");
    }
    JdbcDatabase db = new JdbcDatabase(b.getJdbcUrl(), b.getUsername(), b.getPassword(), b.getMaximumPoolSize());
    JdbcBrokerFactory factory = new JdbcBrokerFactory(db, mapper.getIfAvailable(ObjectMapper::new), b.isCreateSchema());
    // Connects lazily, on the first enqueue or poll.
    return new BrokerConnection(factory, new BrokerSettings(b.getConnectAttempts(), b.getRetryWait()), Sleeper.system());
  }

  @Bean(destroyMethod = "close")
  public JdbcJobSessionFactory jobSessionFactory(JobsProperties props) {
    Map<String, JdbcDatabase> sites = new HashMap<>();
    props.getSites().forEach((site, db) ->
        sites.put(site, new JdbcDatabase(db.getJdbcUrl(), db.getUsername(), db.getPassword(), db.getMaximumPoolSize())));
    return JdbcJobSessionFactory.hikari(sites);
  }

  @Bean
  public JobTargetDefinition testJob() {
    return new JobTargetDefinition(TEST_JOB, kwargs -> {
      Object s = kwargs.get("s");
      long seconds = s == null ? 0 : Long.parseLong(s.toString());
      Sleeper.system().sleep(Duration.ofSeconds(seconds));
      return null;
    });
  }

  @Bean
  public JobTargetRegistry jobTargetRegistry(List<JobTargetDefinition> definitions,
                                             ObjectProvider<DocumentMethodInvoker> documents) {
    JobTargetRegistry.Builder b = JobTargetRegistry.builder();
    for (JobTargetDefinition d : definitions) b.register(d.method(), d.target());
    DocumentMethodInvoker invoker = documents.getIfAvailable();
    if (invoker != null) b.documentMethods(invoker);
    return b.build();
  }

  @Bean
  public PendingJobs pendingJobs(BrokerConnection broker) {
    return new PendingJobs(broker);
  }

  @Bean
  public SiteDispatchers siteDispatchers(JobsProperties props,
                                         QueueRegistry queues,
                                         BrokerConnection broker,
                                         JobTargetRegistry targets,
                                         PendingJobs pending) {
    return new SiteDispatchers(queues, broker, targets, pending, props.getSites().keySet(), props.getSite(), props.getDefaultUser());
  }

  @Bean
  public SiteFilter siteFilter(SiteDispatchers dispatchers) {
    return new SiteFilter(dispatchers);
  }

  @Bean
  public JobExecutor jobExecutor(JobTargetRegistry targets, JobSessionFactory sessions, JobsProperties props) {
    return new JobExecutor(targets, sessions, new RetryPolicy(props.getRetry().getMaxRetries()), Sleeper.system());
  }

  @Bean
  public JobWorker jobWorker(BrokerConnection broker, QueueRegistry queues, JobExecutor executor, JobsProperties props) {
    JobsProperties.Worker w = props.getWorker();
    return new JobWorker(broker, queues, w.getQueues(), executor, w.getPollInterval(), w.isBurst(), Sleeper.system());
  }

  @Bean
  public WorkerRunner workerRunner(JobWorker worker, JobsProperties props) {
    return new WorkerRunner(worker, props.getWorker().isEnabled(), Duration.ofSeconds(30));
  }
}
