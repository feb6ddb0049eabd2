package io.intellixity.vellum.worker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "vellum.jobs")
public class JobsProperties {
  /** Site used when a request names none. */
  private String site = "default";
  /** Queue namespace shared by every site of this deployment. */
  private String namespace = "vellum";
  private String defaultUser = "Administrator";
  private final Broker broker = new Broker();
  /** Custom queues and their timeouts in seconds. */
  private final Map<String, Integer> queues = new LinkedHashMap<>();
  private final Retry retry = new Retry();
  private final Worker worker = new Worker();
  private final Map<String, SiteDb> sites = new HashMap<>();

  public String getSite() { return site; }
  public void setSite(String site) { this.site = site; }
  public String getNamespace() { return namespace; }
  public void setNamespace(String namespace) { this.namespace = namespace; }
  public String getDefaultUser() { return defaultUser; }
  public void setDefaultUser(String defaultUser) { this.defaultUser = defaultUser; }
  public Broker getBroker() { return broker; }
  public Map<String, Integer> getQueues() { return queues; }
  public Retry getRetry() { return retry; }
  public Worker getWorker() { return worker; }
  public Map<String, SiteDb> getSites() { return sites; }

  public static class Broker {
    private String jdbcUrl;
    private String username;
    private String password;
    private int maximumPoolSize = 5;
    private int connectAttempts = 10;
    private Duration retryWait = Duration.ofSeconds(1);
    private boolean createSchema = true;

    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public int getMaximumPoolSize() { return maximumPoolSize; }
    public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
    public int getConnectAttempts() { return connectAttempts; }
    public void setConnectAttempts(int connectAttempts) { this.connectAttempts = connectAttempts; }
    public Duration getRetryWait() { return retryWait; }
    public void setRetryWait(Duration retryWait) { this.retryWait = retryWait; }
    public boolean isCreateSchema() { return createSchema; }
    public void setCreateSchema(boolean createSchema) { this.createSchema = createSchema; }
  }

  public static class Retry {
    private int maxRetries = 5;

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
  }

  public static class Worker {
    private boolean enabled = true;
    /** Queues polled in this order; empty means every recognised queue. */
    private List<String> queues = new ArrayList<>();
    private Duration pollInterval = Duration.ofSeconds(1);
    /** Exit once every queue is empty. */
    private boolean burst;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public List<String> getQueues() { return queues; }
    public void setQueues(List<String> queues) { this.queues = queues; }
    public Duration getPollInterval() { return pollInterval; }
    public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
    public boolean isBurst() { return burst; }
    public void setBurst(boolean burst) { this.burst = burst; }
  }

  public static class SiteDb {
    private String jdbcUrl;
    private String username;
    private String password;
    private int maximumPoolSize = 10;

    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public int getMaximumPoolSize() { return maximumPoolSize; }
    public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
  }
}
