package io.intellixity.vellum.jobs.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

/** Worker names: {@code <uuid>.<hostname>.<pid>}, plus {@code .<queue>} for single-queue workers. */
public final class WorkerNames {
  private static final Logger log = LoggerFactory.getLogger(WorkerNames.class);

  private WorkerNames() {}

  public static String create(String qname) {
    String base = UUID.randomUUID().toString().replace("-", "") + "." + hostname() + "." + ProcessHandle.current().pid();
    return qname == null || qname.isBlank() ? base : base + "." + qname;
  }

  static String hostname() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      log.debug("vellum.jobs.worker hostname lookup failed, using 'localhost'", e);
      return "localhost";
    }
  }
}
