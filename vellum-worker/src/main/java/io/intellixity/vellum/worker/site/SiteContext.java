package io.intellixity.vellum.worker.site;

import java.util.Objects;
import java.util.function.Supplier;

/** Site and acting user bound to the current request thread. */
public final class SiteContext {
  private SiteContext() {}

  public record Current(String site, String user) {
    public Current {
      Objects.requireNonNull(site, "site");
    }
  }

  private static final ThreadLocal<Current> CURRENT = new ThreadLocal<>();

  /** Runs {@code work} with {@code current} bound; the previous binding is restored afterwards. */
  public static <T> T inContext(Current current, Supplier<T> work) {
    Objects.requireNonNull(current, "current");
    Objects.requireNonNull(work, "work");
    Current previous = CURRENT.get();
    CURRENT.set(current);
    try {
      return work.get();
    } finally {
      if (previous == null) CURRENT.remove(); else CURRENT.set(previous);
    }
  }

  public static Current currentOrNull() {
    return CURRENT.get();
  }

  public static Current currentOrThrow() {
    Current c = currentOrNull();
    if (c == null) throw new IllegalStateException("No site bound in current scope");
    return c;
  }
}
