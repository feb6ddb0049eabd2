package io.intellixity.vellum.worker.web;

import io.intellixity.vellum.worker.site.SiteContext;
import io.intellixity.vellum.worker.site.SiteDispatchers;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Objects;

/**
 * Binds the request's site and user, and acts as the transaction boundary for jobs deferred
 * until commit: flushed when the request completes with a success status, discarded when it
 * throws or ends with an error status (including one written by an exception handler).
 */
public final class SiteFilter extends OncePerRequestFilter {
  public static final String SITE_HEADER = "X-Vellum-Site";
  public static final String USER_HEADER = "X-Vellum-User";

  private final SiteDispatchers dispatchers;

  public SiteFilter(SiteDispatchers dispatchers) {
    this.dispatchers = Objects.requireNonNull(dispatchers, "dispatchers");
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request,
                                  HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    String site = request.getHeader(SITE_HEADER);
    site = site == null || site.isBlank() ? dispatchers.defaultSite() : site.trim();
    if (!dispatchers.isKnown(site)) {
      response.sendError(400, "Unknown site: " + site);
      return;
    }
    String user = request.getHeader(USER_HEADER);
    if (user != null) user = user.isBlank() ? null : user.trim();

    try {
      SiteContext.inContext(new SiteContext.Current(site, user), () -> {
        try {
          filterChain.doFilter(request, response);
        } catch (Exception e) {
          throw new RuntimeException(e);
        }
        return null;
      });
      if (response.getStatus() >= 400) {
        dispatchers.pending().discard();
      } else {
        dispatchers.pending().flush();
      }
    } catch (RuntimeException e) {
      dispatchers.pending().discard();
      Throwable c = e.getCause();
      if (c instanceof IOException ioe) throw ioe;
      if (c instanceof ServletException se) throw se;
      throw e;
    }
  }
}
