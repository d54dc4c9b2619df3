package com.codeheadsystems.relay.server.registry;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides which browser origins may open connections.
 * <p>
 * Requests that carry no {@code Origin} header come from non-browser clients and are not
 * subject to the policy.
 */
@FunctionalInterface
public interface OriginPolicy {

  /**
   * Whether the origin may connect.
   *
   * @param origin the {@code Origin} header value
   * @return true if allowed
   */
  boolean allows(String origin);

  /**
   * Policy accepting every origin.
   *
   * @return the policy
   */
  static OriginPolicy allowAll() {
    return origin -> true;
  }

  /**
   * Policy accepting only the listed origins, compared case-insensitively.
   *
   * @param origins allowed origins, e.g. {@code http://localhost:8080}
   * @return the policy
   */
  static OriginPolicy allowOnly(final Collection<String> origins) {
    Set<String> allowed = origins.stream()
        .map(o -> o.toLowerCase(Locale.ROOT))
        .collect(Collectors.toUnmodifiableSet());
    return origin -> origin != null && allowed.contains(origin.toLowerCase(Locale.ROOT));
  }

  /**
   * Builds the policy for a configured origin list; an empty list allows every origin.
   *
   * @param origins configured origins
   * @return the policy
   */
  static OriginPolicy of(final Collection<String> origins) {
    return origins == null || origins.isEmpty() ? allowAll() : allowOnly(origins);
  }
}
