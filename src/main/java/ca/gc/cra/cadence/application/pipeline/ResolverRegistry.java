package ca.gc.cra.cadence.application.pipeline;

import ca.gc.cra.cadence.application.port.Query;
import ca.gc.cra.cadence.application.port.Resolver;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Registered resolvers in registration order, plus the selection rule for a query's next attempt.
 * <p>Not thread-safe; confined to the pipeline dispatcher thread, which serializes every access.</p>
 *
 * @since 0.1.0
 */
final class ResolverRegistry {
  private final List<Resolver> resolvers = new ArrayList<>();

  /**
   * Registers a resolver unless the same instance is already registered.
   *
   * @param resolver resolver to add
   * @return {@code true} if the registry changed
   */
  boolean register(Resolver resolver) {
    Objects.requireNonNull(resolver, "resolver");
    if (contains(resolver)) {
      return false;
    }
    resolvers.add(resolver);
    return true;
  }

  /**
   * Removes a resolver.
   *
   * @param resolver resolver to remove
   * @return {@code true} if the resolver was registered
   */
  boolean unregister(Resolver resolver) {
    return resolvers.removeIf(candidate -> candidate == resolver);
  }

  int size() {
    return resolvers.size();
  }

  List<Resolver> snapshot() {
    return List.copyOf(resolvers);
  }

  /**
   * Picks the highest-weighted resolver the query has not been dispatched to yet. On equal weights the resolver
   * registered first wins.
   *
   * @param query query being dispatched
   * @return next resolver, or {@code null} when every registered resolver was already tried
   */
  Resolver nextResolver(Query query) {
    Set<Resolver> tried = query.resolvedBy();
    Resolver best = null;
    for (Resolver candidate : resolvers) {
      if (tried.contains(candidate)) {
        continue;
      }
      if (best == null || candidate.weight() > best.weight()) {
        best = candidate;
      }
    }
    return best;
  }

  private boolean contains(Resolver resolver) {
    for (Resolver candidate : resolvers) {
      if (candidate == resolver) {
        return true;
      }
    }
    return false;
  }
}
