package ca.gc.cra.cadence.config;

import ca.gc.cra.cadence.infrastructure.resolver.CatalogEntry;
import ca.gc.cra.cadence.validation.Strings;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Catalog resolver as declared in a catalog file.
 *
 * @param name resolver name; must not be blank
 * @param weight selection priority
 * @param timeout attempt timeout; zero disables it
 * @param latency answer delay
 * @param entries tracks the resolver knows
 * @since 0.1.0
 */
public record ResolverDefinition(
    String name, int weight, Duration timeout, Duration latency, List<CatalogEntry> entries) {
  /**
   * Validates the definition.
   */
  public ResolverDefinition {
    name = Strings.requireNonBlank("name", name);
    Objects.requireNonNull(timeout, "timeout");
    Objects.requireNonNull(latency, "latency");
    if (timeout.isNegative() || latency.isNegative()) {
      throw new IllegalArgumentException("resolver " + name + " timeout and latency must not be negative");
    }
    entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
  }
}
