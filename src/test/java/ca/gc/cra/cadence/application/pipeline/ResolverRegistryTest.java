package ca.gc.cra.cadence.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.cadence.application.query.TrackQuery;
import ca.gc.cra.cadence.testutil.ScriptedResolver;
import java.util.List;
import org.junit.jupiter.api.Test;

class ResolverRegistryTest {
  private final ResolverRegistry registry = new ResolverRegistry();

  @Test
  void picksHighestWeightNotYetTried() {
    ScriptedResolver low = new ScriptedResolver("low", 5);
    ScriptedResolver high = new ScriptedResolver("high", 50);
    ScriptedResolver mid = new ScriptedResolver("mid", 20);
    registry.register(low);
    registry.register(high);
    registry.register(mid);
    TrackQuery query = TrackQuery.of("Artist", "Track", null);

    assertSame(high, registry.nextResolver(query));
    query.setCurrentResolver(high);
    assertSame(mid, registry.nextResolver(query));
    query.setCurrentResolver(mid);
    assertSame(low, registry.nextResolver(query));
    query.setCurrentResolver(low);
    assertNull(registry.nextResolver(query));
  }

  @Test
  void equalWeightsKeepRegistrationOrder() {
    ScriptedResolver first = new ScriptedResolver("first", 10);
    ScriptedResolver second = new ScriptedResolver("second", 10);
    registry.register(first);
    registry.register(second);

    assertSame(first, registry.nextResolver(TrackQuery.of("Artist", "Track", null)));
  }

  @Test
  void registrationIsByIdentity() {
    ScriptedResolver resolver = new ScriptedResolver("only", 10);
    ScriptedResolver twin = new ScriptedResolver("only", 10);

    assertTrue(registry.register(resolver));
    assertFalse(registry.register(resolver));
    assertTrue(registry.register(twin));
    assertEquals(2, registry.size());

    assertTrue(registry.unregister(resolver));
    assertFalse(registry.unregister(resolver));
    assertEquals(List.of(twin), registry.snapshot());
  }

  @Test
  void emptyRegistryHasNoCandidate() {
    assertNull(registry.nextResolver(TrackQuery.fullText("anything")));
    assertEquals(0, registry.size());
  }
}
