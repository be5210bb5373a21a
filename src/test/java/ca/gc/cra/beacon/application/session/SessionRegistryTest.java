package ca.gc.cra.beacon.application.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SessionRegistryTest {
  private final SessionRegistry registry = new SessionRegistry(new RecordingSessionHost());

  @Test
  void mainSessionAlwaysExists() {
    assertEquals(SessionRegistry.MAIN, registry.main().name());
    assertSame(registry.main(), registry.get("Main"));
    assertFalse(registry.delete("Main"));
    assertTrue(registry.find("Main").isPresent());
  }

  @Test
  void getCreatesOnceAndReturnsSameInstance() {
    Session first = registry.get("Billing");

    assertSame(first, registry.get("Billing"));
    assertEquals(Set.of("Billing", "Main"), registry.names());
  }

  @Test
  void namesAreSorted() {
    registry.get("zeta");
    registry.get("Alpha");

    assertEquals(List.of("Alpha", "Main", "zeta"), List.copyOf(registry.names()));
  }

  @Test
  void deleteForgetsSession() {
    registry.get("Temp");

    assertTrue(registry.delete("Temp"));
    assertFalse(registry.delete("Temp"));
    assertTrue(registry.find("Temp").isEmpty());
    assertFalse(registry.find(null).isPresent());
  }

  @Test
  void blankNamesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> registry.get("  "));
  }
}
