package ca.gc.cra.portalwatch.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(10, Numbers.requireRange("maxAttempts", 10, 0, 64));
  }

  @Test
  void requireRangeRejectsValuesOutsideBounds() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("maxAttempts", -1, 0, 64));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("maxAttempts", 65, 0, 64));
  }

  @Test
  void parseInRangeTrimsInput() {
    assertEquals(3000L, Numbers.parseInRange("backoffInitialMs", " 3000 ", 1, 86_400_000));
  }

  @Test
  void parseInRangeRejectsNonNumeric() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class, () -> Numbers.parseInRange("probeTimeoutMs", "10s", 1, 600_000));
    assertEquals("probeTimeoutMs must be numeric (was 10s)", ex.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInRange("probeTimeoutMs", "", 1, 600_000));
  }
}
