package ca.gc.cra.portalwatch.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
  }

  @Test
  void requireNonBlankRejectsBlank() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("iface", "   "));
  }

  @Test
  void requirePrintableAsciiRejectsNonAscii() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("iface", "w\u2603n", 16));
  }

  @Test
  void requirePrintableAsciiRejectsExcessLength() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("iface", "abc", 2));
  }

  @Test
  void splitListTrimsAndDropsEmptyEntries() {
    assertEquals(List.of("a", "b"), Strings.splitList("dns", " a ,,b, "));
    assertEquals(List.of(), Strings.splitList("dns", null));
  }
}
