package ca.gc.cra.dnstap.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeAcceptsBounds() {
    assertEquals(0, Numbers.requireRange("ipv4Mask", 0, 0, 32));
    assertEquals(32, Numbers.requireRange("ipv4Mask", 32, 0, 32));
  }

  @Test
  void requireRangeNamesParameter() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("ipv6Mask", 129, 0, 128));
    assertTrue(ex.getMessage().startsWith("ipv6Mask"));
  }

  @Test
  void parseIntInRangeTrimsAndParses() {
    assertEquals(48, Numbers.parseIntInRange("ipv6Mask", " 48 ", 0, 128));
  }

  @Test
  void parseIntInRangeRejectsNonNumeric() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseIntInRange("workers", "four", 1, 256));
  }
}
