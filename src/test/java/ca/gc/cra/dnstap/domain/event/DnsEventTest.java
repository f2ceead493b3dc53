package ca.gc.cra.dnstap.domain.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DnsEventTest {

  @Test
  void keepsInsertionOrderAndTypes() {
    DnsEvent event = DnsEvent.builder()
        .put("b", "text")
        .put("a", 7)
        .put("c", true)
        .put("d", 9L)
        .build();
    assertEquals(List.of("b", "a", "c", "d"), List.copyOf(event.fields().keySet()));
    assertEquals(Optional.of(7), event.get("a"));
    assertEquals(Optional.of(9L), event.get("d"));
    assertEquals(Optional.empty(), event.getString("a"));
    assertEquals(4, event.size());
  }

  @Test
  void fieldsAreUnmodifiable() {
    DnsEvent event = DnsEvent.builder().put("a", "x").build();
    assertThrows(UnsupportedOperationException.class, () -> event.fields().put("b", "y"));
  }

  @Test
  void replacingValueKeepsPosition() {
    DnsEvent event = DnsEvent.builder().put("a", "1").put("b", "2").put("a", "3").build();
    assertEquals(List.of("a", "b"), List.copyOf(event.fields().keySet()));
    assertTrue(event.contains("a"));
    assertEquals(Optional.of("3"), event.getString("a"));
  }
}
