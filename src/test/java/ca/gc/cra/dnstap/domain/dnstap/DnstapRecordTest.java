package ca.gc.cra.dnstap.domain.dnstap;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class DnstapRecordTest {

  @Test
  void absentFieldsAreEmpty() {
    DnstapRecord record = DnstapRecord.builder(MessageType.CLIENT_QUERY).build();
    assertEquals(0, record.identity().length);
    assertEquals(0, record.queryAddress().length);
    assertFalse(record.hasQueryMessage());
    assertFalse(record.hasResponseMessage());
    assertTrue(record.socketFamily().isEmpty());
    assertTrue(record.socketProtocol().isEmpty());
  }

  @Test
  void byteFieldsAreCopied() {
    byte[] address = {10, 0, 0, 1};
    DnstapRecord record = DnstapRecord.builder(MessageType.CLIENT_QUERY).queryAddress(address).build();
    address[0] = 99;
    assertArrayEquals(new byte[] {10, 0, 0, 1}, record.queryAddress());
    record.queryAddress()[1] = 42;
    assertArrayEquals(new byte[] {10, 0, 0, 1}, record.queryAddress());
  }

  @Test
  void rejectsMissingType() {
    assertThrows(NullPointerException.class, () -> DnstapRecord.builder(null).build());
  }

  @Test
  void rejectsOutOfRangePortsAndNanos() {
    assertThrows(IllegalArgumentException.class,
        () -> DnstapRecord.builder(MessageType.AUTH_QUERY).queryPort(65536).build());
    assertThrows(IllegalArgumentException.class,
        () -> DnstapRecord.builder(MessageType.AUTH_QUERY).responseTime(1L, 1_000_000_000).build());
  }
}
