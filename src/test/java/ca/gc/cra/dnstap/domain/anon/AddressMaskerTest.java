package ca.gc.cra.dnstap.domain.anon;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.net.InetAddress;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class AddressMaskerTest {

  private static byte[] bytes(String literal) throws Exception {
    return InetAddress.getByName(literal).getAddress();
  }

  @Test
  void masksIpv4ToConfiguredPrefix() throws Exception {
    AddressMasker masker = new AddressMasker(24, 48);
    assertEquals(Optional.of("192.0.2.0"), masker.mask(bytes("192.0.2.55")));
  }

  @Test
  void masksIpv4OnNonOctetBoundary() throws Exception {
    AddressMasker masker = new AddressMasker(20, 48);
    assertEquals(Optional.of("10.1.16.0"), masker.mask(bytes("10.1.31.200")));
  }

  @Test
  void masksIpv6ToConfiguredPrefix() throws Exception {
    AddressMasker masker = new AddressMasker(24, 48);
    assertEquals(Optional.of("2001:db8:abcd::"), masker.mask(bytes("2001:db8:abcd:1234::1")));
  }

  @Test
  void fullPrefixKeepsAddress() throws Exception {
    AddressMasker masker = new AddressMasker(32, 128);
    assertEquals(Optional.of("198.51.100.7"), masker.mask(bytes("198.51.100.7")));
    assertEquals(Optional.of("2001:db8::7"), masker.mask(bytes("2001:db8::7")));
  }

  @Test
  void zeroPrefixClearsAddress() throws Exception {
    AddressMasker masker = new AddressMasker(0, 0);
    assertEquals(Optional.of("0.0.0.0"), masker.mask(bytes("203.0.113.9")));
    assertEquals(Optional.of("::"), masker.mask(bytes("2001:db8::1")));
  }

  @Test
  void maskingTwiceGivesSameAddress() throws Exception {
    AddressMasker masker = new AddressMasker(20, 44);
    for (String literal : new String[] {"10.1.31.200", "192.0.2.55", "2001:db8:abcd:1234::1", "fe80::1:2:3:4"}) {
      String once = masker.mask(bytes(literal)).orElseThrow();
      assertEquals(Optional.of(once), masker.mask(bytes(once)), literal);
    }
  }

  @Test
  void rejectsUnexpectedLengths() {
    AddressMasker masker = new AddressMasker(24, 48);
    assertEquals(Optional.empty(), masker.mask(null));
    assertEquals(Optional.empty(), masker.mask(new byte[0]));
    assertEquals(Optional.empty(), masker.mask(new byte[] {1, 2, 3}));
    assertEquals(Optional.empty(), masker.mask(new byte[8]));
  }

  @Test
  void doesNotModifyInput() throws Exception {
    byte[] address = bytes("192.0.2.55");
    new AddressMasker(8, 48).mask(address);
    assertEquals(55, address[3]);
  }

  @Test
  void rejectsOutOfRangePrefixes() {
    assertThrows(IllegalArgumentException.class, () -> new AddressMasker(33, 48));
    assertThrows(IllegalArgumentException.class, () -> new AddressMasker(24, 129));
    assertThrows(IllegalArgumentException.class, () -> new AddressMasker(-1, 48));
  }
}
