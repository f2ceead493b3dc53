package ca.gc.cra.dnstap.infrastructure.publish;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.dnstap.domain.event.DnsEvent;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileEventPublisherTest {

  @TempDir Path tempDir;

  @Test
  void appendsOneLinePerEventPerTag() throws Exception {
    Path out = tempDir.resolve("events");
    try (FileEventPublisher publisher = new FileEventPublisher(out)) {
      publisher.post("dnstap.full", DnsEvent.builder().put("qname", "a.example.").build());
      publisher.post("dnstap.full", DnsEvent.builder().put("qname", "b.example.").build());
      publisher.post("other", DnsEvent.builder().put("query_port", 53).build());
    }

    assertEquals(
        List.of("{\"qname\":\"a.example.\"}", "{\"qname\":\"b.example.\"}"),
        Files.readAllLines(out.resolve("dnstap.full.ndjson"), StandardCharsets.UTF_8));
    assertEquals(
        List.of("{\"query_port\":53}"),
        Files.readAllLines(out.resolve("other.ndjson"), StandardCharsets.UTF_8));
  }

  @Test
  void reopeningAppendsToExistingFile() throws Exception {
    try (FileEventPublisher publisher = new FileEventPublisher(tempDir)) {
      publisher.post("t", DnsEvent.builder().put("n", 1).build());
    }
    try (FileEventPublisher publisher = new FileEventPublisher(tempDir)) {
      publisher.post("t", DnsEvent.builder().put("n", 2).build());
    }

    assertEquals(List.of("{\"n\":1}", "{\"n\":2}"), Files.readAllLines(tempDir.resolve("t.ndjson")));
  }

  @Test
  void postAfterCloseFails() throws Exception {
    FileEventPublisher publisher = new FileEventPublisher(tempDir);
    publisher.close();

    assertThrows(IOException.class, () -> publisher.post("t", DnsEvent.builder().put("n", 1).build()));
  }

  @Test
  void rejectsTagThatEscapesDirectory() {
    FileEventPublisher publisher = new FileEventPublisher(tempDir);

    assertThrows(IllegalArgumentException.class,
        () -> publisher.post("../escape", DnsEvent.builder().put("n", 1).build()));
  }
}
