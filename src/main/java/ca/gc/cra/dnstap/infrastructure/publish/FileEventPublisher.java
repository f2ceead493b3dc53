package ca.gc.cra.dnstap.infrastructure.publish;

import ca.gc.cra.dnstap.application.port.EventPublisher;
import ca.gc.cra.dnstap.domain.event.DnsEvent;
import ca.gc.cra.dnstap.validation.Strings;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Appends events as newline-delimited JSON to {@code <directory>/<tag>.ndjson}.
 * <p>Synchronized so lines from concurrent workers never interleave. Writers are opened lazily per tag and
 * flushed after every line.</p>
 *
 * @since 0.1.0
 */
public final class FileEventPublisher implements EventPublisher {
  private final Path outputDirectory;
  private final EventJsonEncoder encoder;
  private final Map<String, BufferedWriter> writers = new HashMap<>();
  private boolean closed;

  /**
   * Creates a file-backed publisher.
   *
   * @param outputDirectory directory receiving one NDJSON file per tag; created when missing
   */
  public FileEventPublisher(Path outputDirectory) {
    this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
    this.encoder = new EventJsonEncoder();
  }

  @Override
  public synchronized void post(String tag, DnsEvent event) throws IOException {
    String sanitizedTag = Strings.sanitizeTag("tag", tag);
    Objects.requireNonNull(event, "event");
    if (closed) {
      throw new IOException("publisher is closed");
    }
    BufferedWriter writer = writers.get(sanitizedTag);
    if (writer == null) {
      Files.createDirectories(outputDirectory);
      writer = Files.newBufferedWriter(
          outputDirectory.resolve(sanitizedTag + ".ndjson"),
          StandardCharsets.UTF_8,
          StandardOpenOption.CREATE,
          StandardOpenOption.APPEND);
      writers.put(sanitizedTag, writer);
    }
    writer.write(encoder.encodeToString(event));
    writer.newLine();
    writer.flush();
  }

  @Override
  public synchronized void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    IOException failure = null;
    for (BufferedWriter writer : writers.values()) {
      try {
        writer.close();
      } catch (IOException ex) {
        if (failure == null) {
          failure = ex;
        } else {
          failure.addSuppressed(ex);
        }
      }
    }
    writers.clear();
    if (failure != null) {
      throw failure;
    }
  }
}
