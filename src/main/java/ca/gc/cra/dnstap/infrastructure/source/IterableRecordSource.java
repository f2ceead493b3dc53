package ca.gc.cra.dnstap.infrastructure.source;

import ca.gc.cra.dnstap.application.port.DnstapRecordSource;
import ca.gc.cra.dnstap.domain.dnstap.DnstapRecord;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Record source over an in-memory collection, for embedding callers that already hold decoded records.
 *
 * <p>Not thread-safe; the pipeline polls from a single thread.</p>
 *
 * @since 0.1.0
 */
public final class IterableRecordSource implements DnstapRecordSource {
  private final Iterable<DnstapRecord> records;
  private Iterator<DnstapRecord> iterator;
  private boolean closed;

  public IterableRecordSource(Iterable<DnstapRecord> records) {
    this.records = Objects.requireNonNull(records, "records");
  }

  public static IterableRecordSource of(DnstapRecord... records) {
    return new IterableRecordSource(List.of(records));
  }

  @Override
  public void start() {
    if (iterator != null) {
      throw new IllegalStateException("source already started");
    }
    iterator = records.iterator();
  }

  @Override
  public Optional<DnstapRecord> poll() {
    if (iterator == null) {
      throw new IllegalStateException("source not started");
    }
    if (closed || !iterator.hasNext()) {
      return Optional.empty();
    }
    return Optional.of(Objects.requireNonNull(iterator.next(), "record"));
  }

  @Override
  public boolean isExhausted() {
    return closed || (iterator != null && !iterator.hasNext());
  }

  @Override
  public void close() {
    closed = true;
  }
}
