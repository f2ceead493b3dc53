package ca.gc.cra.dnstap.application.port;

import ca.gc.cra.dnstap.domain.dnstap.DnstapRecord;
import java.util.Optional;

/**
 * <strong>What:</strong> Port that supplies decoded dnstap records to the processing pipeline.
 * <ul>
 *   <li>Open and close the underlying transport.</li>
 *   <li>Poll for new records with bounded blocking semantics.</li>
 *   <li>Signal exhaustion so the pipeline can shut down.</li>
 * </ul>
 *
 * @implNote Callers invoke {@link #start()} before polling and always call {@link #close()}.
 * @since 0.1.0
 */
public interface DnstapRecordSource extends AutoCloseable {
  /**
   * Opens the source.
   *
   * @throws Exception if the transport cannot be opened
   */
  void start() throws Exception;

  /**
   * Retrieves the next record when available.
   *
   * @return record, or empty when none is currently available or the source is exhausted
   * @throws Exception if the transport fails
   */
  Optional<DnstapRecord> poll() throws Exception;

  /**
   * Indicates whether the source will deliver no further records.
   *
   * @return {@code true} once drained
   */
  default boolean isExhausted() {
    return false;
  }

  @Override
  void close() throws Exception;
}
