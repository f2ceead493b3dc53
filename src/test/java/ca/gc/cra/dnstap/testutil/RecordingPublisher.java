package ca.gc.cra.dnstap.testutil;

import ca.gc.cra.dnstap.application.port.EventPublisher;
import ca.gc.cra.dnstap.domain.event.DnsEvent;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Publisher that records every post and can be told to fail. */
public final class RecordingPublisher implements EventPublisher {
  private final List<Post> posts = new CopyOnWriteArrayList<>();
  private volatile IOException failure;
  private volatile boolean closed;

  public void failWith(IOException failure) {
    this.failure = failure;
  }

  @Override
  public void post(String tag, DnsEvent event) throws IOException {
    IOException current = failure;
    if (current != null) {
      throw current;
    }
    posts.add(new Post(tag, event));
  }

  @Override
  public void close() {
    closed = true;
  }

  public List<Post> posts() {
    return posts;
  }

  public boolean isClosed() {
    return closed;
  }

  public record Post(String tag, DnsEvent event) {}
}
