package ca.gc.cra.dnstap.infrastructure.publish;

import ca.gc.cra.dnstap.application.port.EventPublisher;
import ca.gc.cra.dnstap.domain.event.DnsEvent;
import ca.gc.cra.dnstap.validation.Strings;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * Publishes events to a Fluentd {@code in_http} input by POSTing each JSON event to {@code <endpoint>/<tag>}.
 *
 * <p>Thread-safe; {@link HttpClient} is shared across callers. Each post is a synchronous request bounded by the
 * configured timeout, and any non-2xx status is a failure.</p>
 *
 * @since 0.1.0
 */
public final class FluentdHttpEventPublisher implements EventPublisher {
  private final HttpClient client;
  private final URI endpoint;
  private final Duration timeout;
  private final EventJsonEncoder encoder;

  /**
   * Creates a publisher with a dedicated HTTP/1.1 client.
   *
   * @param endpoint base URI of the Fluentd HTTP input, without trailing slash
   * @param timeout connect and request timeout
   */
  public FluentdHttpEventPublisher(URI endpoint, Duration timeout) {
    this(HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NEVER)
            .connectTimeout(Objects.requireNonNull(timeout, "timeout"))
            .version(HttpClient.Version.HTTP_1_1)
            .build(),
        endpoint,
        timeout,
        new EventJsonEncoder());
  }

  FluentdHttpEventPublisher(HttpClient client, URI endpoint, Duration timeout, EventJsonEncoder encoder) {
    this.client = Objects.requireNonNull(client, "client");
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    this.encoder = Objects.requireNonNull(encoder, "encoder");
  }

  @Override
  public void post(String tag, DnsEvent event) throws IOException {
    String sanitizedTag = Strings.sanitizeTag("tag", tag);
    Objects.requireNonNull(event, "event");
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(endpoint + "/" + sanitizedTag))
        .timeout(timeout)
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofByteArray(encoder.encode(event)))
        .build();
    HttpResponse<Void> response;
    try {
      response = client.send(request, HttpResponse.BodyHandlers.discarding());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted while posting to Fluentd tag " + sanitizedTag, ex);
    }
    int status = response.statusCode();
    if (status < 200 || status > 299) {
      throw new IOException("Fluentd rejected event for tag " + sanitizedTag + " with HTTP " + status);
    }
  }
}
