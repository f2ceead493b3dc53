/**
 * Publisher adapters for {@link ca.gc.cra.dnstap.application.port.EventPublisher}: Kafka, Fluentd HTTP,
 * NDJSON files, and the application log.
 * <p><strong>Concurrency:</strong> Every adapter accepts concurrent posts from handler workers.</p>
 * <p><strong>Serialization:</strong> All adapters share {@link ca.gc.cra.dnstap.infrastructure.publish.EventJsonEncoder}
 * so field order and types are identical on every sink.</p>
 */
package ca.gc.cra.dnstap.infrastructure.publish;
