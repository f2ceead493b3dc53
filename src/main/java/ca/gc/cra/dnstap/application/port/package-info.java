/**
 * Ports consumed by the dnstap event handler and pipeline: record sources, the DNS wire parser, publishers,
 * the error sink, and metrics.
 * <p><strong>Role:</strong> Application boundary; adapters live under {@code ca.gc.cra.dnstap.infrastructure}.</p>
 * <p><strong>Concurrency:</strong> Publisher, error sink, and metrics implementations must tolerate concurrent
 * callers.</p>
 */
package ca.gc.cra.dnstap.application.port;
