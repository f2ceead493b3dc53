/**
 * OpenTelemetry implementation of {@link ca.gc.cra.dnstap.application.port.MetricsPort}.
 */
package ca.gc.cra.dnstap.infrastructure.metrics;
