/**
 * Bounded, non-blocking delivery of per-record failures and the background logger that consumes them.
 */
package ca.gc.cra.dnstap.infrastructure.errors;
