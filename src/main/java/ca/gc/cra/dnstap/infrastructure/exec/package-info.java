/**
 * Executor construction for handler workers.
 */
package ca.gc.cra.dnstap.infrastructure.exec;
