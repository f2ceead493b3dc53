/**
 * Record source adapters.
 */
package ca.gc.cra.dnstap.infrastructure.source;
