/**
 * Structured DNS events: the ordered field map handed to publishers and its field names.
 */
package ca.gc.cra.dnstap.domain.event;
