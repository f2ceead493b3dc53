/**
 * Drivers that feed decoded dnstap records to the event handler.
 */
package ca.gc.cra.dnstap.application.pipeline;
