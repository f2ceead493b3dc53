/**
 * Runtime logging level control for the Logback backend.
 */
package ca.gc.cra.dnstap.logging;
